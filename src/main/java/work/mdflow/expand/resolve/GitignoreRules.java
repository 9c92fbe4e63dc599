package work.mdflow.expand.resolve;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.eclipse.jgit.ignore.FastIgnoreRule;
import org.eclipse.jgit.ignore.IgnoreNode;

/**
 * Ignore rules for glob imports: a fixed base set plus every {@code .gitignore} from the start
 * directory up to the enclosing repository root. Rules from deeper directories take precedence.
 */
final class GitignoreRules {
    static final List<String> ALWAYS_IGNORED = List.of(".git", "node_modules", ".DS_Store", "*.log");

    private final IgnoreNode node;

    private GitignoreRules(IgnoreNode node) {
        this.node = node;
    }

    static GitignoreRules collect(Path startDirectory) throws IOException {
        Deque<List<String>> perDirectory = new ArrayDeque<>();
        Path current = startDirectory.toAbsolutePath().normalize();
        while (current != null) {
            Path gitignore = current.resolve(".gitignore");
            if (Files.isRegularFile(gitignore)) {
                List<String> lines = new ArrayList<>();
                for (String line : Files.readAllLines(gitignore, StandardCharsets.UTF_8)) {
                    if (!line.isBlank() && !line.startsWith("#")) {
                        lines.add(line);
                    }
                }
                perDirectory.push(lines);
            }
            if (Files.exists(current.resolve(".git"))) {
                break;
            }
            current = current.getParent();
        }

        List<FastIgnoreRule> rules = new ArrayList<>();
        ALWAYS_IGNORED.forEach(pattern -> rules.add(new FastIgnoreRule(pattern)));
        for (List<String> lines : perDirectory) {
            lines.forEach(line -> rules.add(new FastIgnoreRule(line)));
        }
        return new GitignoreRules(new IgnoreNode(rules));
    }

    /**
     * @param relativePath path relative to the start directory, any separator
     */
    boolean isIgnored(String relativePath, boolean directory) {
        String normalized = relativePath.replace(File.separatorChar, '/');
        return Boolean.TRUE.equals(node.checkIgnored(normalized, directory));
    }
}
