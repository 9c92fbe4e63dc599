package work.mdflow.expand.resolve;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.mdflow.expand.config.ExpansionLimits;
import work.mdflow.expand.directive.ActionParser;
import work.mdflow.expand.directive.ImportAction.GlobImport;
import work.mdflow.expand.runtime.ImportException;
import work.mdflow.expand.runtime.ImportFailure;
import work.mdflow.expand.runtime.ResolutionContext;

/**
 * Expands {@code @./src/**}{@code /*.ts} style imports into one tagged block per matching file,
 * honouring gitignore rules and the context-window budget.
 */
public final class GlobImportResolver {
    private static final Logger log = LoggerFactory.getLogger(GlobImportResolver.class);

    private final ExpansionLimits limits;

    public GlobImportResolver(ExpansionLimits limits) {
        this.limits = Objects.requireNonNull(limits, "limits");
    }

    record MatchedFile(String path, String content) {}

    public String resolve(GlobImport action, Path currentDirectory, ResolutionContext context) {
        String pattern = action.pattern();
        Path directory = currentDirectory.toAbsolutePath().normalize();
        GlobRoot root = GlobRoot.split(pattern, directory);
        log.debug("Glob pattern: {} under {}", root.pattern(), root.base());

        List<MatchedFile> files = new ArrayList<>();
        List<String> skippedBinary = new ArrayList<>();
        try {
            collect(root, directory, files, skippedBinary);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to expand glob " + pattern, ex);
        }
        if (!skippedBinary.isEmpty()) {
            log.warn("Skipped {} binary file(s): {}", skippedBinary.size(), String.join(", ", skippedBinary));
        }
        files.sort(Comparator.comparing(MatchedFile::path));

        String combined = files.stream().map(MatchedFile::content).collect(Collectors.joining("\n"));
        int window = limits.contextWindowTokens();
        int estimated = TokenBudget.estimate(combined);
        boolean precise = TokenBudget.needsPreciseCount(estimated, window);
        int tokens = precise ? TokenBudget.count(combined) : estimated;
        log.info("Expanding {}: {} files (~{} tokens{})", pattern, files.size(), grouped(tokens), precise ? "" : " est");

        if (tokens > window && !limits.forceContext()) {
            throw new ImportException(
                ImportFailure.CONTEXT_BUDGET_EXCEEDED,
                "Glob import \"" + pattern + "\" would include ~" + grouped(tokens) + " tokens (" + files.size()
                    + " files), which exceeds the " + grouped(window) + " token limit.\n"
                    + "To override this limit, set the MA_FORCE_CONTEXT=1 environment variable.",
                ImportException.details("pattern", pattern, "tokens", tokens, "files", files.size(), "contextWindow", window)
            );
        }
        if (tokens > TokenBudget.warnThreshold(window) && tokens <= window) {
            log.warn("High token count (~{}) for {}. This may be expensive.", grouped(tokens), pattern);
        }

        context.recordResolved(pattern);
        return format(files);
    }

    private void collect(GlobRoot root, Path currentDirectory, List<MatchedFile> files, List<String> skippedBinary)
        throws IOException {
        if (!Files.isDirectory(root.base())) {
            return;
        }
        Path ignoreRoot = root.base().startsWith(currentDirectory) ? currentDirectory : root.base();
        GitignoreRules ignore = GitignoreRules.collect(ignoreRoot);
        List<PathMatcher> matchers = root.matchers();

        Files.walkFileTree(root.base(), new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root.base()) && ignore.isIgnored(ignoreRoot.relativize(dir).toString(), true)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                if (!Files.isRegularFile(file) || ignore.isIgnored(ignoreRoot.relativize(file).toString(), false)) {
                    return FileVisitResult.CONTINUE;
                }
                Path relativeToBase = root.base().relativize(file);
                if (matchers.stream().noneMatch(matcher -> matcher.matches(relativeToBase))) {
                    return FileVisitResult.CONTINUE;
                }
                String displayPath = currentDirectory.relativize(file).toString().replace('\\', '/');
                if (BinaryFiles.isBinary(file)) {
                    skippedBinary.add(displayPath);
                    return FileVisitResult.CONTINUE;
                }
                long size = Files.size(file);
                if (size > limits.maxFileBytes()) {
                    throw FileImportResolver.fileTooLarge(file, size, limits.maxFileBytes());
                }
                files.add(new MatchedFile(displayPath, Files.readString(file, StandardCharsets.UTF_8)));
                return FileVisitResult.CONTINUE;
            }
        });
    }

    static String format(List<MatchedFile> files) {
        return files.stream()
            .map(file -> {
                String name = tagName(file.path());
                return "<" + name + " path=\"" + file.path() + "\">\n" + file.content() + "\n</" + name + ">";
            })
            .collect(Collectors.joining("\n\n"));
    }

    /**
     * File basename without extension, slugified into a valid tag name.
     */
    static String tagName(String path) {
        String base = path.substring(path.lastIndexOf('/') + 1);
        int dot = base.lastIndexOf('.');
        if (dot > 0 || (dot == 0 && base.length() > 1)) {
            base = base.substring(0, dot);
        }
        String slug = base.toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9]+", "-")
            .replaceAll("^-+|-+$", "");
        if (slug.isEmpty()) {
            return "file";
        }
        return Character.isDigit(slug.charAt(0)) ? "_" + slug : slug;
    }

    private static String grouped(int value) {
        return String.format(Locale.ROOT, "%,d", value);
    }

    /**
     * Literal leading directories of a pattern, split from the part that needs matching.
     */
    record GlobRoot(Path base, String pattern) {
        static GlobRoot split(String rawPattern, Path currentDirectory) {
            String expanded = FileImportResolver.expandHome(rawPattern).toString().replace('\\', '/');
            if (rawPattern.startsWith("./")) {
                expanded = rawPattern.substring(2);
            }
            Path start = Path.of(expanded).isAbsolute() ? Path.of("/") : currentDirectory;
            String[] segments = expanded.split("/");
            StringBuilder literal = new StringBuilder();
            int index = 0;
            for (; index < segments.length - 1; index++) {
                if (ActionParser.isGlobPattern(segments[index])) {
                    break;
                }
                if (!segments[index].isEmpty()) {
                    literal.append(segments[index]).append('/');
                }
            }
            StringBuilder rest = new StringBuilder();
            for (int i = index; i < segments.length; i++) {
                if (rest.length() > 0) {
                    rest.append('/');
                }
                rest.append(segments[i]);
            }
            Path base = literal.length() == 0 ? start : start.resolve(literal.toString());
            return new GlobRoot(base.normalize(), rest.toString());
        }

        /**
         * {@code **}{@code /} also matches zero directories, which {@link PathMatcher} globs do not.
         */
        List<PathMatcher> matchers() {
            List<PathMatcher> matchers = new ArrayList<>();
            matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
            if (pattern.contains("**/")) {
                matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern.replace("**/", "")));
            }
            return matchers;
        }
    }
}
