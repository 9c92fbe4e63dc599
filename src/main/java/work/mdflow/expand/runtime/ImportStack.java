package work.mdflow.expand.runtime;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Canonical paths being expanded on the current recursion branch.
 *
 * <p>Immutable: {@link #push(Path)} returns an extended copy, so sibling imports never observe
 * each other's entries.</p>
 */
public final class ImportStack {
    private static final ImportStack EMPTY = new ImportStack(Set.of());

    private final Set<Path> paths;

    private ImportStack(Set<Path> paths) {
        this.paths = paths;
    }

    public static ImportStack empty() {
        return EMPTY;
    }

    public static ImportStack of(Path... canonicalPaths) {
        ImportStack stack = EMPTY;
        for (Path path : canonicalPaths) {
            stack = stack.push(path);
        }
        return stack;
    }

    public boolean contains(Path canonicalPath) {
        return paths.contains(canonicalPath);
    }

    public ImportStack push(Path canonicalPath) {
        Set<Path> next = new LinkedHashSet<>(paths);
        next.add(canonicalPath);
        return new ImportStack(Collections.unmodifiableSet(next));
    }

    public List<Path> paths() {
        return List.copyOf(paths);
    }

    public int depth() {
        return paths.size();
    }

    /**
     * Renders {@code a -> b -> reentered} for cycle reports.
     */
    public String chainTo(Path reentered) {
        List<Path> chain = new ArrayList<>(paths);
        chain.add(reentered);
        return chain.stream().map(Path::toString).collect(Collectors.joining(" -> "));
    }

    @Override
    public String toString() {
        return "ImportStack" + paths;
    }
}
