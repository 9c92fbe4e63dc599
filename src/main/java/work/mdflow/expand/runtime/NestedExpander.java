package work.mdflow.expand.runtime;

import java.nio.file.Path;

/**
 * Re-enters the expansion pipeline for the content of an imported file.
 */
@FunctionalInterface
public interface NestedExpander {
    String expand(String content, Path currentDirectory, ImportStack stack, ResolutionContext context);
}
