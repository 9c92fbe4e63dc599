package work.mdflow.expand.resolve;

import java.nio.file.Path;
import work.mdflow.expand.config.ExpansionLimits;
import work.mdflow.expand.directive.ImportAction;
import work.mdflow.expand.runtime.ImportStack;
import work.mdflow.expand.runtime.NestedExpander;
import work.mdflow.expand.runtime.ResolutionContext;

/**
 * Turns one import action into its replacement text, or fails with an
 * {@link work.mdflow.expand.runtime.ImportException}.
 */
@FunctionalInterface
public interface ImportResolver {
    String resolve(
        ImportAction action,
        Path currentDirectory,
        ImportStack stack,
        ResolutionContext context,
        NestedExpander nested
    );

    static ImportResolver standard(ExpansionLimits limits) {
        return StandardImportResolver.builder(limits).build();
    }
}
