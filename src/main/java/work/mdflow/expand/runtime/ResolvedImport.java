package work.mdflow.expand.runtime;

import java.util.Objects;
import work.mdflow.expand.directive.ImportAction;

/**
 * An action paired with the text that replaces it.
 */
public record ResolvedImport(ImportAction action, String content) {
    public ResolvedImport {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(content, "content");
    }
}
