package work.mdflow.expand.runtime;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Splices resolved content back into a document at the offsets recorded by the parser.
 */
public final class Injector {
    private Injector() {}

    /**
     * Replacements are applied from the highest offset down so that earlier offsets stay valid
     * regardless of how much each replacement grows or shrinks the text.
     */
    public static String inject(String content, Collection<ResolvedImport> resolved) {
        List<ResolvedImport> ordered = new ArrayList<>(resolved);
        ordered.sort(Comparator.comparingInt((ResolvedImport r) -> r.action().sourceIndex()).reversed());
        StringBuilder result = new StringBuilder(content);
        for (ResolvedImport entry : ordered) {
            int start = entry.action().sourceIndex();
            int end = start + entry.action().originalText().length();
            if (start < 0 || end > result.length()) {
                throw new IllegalArgumentException(
                    "Import span [" + start + ", " + end + ") lies outside the document (length " + result.length() + ")"
                );
            }
            result.replace(start, end, entry.content());
        }
        return result.toString();
    }
}
