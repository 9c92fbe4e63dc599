package work.mdflow.expand.directive;

import java.util.List;
import java.util.Set;

/**
 * Output of {@link DirectiveScanner#scan(String)}: the safe ranges of a document and the offsets
 * where its top-level code regions begin.
 */
public record ScanResult(List<SafeRange> safeRanges, Set<Integer> unsafeStarts) {
    public ScanResult {
        safeRanges = List.copyOf(safeRanges);
        unsafeStarts = Set.copyOf(unsafeStarts);
    }

    public boolean isSafe(int index) {
        for (SafeRange range : safeRanges) {
            if (range.contains(index)) {
                return true;
            }
        }
        return false;
    }

    public boolean isUnsafeStart(int index) {
        return unsafeStarts.contains(index);
    }
}
