package work.mdflow.expand.directive;

/**
 * Half-open {@code [start, end)} span of a document that lies outside fenced and inline code.
 */
public record SafeRange(int start, int end) {
    public SafeRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid safe range [" + start + ", " + end + ")");
        }
    }

    public boolean contains(int index) {
        return index >= start && index < end;
    }
}
