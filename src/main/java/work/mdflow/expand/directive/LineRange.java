package work.mdflow.expand.directive;

/**
 * Inclusive, 1-indexed line window requested with {@code @path:start-end}.
 */
public record LineRange(int start, int end) {
    @Override
    public String toString() {
        return start + "-" + end;
    }
}
