package work.mdflow.expand.runtime;

/**
 * Tags for every way a single import can fail. Each one aborts the enclosing expansion.
 */
public enum ImportFailure {
    IMPORT_NOT_FOUND,
    FILE_TOO_LARGE,
    BINARY_IMPORT_REJECTED,
    CIRCULAR_IMPORT,
    SYMBOL_NOT_FOUND,
    CONTEXT_BUDGET_EXCEEDED,
    URL_FETCH_FAILED,
    UNSUPPORTED_CONTENT_TYPE,
    COMMAND_TIMED_OUT,
    BINARY_COMMAND_OUTPUT,
    COMMAND_FAILED,
    CODE_FENCE_FAILED
}
