package work.mdflow.expand.directive;

/**
 * Scanner states used while walking a document.
 */
enum ScanContext {
    NORMAL,
    FENCED_CODE,
    INLINE_CODE
}
