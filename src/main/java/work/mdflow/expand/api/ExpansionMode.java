package work.mdflow.expand.api;

import java.util.Locale;

/**
 * Which directives a run resolves.
 */
public enum ExpansionMode {
    /** Every directive in one pass. */
    FULL,
    /** Files, globs and URLs; commands and code fences stay in the text. */
    CONTENT_ONLY,
    /** Commands and code fences only. */
    COMMAND_ONLY,
    /**
     * Content, then template substitution, then commands. Command and code fence output is
     * returned as is, without the raw wrapper the other modes add for a later template pass.
     */
    THREE_PHASE;

    public static ExpansionMode from(String value) {
        if (value == null || value.isBlank()) {
            return FULL;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return ExpansionMode.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported expansion mode: " + value, ex);
        }
    }
}
