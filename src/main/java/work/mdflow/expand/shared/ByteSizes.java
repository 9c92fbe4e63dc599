package work.mdflow.expand.shared;

import java.util.Locale;

/**
 * Byte size formatting and parsing ({@code 512}, {@code 64KB}, {@code 10MB}).
 */
public final class ByteSizes {
    private static final long KB = 1024L;
    private static final long MB = KB * 1024L;

    private ByteSizes() {}

    public static String format(long bytes) {
        if (bytes < KB) {
            return bytes + " bytes";
        }
        if (bytes < MB) {
            return String.format(Locale.ROOT, "%.1fKB", bytes / (double) KB);
        }
        return String.format(Locale.ROOT, "%.1fMB", bytes / (double) MB);
    }

    public static long parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Byte size is required");
        }
        String trimmed = raw.trim().toUpperCase(Locale.ROOT);
        long multiplier = 1L;
        String digits = trimmed;
        if (trimmed.endsWith("MB")) {
            multiplier = MB;
            digits = trimmed.substring(0, trimmed.length() - 2);
        } else if (trimmed.endsWith("KB")) {
            multiplier = KB;
            digits = trimmed.substring(0, trimmed.length() - 2);
        } else if (trimmed.endsWith("B")) {
            digits = trimmed.substring(0, trimmed.length() - 1);
        }
        try {
            long value = Long.parseLong(digits.trim());
            if (value < 0) {
                throw new IllegalArgumentException("Byte size must not be negative: " + raw);
            }
            return Math.multiplyExact(value, multiplier);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid byte size: " + raw, ex);
        }
    }
}
