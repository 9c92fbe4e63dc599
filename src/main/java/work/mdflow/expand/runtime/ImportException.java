package work.mdflow.expand.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Failure of one import, carrying its {@link ImportFailure} tag and the context needed to
 * diagnose it (paths, command, sizes, cycle chain, captured output).
 */
public final class ImportException extends RuntimeException {
    private final ImportFailure failure;
    private final Map<String, Object> details;

    public ImportException(ImportFailure failure, String message, Map<String, Object> details) {
        this(failure, message, details, null);
    }

    public ImportException(ImportFailure failure, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.failure = Objects.requireNonNull(failure, "failure");
        this.details = details == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public ImportFailure failure() {
        return failure;
    }

    public Map<String, Object> details() {
        return details;
    }

    /**
     * Ordered detail map from alternating key/value arguments; null values are dropped.
     */
    public static Map<String, Object> details(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("details expects key/value pairs");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            Object value = keyValues[i + 1];
            if (value != null) {
                map.put(String.valueOf(keyValues[i]), value);
            }
        }
        return map;
    }
}
