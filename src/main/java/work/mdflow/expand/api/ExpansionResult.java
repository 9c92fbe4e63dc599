package work.mdflow.expand.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of an {@link ExpansionRunner} run (usable by the CLI and embedding apps).
 */
public record ExpansionResult(
    Status status,
    Optional<String> output,
    List<String> resolvedImports,
    Map<String, Object> metadata,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public ExpansionResult {
        resolvedImports = List.copyOf(resolvedImports);
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ExpansionResult success(String output, List<String> resolvedImports, Map<String, Object> metadata, Instant startedAt) {
        return new ExpansionResult(Status.SUCCESS, Optional.of(output), resolvedImports, metadata, startedAt, Instant.now());
    }

    public static ExpansionResult failure(
        Map<String, Object> error,
        List<String> resolvedImports,
        Map<String, Object> metadata,
        Instant startedAt
    ) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.put("error", error);
        return new ExpansionResult(Status.FAILURE, Optional.empty(), resolvedImports, meta, startedAt, Instant.now());
    }

    public Duration elapsed() {
        return Duration.between(startedAt, finishedAt);
    }

    /**
     * Error message of a failed run.
     */
    public Optional<String> errorMessage() {
        Object error = metadata.get("error");
        if (error instanceof Map<?, ?> map && map.get("message") != null) {
            return Optional.of(String.valueOf(map.get("message")));
        }
        return Optional.empty();
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        output.ifPresent(text -> serializable.put("output", text));
        serializable.put("resolvedImports", resolvedImports);
        serializable.put("metadata", metadata);
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        serializable.put("elapsedMs", elapsed().toMillis());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize expansion result: " + ex.getOriginalMessage(), ex);
        }
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
