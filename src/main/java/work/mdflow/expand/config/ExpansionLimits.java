package work.mdflow.expand.config;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable guard rails applied while resolving imports.
 */
public record ExpansionLimits(
    long maxFileBytes,
    int maxCommandOutputChars,
    Duration commandTimeout,
    Duration codeFenceTimeout,
    int concurrency,
    int contextWindowTokens,
    boolean forceContext,
    String toolCommand
) {
    public static final long DEFAULT_MAX_FILE_BYTES = 10L * 1024 * 1024;
    public static final int DEFAULT_MAX_COMMAND_OUTPUT_CHARS = 100_000;
    public static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_CONCURRENCY = 10;
    public static final int DEFAULT_CONTEXT_WINDOW = 128_000;
    public static final String DEFAULT_TOOL_COMMAND = "mdflow";

    public ExpansionLimits {
        Objects.requireNonNull(commandTimeout, "commandTimeout");
        Objects.requireNonNull(codeFenceTimeout, "codeFenceTimeout");
        Objects.requireNonNull(toolCommand, "toolCommand");
        if (maxFileBytes <= 0) {
            throw new IllegalArgumentException("maxFileBytes must be positive");
        }
        if (maxCommandOutputChars <= 0) {
            throw new IllegalArgumentException("maxCommandOutputChars must be positive");
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive");
        }
        if (contextWindowTokens <= 0) {
            throw new IllegalArgumentException("contextWindowTokens must be positive");
        }
        if (commandTimeout.isNegative() || commandTimeout.isZero()) {
            throw new IllegalArgumentException("commandTimeout must be positive");
        }
        if (codeFenceTimeout.isNegative() || codeFenceTimeout.isZero()) {
            throw new IllegalArgumentException("codeFenceTimeout must be positive");
        }
    }

    public static ExpansionLimits defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A code fence timeout equal to the command timeout is left unset, so it keeps following it.
     */
    public Builder toBuilder() {
        return new Builder()
            .maxFileBytes(maxFileBytes)
            .maxCommandOutputChars(maxCommandOutputChars)
            .commandTimeout(commandTimeout)
            .codeFenceTimeout(codeFenceTimeout.equals(commandTimeout) ? null : codeFenceTimeout)
            .concurrency(concurrency)
            .contextWindowTokens(contextWindowTokens)
            .forceContext(forceContext)
            .toolCommand(toolCommand);
    }

    /**
     * Context window of a model family, falling back to {@link #DEFAULT_CONTEXT_WINDOW}.
     */
    public static int contextWindowFor(String model) {
        if (model == null || model.isBlank()) {
            return DEFAULT_CONTEXT_WINDOW;
        }
        String normalized = model.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith("claude")) {
            return 200_000;
        }
        if (normalized.startsWith("gpt-4.1") || normalized.startsWith("gemini")) {
            return 1_000_000;
        }
        return DEFAULT_CONTEXT_WINDOW;
    }

    public static final class Builder {
        private long maxFileBytes = DEFAULT_MAX_FILE_BYTES;
        private int maxCommandOutputChars = DEFAULT_MAX_COMMAND_OUTPUT_CHARS;
        private Duration commandTimeout = DEFAULT_COMMAND_TIMEOUT;
        private Duration codeFenceTimeout;
        private int concurrency = DEFAULT_CONCURRENCY;
        private int contextWindowTokens = DEFAULT_CONTEXT_WINDOW;
        private boolean forceContext;
        private String toolCommand = DEFAULT_TOOL_COMMAND;

        public Builder maxFileBytes(long maxFileBytes) {
            this.maxFileBytes = maxFileBytes;
            return this;
        }

        public Builder maxCommandOutputChars(int maxCommandOutputChars) {
            this.maxCommandOutputChars = maxCommandOutputChars;
            return this;
        }

        public Builder commandTimeout(Duration commandTimeout) {
            this.commandTimeout = commandTimeout;
            return this;
        }

        /**
         * Unset means "same as the command timeout".
         */
        public Builder codeFenceTimeout(Duration codeFenceTimeout) {
            this.codeFenceTimeout = codeFenceTimeout;
            return this;
        }

        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder contextWindowTokens(int contextWindowTokens) {
            this.contextWindowTokens = contextWindowTokens;
            return this;
        }

        public Builder forceContext(boolean forceContext) {
            this.forceContext = forceContext;
            return this;
        }

        public Builder toolCommand(String toolCommand) {
            this.toolCommand = toolCommand;
            return this;
        }

        public ExpansionLimits build() {
            return new ExpansionLimits(
                maxFileBytes,
                maxCommandOutputChars,
                commandTimeout,
                codeFenceTimeout == null ? commandTimeout : codeFenceTimeout,
                concurrency,
                contextWindowTokens,
                forceContext,
                toolCommand
            );
        }
    }
}
