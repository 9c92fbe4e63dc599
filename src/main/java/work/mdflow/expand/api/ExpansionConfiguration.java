package work.mdflow.expand.api;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.mdflow.expand.config.ExpansionLimits;

/**
 * Immutable description of one expansion run.
 *
 * <p>When {@code limits} is empty the runner loads them from {@code .mdflow.toml} files and the
 * environment, starting at the document's directory. An empty {@code cacheDirectory} with the
 * cache enabled means {@code ~/.mdflow/cache}.</p>
 */
public record ExpansionConfiguration(
    DocumentSource source,
    ExpansionMode mode,
    Optional<Path> invocationDirectory,
    Map<String, String> variables,
    Map<String, String> environment,
    boolean dryRun,
    Optional<ExpansionLimits> limits,
    boolean cacheEnabled,
    Optional<Path> cacheDirectory,
    LogLevel logLevel
) {
    public ExpansionConfiguration {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(invocationDirectory, "invocationDirectory");
        Objects.requireNonNull(variables, "variables");
        Objects.requireNonNull(environment, "environment");
        Objects.requireNonNull(limits, "limits");
        Objects.requireNonNull(cacheDirectory, "cacheDirectory");
        Objects.requireNonNull(logLevel, "logLevel");
        variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        environment = Map.copyOf(environment);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private DocumentSource source;
        private ExpansionMode mode = ExpansionMode.FULL;
        private Optional<Path> invocationDirectory = Optional.empty();
        private Map<String, String> variables = Map.of();
        private Map<String, String> environment = System.getenv();
        private boolean dryRun;
        private Optional<ExpansionLimits> limits = Optional.empty();
        private boolean cacheEnabled = true;
        private Optional<Path> cacheDirectory = Optional.empty();
        private LogLevel logLevel = LogLevel.INFO;

        public Builder source(DocumentSource source) {
            this.source = source;
            return this;
        }

        public Builder mode(ExpansionMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder invocationDirectory(Optional<Path> invocationDirectory) {
            this.invocationDirectory = invocationDirectory;
            return this;
        }

        public Builder variables(Map<String, String> variables) {
            this.variables = variables;
            return this;
        }

        public Builder environment(Map<String, String> environment) {
            this.environment = environment;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder limits(Optional<ExpansionLimits> limits) {
            this.limits = limits;
            return this;
        }

        public Builder cacheEnabled(boolean cacheEnabled) {
            this.cacheEnabled = cacheEnabled;
            return this;
        }

        public Builder cacheDirectory(Optional<Path> cacheDirectory) {
            this.cacheDirectory = cacheDirectory;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public ExpansionConfiguration build() {
            return new ExpansionConfiguration(
                source,
                mode,
                invocationDirectory,
                variables,
                environment,
                dryRun,
                limits,
                cacheEnabled,
                cacheDirectory,
                logLevel
            );
        }
    }
}
