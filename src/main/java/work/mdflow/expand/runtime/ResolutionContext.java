package work.mdflow.expand.runtime;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Per-invocation settings shared by every recursive expansion call.
 *
 * <p>Read-only after construction apart from the resolved-import log, which is append-only and
 * safe to share between concurrently resolving siblings.</p>
 */
public final class ResolutionContext {
    private final Map<String, String> environment;
    private final List<String> resolvedImports;
    private final Path invocationDirectory;
    private final Map<String, String> variables;
    private final boolean dryRun;
    private final boolean contentOnly;
    private final boolean rawOutput;

    private ResolutionContext(
        Map<String, String> environment,
        List<String> resolvedImports,
        Path invocationDirectory,
        Map<String, String> variables,
        boolean dryRun,
        boolean contentOnly,
        boolean rawOutput
    ) {
        this.environment = environment;
        this.resolvedImports = resolvedImports;
        this.invocationDirectory = invocationDirectory;
        this.variables = variables;
        this.dryRun = dryRun;
        this.contentOnly = contentOnly;
        this.rawOutput = rawOutput;
    }

    public static ResolutionContext defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, String> environment() {
        return environment;
    }

    /**
     * Identifiers of resolved imports in completion order, or empty when tracking is off.
     */
    public Optional<List<String>> resolvedImports() {
        return resolvedImports == null ? Optional.empty() : Optional.of(Collections.unmodifiableList(resolvedImports));
    }

    public void recordResolved(String identifier) {
        if (resolvedImports != null) {
            resolvedImports.add(identifier);
        }
    }

    public Optional<Path> invocationDirectory() {
        return Optional.ofNullable(invocationDirectory);
    }

    public Map<String, String> variables() {
        return variables;
    }

    public boolean dryRun() {
        return dryRun;
    }

    public boolean contentOnly() {
        return contentOnly;
    }

    /**
     * True when command and code fence output is wrapped in a raw block for a later template pass.
     */
    public boolean rawOutput() {
        return rawOutput;
    }

    /**
     * Copy with the content-only flag set; the resolved-import log stays shared.
     */
    public ResolutionContext asContentOnly() {
        if (contentOnly) {
            return this;
        }
        return new ResolutionContext(environment, resolvedImports, invocationDirectory, variables, dryRun, true, rawOutput);
    }

    /**
     * Copy that leaves program output unwrapped, for a final pass with no template stage after it.
     */
    public ResolutionContext withPlainOutput() {
        if (!rawOutput) {
            return this;
        }
        return new ResolutionContext(environment, resolvedImports, invocationDirectory, variables, dryRun, contentOnly, false);
    }

    private static Map<String, String> copyVariables(Map<String, String> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    public static final class Builder {
        private Map<String, String> environment = System.getenv();
        private boolean trackResolvedImports;
        private Path invocationDirectory;
        private Map<String, String> variables = Map.of();
        private boolean dryRun;
        private boolean contentOnly;
        private boolean rawOutput = true;

        public Builder environment(Map<String, String> environment) {
            this.environment = Objects.requireNonNull(environment, "environment");
            return this;
        }

        public Builder trackResolvedImports(boolean trackResolvedImports) {
            this.trackResolvedImports = trackResolvedImports;
            return this;
        }

        public Builder invocationDirectory(Path invocationDirectory) {
            this.invocationDirectory = invocationDirectory == null
                ? null
                : invocationDirectory.toAbsolutePath().normalize();
            return this;
        }

        public Builder variables(Map<String, String> variables) {
            this.variables = variables;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder contentOnly(boolean contentOnly) {
            this.contentOnly = contentOnly;
            return this;
        }

        public Builder rawOutput(boolean rawOutput) {
            this.rawOutput = rawOutput;
            return this;
        }

        public ResolutionContext build() {
            return new ResolutionContext(
                Map.copyOf(environment),
                trackResolvedImports ? new CopyOnWriteArrayList<>() : null,
                invocationDirectory,
                copyVariables(variables),
                dryRun,
                contentOnly,
                rawOutput
            );
        }
    }
}
