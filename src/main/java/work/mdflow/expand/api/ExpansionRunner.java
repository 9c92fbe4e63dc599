package work.mdflow.expand.api;

import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.mdflow.expand.config.ExpansionLimits;
import work.mdflow.expand.config.ExpansionSettingsLoader;
import work.mdflow.expand.resolve.StandardImportResolver;
import work.mdflow.expand.runtime.ImportException;
import work.mdflow.expand.runtime.ImportExpander;
import work.mdflow.expand.runtime.ImportStack;
import work.mdflow.expand.runtime.ResolutionContext;
import work.mdflow.expand.spi.FileRemoteCache;
import work.mdflow.expand.spi.HttpFetcher;
import work.mdflow.expand.spi.JdkHttpFetcher;
import work.mdflow.expand.spi.LiquidVariableSubstitution;
import work.mdflow.expand.spi.TemplateSubstitution;

/**
 * Public entry point for embedding the expansion pipeline.
 */
public final class ExpansionRunner {
    private static final Logger log = LoggerFactory.getLogger(ExpansionRunner.class);

    private final ExpansionSettingsLoader settingsLoader;
    private final HttpFetcher httpFetcher;
    private final TemplateSubstitution substitution;

    public ExpansionRunner() {
        this(new ExpansionSettingsLoader(), new JdkHttpFetcher(), new LiquidVariableSubstitution());
    }

    public ExpansionRunner(ExpansionSettingsLoader settingsLoader, HttpFetcher httpFetcher, TemplateSubstitution substitution) {
        this.settingsLoader = Objects.requireNonNull(settingsLoader, "settingsLoader");
        this.httpFetcher = Objects.requireNonNull(httpFetcher, "httpFetcher");
        this.substitution = Objects.requireNonNull(substitution, "substitution");
    }

    public ExpansionResult run(ExpansionConfiguration configuration) {
        var started = Instant.now();
        var source = configuration.source();
        var context = ResolutionContext.builder()
            .environment(configuration.environment())
            .trackResolvedImports(true)
            .invocationDirectory(configuration.invocationDirectory().orElse(null))
            .variables(configuration.variables())
            .dryRun(configuration.dryRun())
            .build();

        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("document", source.display());
        metadata.put("mode", configuration.mode().name());
        metadata.put("dryRun", configuration.dryRun());
        try {
            var document = source.read();
            var baseDirectory = source.baseDirectory();
            var limits = configuration.limits().orElseGet(() -> settingsLoader.load(baseDirectory));
            metadata.put("concurrency", limits.concurrency());
            metadata.put("commandTimeoutMs", limits.commandTimeout().toMillis());
            metadata.put("contextWindowTokens", limits.contextWindowTokens());

            var stack = source.file().isPresent() ? ImportStack.of(source.file().get().toRealPath()) : ImportStack.empty();
            String output;
            try (var expander = new ImportExpander(limits, resolverFor(limits, configuration))) {
                output = expand(expander, configuration, document, baseDirectory, stack, context);
            }
            metadata.put("status", "ok");
            return ExpansionResult.success(output, resolved(context), metadata, started);
        } catch (Exception ex) {
            if (Boolean.getBoolean("mdflow.debug")) {
                log.error("Expansion of {} failed", source.display(), ex);
            }
            return ExpansionResult.failure(describe(ex), resolved(context), metadata, started);
        }
    }

    private String expand(
        ImportExpander expander,
        ExpansionConfiguration configuration,
        String document,
        Path baseDirectory,
        ImportStack stack,
        ResolutionContext context
    ) {
        return switch (configuration.mode()) {
            case FULL -> expander.expand(document, baseDirectory, stack, context);
            case CONTENT_ONLY -> expander.expandContent(document, baseDirectory, stack, context);
            case COMMAND_ONLY -> expander.expandCommands(document, baseDirectory, context);
            case THREE_PHASE -> {
                var content = expander.expandContent(document, baseDirectory, stack, context);
                var substituted = substitution.substitute(content, configuration.variables());
                yield expander.expandCommands(substituted, baseDirectory, context.withPlainOutput());
            }
        };
    }

    private StandardImportResolver resolverFor(ExpansionLimits limits, ExpansionConfiguration configuration) {
        var builder = StandardImportResolver.builder(limits)
            .httpFetcher(httpFetcher)
            .substitution(substitution);
        if (configuration.cacheEnabled()) {
            builder.remoteCache(new FileRemoteCache(configuration.cacheDirectory().orElseGet(FileRemoteCache::defaultDirectory)));
        }
        return builder.build();
    }

    private static List<String> resolved(ResolutionContext context) {
        return context.resolvedImports().map(List::copyOf).orElse(List.of());
    }

    private static Map<String, Object> describe(Exception ex) {
        var error = new LinkedHashMap<String, Object>();
        if (ex instanceof ImportException importException) {
            error.put("kind", importException.failure().name());
            error.put("message", importException.getMessage());
            error.put("details", importException.details());
        } else {
            error.put("kind", ex.getClass().getSimpleName());
            error.put("message", ex.getMessage() == null ? ex.getClass().getName() : ex.getMessage());
        }
        return error;
    }
}
