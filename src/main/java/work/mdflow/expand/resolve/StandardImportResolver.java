package work.mdflow.expand.resolve;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import work.mdflow.expand.config.ExpansionLimits;
import work.mdflow.expand.directive.ImportAction;
import work.mdflow.expand.directive.ImportAction.CodeFenceImport;
import work.mdflow.expand.directive.ImportAction.CommandImport;
import work.mdflow.expand.directive.ImportAction.FileImport;
import work.mdflow.expand.directive.ImportAction.GlobImport;
import work.mdflow.expand.directive.ImportAction.UrlImport;
import work.mdflow.expand.runtime.ImportStack;
import work.mdflow.expand.runtime.NestedExpander;
import work.mdflow.expand.runtime.ResolutionContext;
import work.mdflow.expand.spi.HttpFetcher;
import work.mdflow.expand.spi.JdkHttpFetcher;
import work.mdflow.expand.spi.LiquidVariableSubstitution;
import work.mdflow.expand.spi.RemoteCache;
import work.mdflow.expand.spi.TemplateSubstitution;

/**
 * Dispatches each action variant to its resolution strategy.
 */
public final class StandardImportResolver implements ImportResolver {
    private final FileImportResolver files;
    private final GlobImportResolver globs;
    private final UrlImportResolver urls;
    private final CommandImportResolver commands;
    private final CodeFenceResolver codeFences;

    private StandardImportResolver(Builder builder) {
        this.files = new FileImportResolver(builder.limits);
        this.globs = new GlobImportResolver(builder.limits);
        this.urls = new UrlImportResolver(builder.httpFetcher, builder.remoteCache);
        this.commands = new CommandImportResolver(builder.limits, builder.substitution);
        this.codeFences = new CodeFenceResolver(builder.limits);
    }

    public static Builder builder(ExpansionLimits limits) {
        return new Builder(limits);
    }

    @Override
    public String resolve(
        ImportAction action,
        Path currentDirectory,
        ImportStack stack,
        ResolutionContext context,
        NestedExpander nested
    ) {
        if (action instanceof FileImport file) {
            return files.resolve(file, currentDirectory, stack, context, nested);
        }
        if (action instanceof GlobImport glob) {
            return globs.resolve(glob, currentDirectory, context);
        }
        if (action instanceof UrlImport url) {
            return urls.resolve(url, context);
        }
        if (action instanceof CommandImport command) {
            return commands.resolve(command, currentDirectory, context);
        }
        if (action instanceof CodeFenceImport fence) {
            return codeFences.resolve(fence, currentDirectory, context);
        }
        throw new IllegalArgumentException("Unsupported import action: " + action.getClass().getSimpleName());
    }

    public static final class Builder {
        private final ExpansionLimits limits;
        private HttpFetcher httpFetcher;
        private Optional<RemoteCache> remoteCache = Optional.empty();
        private TemplateSubstitution substitution = new LiquidVariableSubstitution();

        private Builder(ExpansionLimits limits) {
            this.limits = Objects.requireNonNull(limits, "limits");
        }

        public Builder httpFetcher(HttpFetcher httpFetcher) {
            this.httpFetcher = Objects.requireNonNull(httpFetcher, "httpFetcher");
            return this;
        }

        public Builder remoteCache(RemoteCache remoteCache) {
            this.remoteCache = Optional.ofNullable(remoteCache);
            return this;
        }

        public Builder substitution(TemplateSubstitution substitution) {
            this.substitution = Objects.requireNonNull(substitution, "substitution");
            return this;
        }

        public StandardImportResolver build() {
            if (httpFetcher == null) {
                httpFetcher = new JdkHttpFetcher();
            }
            return new StandardImportResolver(this);
        }
    }
}
