package work.mdflow.expand.cli;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.mdflow.expand.api.DocumentSource;
import work.mdflow.expand.api.ExpansionConfiguration;
import work.mdflow.expand.api.ExpansionMode;
import work.mdflow.expand.api.ExpansionResult;
import work.mdflow.expand.api.ExpansionRunner;
import work.mdflow.expand.api.LogLevel;
import work.mdflow.expand.config.ExpansionLimits;
import work.mdflow.expand.config.ExpansionSettingsLoader;
import work.mdflow.expand.shared.DurationParser;

@CommandLine.Command(
    name = "mdflow-expand",
    description = "Expand @file, @glob, @url, !`command` and shebang fence directives in a markdown document.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class ExpandCommand implements Callable<Integer> {
    @CommandLine.Parameters(
        index = "0",
        paramLabel = "FILE|-",
        description = "Markdown document to expand; use '-' to read from stdin."
    )
    private String document;

    @CommandLine.Option(
        names = "--mode",
        description = "full | content-only | command-only | three-phase.",
        defaultValue = "full"
    )
    private String modeRaw;

    @CommandLine.Option(
        names = "--var",
        paramLabel = "KEY=VALUE",
        description = "Template variable used in command text (repeatable)."
    )
    private Map<String, String> vars = new LinkedHashMap<>();

    @CommandLine.Option(
        names = "--vars",
        paramLabel = "FILE",
        description = "YAML or JSON file of template variables; --var entries take precedence.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path varsFile;

    @CommandLine.Option(
        names = "--cwd",
        paramLabel = "DIR",
        description = "Working directory for commands (default: the document's directory).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path cwd;

    @CommandLine.Option(names = "--dry-run", description = "Do not execute commands or code fences.")
    private boolean dryRun;

    @CommandLine.Option(
        names = "--concurrency",
        description = "Maximum imports resolved at once per level.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer concurrency;

    @CommandLine.Option(
        names = "--timeout",
        description = "Command timeout (e.g. 30s, 2m).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String timeoutRaw;

    @CommandLine.Option(names = "--no-cache", description = "Always fetch URL imports from the network.")
    private boolean noCache;

    @CommandLine.Option(
        names = "--cache-dir",
        description = "URL cache location (default: ~/.mdflow/cache).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path cacheDir;

    @CommandLine.Option(names = "--force-context", description = "Allow glob imports beyond the context window.")
    private boolean forceContext;

    @CommandLine.Option(names = "--json", description = "Print the full result as JSON.")
    private boolean json;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Shorthand for --log-level debug.")
    private boolean verbose;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        LogLevel logLevel = verbose ? LogLevel.DEBUG : LogLevel.from(logLevelRaw);
        LoggingConfigurator.apply(logLevel);

        DocumentSource source = resolveSource();
        ExpansionLimits limits = resolveLimits(source.baseDirectory());

        var variables = new LinkedHashMap<String, String>();
        if (varsFile != null) {
            variables.putAll(VariablesFile.load(varsFile));
        }
        variables.putAll(vars);

        ExpansionConfiguration configuration = ExpansionConfiguration.builder()
            .source(source)
            .mode(ExpansionMode.from(modeRaw))
            .invocationDirectory(Optional.ofNullable(cwd).map(path -> path.toAbsolutePath().normalize()))
            .variables(variables)
            .dryRun(dryRun)
            .limits(Optional.of(limits))
            .cacheEnabled(!noCache)
            .cacheDirectory(Optional.ofNullable(cacheDir))
            .logLevel(logLevel)
            .build();

        ExpansionResult result = new ExpansionRunner().run(configuration);
        if (json) {
            spec.commandLine().getOut().println(result.toPrettyJson());
        } else if (result.status() == ExpansionResult.Status.SUCCESS) {
            spec.commandLine().getOut().println(result.output().orElse(""));
        } else {
            String message = result.errorMessage().orElse("Expansion failed");
            spec.commandLine().getErr().println(spec.commandLine().getColorScheme().errorText(message));
        }
        spec.commandLine().getOut().flush();
        return result.status().exitCode();
    }

    private DocumentSource resolveSource() throws IOException {
        if ("-".equals(document)) {
            Path base = cwd != null ? cwd : Path.of("").toAbsolutePath();
            return DocumentSource.forText(readStdin(), base);
        }
        Path file = Path.of(document);
        if (!Files.isRegularFile(file)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Document not found: " + document);
        }
        return DocumentSource.forFile(file);
    }

    private ExpansionLimits resolveLimits(Path baseDirectory) {
        ExpansionLimits.Builder builder = new ExpansionSettingsLoader().load(baseDirectory).toBuilder();
        if (concurrency != null) {
            builder.concurrency(concurrency);
        }
        DurationParser.parse(timeoutRaw).ifPresent(builder::commandTimeout);
        if (forceContext) {
            builder.forceContext(true);
        }
        return builder.build();
    }

    private static String readStdin() throws IOException {
        InputStream in = System.in;
        return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
}
