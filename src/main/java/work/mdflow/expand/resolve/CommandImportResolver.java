package work.mdflow.expand.resolve;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.mdflow.expand.config.ExpansionLimits;
import work.mdflow.expand.directive.ImportAction.CommandImport;
import work.mdflow.expand.runtime.ImportException;
import work.mdflow.expand.runtime.ImportFailure;
import work.mdflow.expand.runtime.ResolutionContext;
import work.mdflow.expand.spi.TemplateSubstitution;

/**
 * Runs {@code !`cmd`} inlines through the platform shell and returns their sanitized output,
 * wrapped so later template passes keep it verbatim.
 */
public final class CommandImportResolver {
    private static final Logger log = LoggerFactory.getLogger(CommandImportResolver.class);

    private final ExpansionLimits limits;
    private final TemplateSubstitution substitution;

    public CommandImportResolver(ExpansionLimits limits, TemplateSubstitution substitution) {
        this.limits = Objects.requireNonNull(limits, "limits");
        this.substitution = Objects.requireNonNull(substitution, "substitution");
    }

    public String resolve(CommandImport action, Path currentDirectory, ResolutionContext context) {
        String command = action.command();
        if (!context.variables().isEmpty()) {
            String substituted = substitution.substitute(command, context.variables());
            if (!substituted.equals(command)) {
                log.info("Command with vars: {} -> {}", command, substituted);
            }
            command = substituted;
        }

        String actual = command;
        if (CommandOutput.isMarkdownFileCommand(command)) {
            actual = limits.toolCommand() + " " + command;
            log.info("Auto-running .md file with {}: {}", limits.toolCommand(), actual);
        } else {
            log.info("Executing: {}", command);
        }

        if (context.dryRun()) {
            log.info("Dry-run: skipping execution of '{}'", actual);
            return "[Dry Run: Command \"" + actual + "\" not executed]";
        }

        Path workingDirectory = context.invocationDirectory().orElse(currentDirectory);
        ProcessRunner.Completed completed;
        try {
            completed = ProcessRunner.run(shellCommand(actual), workingDirectory, context.environment(), limits.commandTimeout());
        } catch (TimeoutException ex) {
            long millis = limits.commandTimeout().toMillis();
            throw new ImportException(
                ImportFailure.COMMAND_TIMED_OUT,
                "Command timed out after " + millis + "ms: " + actual,
                ImportException.details("command", actual, "timeoutMs", millis),
                ex
            );
        } catch (IOException ex) {
            throw new ImportException(
                ImportFailure.COMMAND_FAILED,
                "Command failed: " + actual + " - " + ex.getMessage(),
                ImportException.details("command", actual, "workingDirectory", workingDirectory.toString()),
                ex
            );
        }

        if (BinaryFiles.containsNul(completed.stdout(), CommandOutput.BINARY_CHECK_SIZE)) {
            throw new ImportException(
                ImportFailure.BINARY_COMMAND_OUTPUT,
                "Command returned binary data. Inline commands must return text: " + actual,
                ImportException.details("command", actual)
            );
        }

        String stdout = CommandOutput.stripAnsi(CommandOutput.decode(completed.stdout()).trim());
        String stderr = CommandOutput.stripAnsi(CommandOutput.decode(completed.stderr()).trim());
        if (completed.exitCode() != 0) {
            String errorOutput = !stderr.isEmpty() ? stderr : (!stdout.isEmpty() ? stdout : "No output");
            throw new ImportException(
                ImportFailure.COMMAND_FAILED,
                "Command failed (Exit " + completed.exitCode() + "): " + actual + "\nOutput: " + errorOutput,
                ImportException.details(
                    "command", actual,
                    "exitCode", completed.exitCode(),
                    "stderr", stderr,
                    "stdout", stdout
                )
            );
        }

        String output = CommandOutput.truncate(CommandOutput.combine(stderr, stdout), limits.maxCommandOutputChars());
        return context.rawOutput() ? CommandOutput.wrapRaw(output) : output;
    }

    static List<String> shellCommand(String command) {
        if (isWindows()) {
            return List.of("cmd.exe", "/d", "/s", "/c", command);
        }
        return List.of("sh", "-c", command);
    }

    private static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
    }
}
