package work.mdflow.expand.resolve;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.mdflow.expand.config.ExpansionLimits;
import work.mdflow.expand.directive.ImportAction.CodeFenceImport;
import work.mdflow.expand.runtime.ImportException;
import work.mdflow.expand.runtime.ImportFailure;
import work.mdflow.expand.runtime.ResolutionContext;

/**
 * Executes a shebang code fence: the script goes to a temporary executable file that is run
 * directly and always deleted afterwards.
 */
public final class CodeFenceResolver {
    private static final Logger log = LoggerFactory.getLogger(CodeFenceResolver.class);
    private static final Map<String, String> EXTENSIONS = Map.of(
        "ts", "ts",
        "js", "js",
        "py", "py",
        "sh", "sh",
        "bash", "sh"
    );

    private final ExpansionLimits limits;
    private final Path tempDirectory;

    public CodeFenceResolver(ExpansionLimits limits) {
        this(limits, Path.of(System.getProperty("java.io.tmpdir")));
    }

    CodeFenceResolver(ExpansionLimits limits, Path tempDirectory) {
        this.limits = Objects.requireNonNull(limits, "limits");
        this.tempDirectory = Objects.requireNonNull(tempDirectory, "tempDirectory");
    }

    public String resolve(CodeFenceImport action, Path currentDirectory, ResolutionContext context) {
        log.info("Executing code fence ({}): {}", action.language(), action.shebang());
        if (context.dryRun()) {
            return "[Dry Run: Code fence not executed]";
        }

        Path script = tempDirectory.resolve(scriptName(action.language()));
        try {
            return run(action, script, context.invocationDirectory().orElse(currentDirectory), context);
        } finally {
            try {
                Files.deleteIfExists(script);
            } catch (IOException ex) {
                log.warn("Could not delete code fence script {}: {}", script, ex.getMessage());
            }
        }
    }

    private String run(CodeFenceImport action, Path script, Path workingDirectory, ResolutionContext context) {
        ProcessRunner.Completed completed;
        try {
            Files.writeString(script, action.shebang() + "\n" + action.code(), StandardCharsets.UTF_8);
            makeExecutable(script);
            completed = ProcessRunner.run(
                List.of(script.toString()),
                workingDirectory,
                context.environment(),
                limits.codeFenceTimeout()
            );
        } catch (TimeoutException ex) {
            long millis = limits.codeFenceTimeout().toMillis();
            throw new ImportException(
                ImportFailure.COMMAND_TIMED_OUT,
                "Code fence timed out after " + millis + "ms: " + action.shebang(),
                ImportException.details("shebang", action.shebang(), "language", action.language(), "timeoutMs", millis),
                ex
            );
        } catch (IOException ex) {
            throw new ImportException(
                ImportFailure.CODE_FENCE_FAILED,
                "Code fence failed: " + action.shebang() + " - " + ex.getMessage(),
                ImportException.details("shebang", action.shebang(), "language", action.language()),
                ex
            );
        }

        String stdout = CommandOutput.decode(completed.stdout());
        String stderr = CommandOutput.decode(completed.stderr());
        if (completed.exitCode() != 0) {
            String errorOutput = !stderr.isEmpty() ? stderr : (!stdout.isEmpty() ? stdout : "No output");
            throw new ImportException(
                ImportFailure.CODE_FENCE_FAILED,
                "Code fence failed (Exit " + completed.exitCode() + "): " + errorOutput,
                ImportException.details(
                    "shebang", action.shebang(),
                    "exitCode", completed.exitCode(),
                    "stderr", stderr,
                    "stdout", stdout
                )
            );
        }
        String output = CommandOutput.truncate(CommandOutput.stripAnsi((stdout + stderr).trim()), limits.maxCommandOutputChars());
        return context.rawOutput() ? CommandOutput.wrapRaw(output) : output;
    }

    static String scriptName(String language) {
        String extension = EXTENSIONS.getOrDefault(language, language);
        String random = Long.toString(ThreadLocalRandom.current().nextLong() & Long.MAX_VALUE, 36);
        return "mdflow-" + System.currentTimeMillis() + "-" + random + "." + extension;
    }

    private static void makeExecutable(Path script) throws IOException {
        try {
            Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
        } catch (UnsupportedOperationException ex) {
            if (!script.toFile().setExecutable(true)) {
                throw new IOException("Cannot mark " + script + " executable", ex);
            }
        }
    }
}
