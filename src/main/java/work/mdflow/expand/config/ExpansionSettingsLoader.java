package work.mdflow.expand.config;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.mdflow.expand.shared.ByteSizes;
import work.mdflow.expand.shared.DurationParser;

/**
 * Builds {@link ExpansionLimits} from defaults, {@code ~/.mdflow/config.toml}, the nearest
 * {@code .mdflow.toml} above the document, and finally environment variables.
 *
 * <p>All files use an {@code [imports]} table; later sources win.</p>
 */
public final class ExpansionSettingsLoader {
    public static final String PROJECT_FILE = ".mdflow.toml";
    static final String TABLE = "imports";

    private static final Logger log = LoggerFactory.getLogger(ExpansionSettingsLoader.class);

    private final Map<String, String> env;
    private final Path homeDirectory;

    public ExpansionSettingsLoader() {
        this(System.getenv(), Path.of(System.getProperty("user.home")));
    }

    public ExpansionSettingsLoader(Map<String, String> env, Path homeDirectory) {
        this.env = Objects.requireNonNull(env, "env");
        this.homeDirectory = Objects.requireNonNull(homeDirectory, "homeDirectory");
    }

    public ExpansionLimits load(Path startDirectory) {
        ExpansionLimits.Builder builder = ExpansionLimits.builder();
        applyFile(builder, homeDirectory.resolve(".mdflow").resolve("config.toml"));
        if (startDirectory != null) {
            Path project = findProjectFile(startDirectory);
            if (project != null) {
                applyFile(builder, project);
            }
        }
        applyEnvironment(builder);
        return builder.build();
    }

    static Path findProjectFile(Path startDirectory) {
        Path current = startDirectory.toAbsolutePath().normalize();
        while (current != null) {
            Path candidate = current.resolve(PROJECT_FILE);
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
            current = current.getParent();
        }
        return null;
    }

    private void applyFile(ExpansionLimits.Builder builder, Path path) {
        if (!Files.isRegularFile(path)) {
            return;
        }
        TomlParseResult parsed;
        try {
            parsed = Toml.parse(Files.readString(path));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read settings: " + path, ex);
        }
        if (parsed.hasErrors()) {
            String errors = parsed.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid settings file " + path + ": " + errors);
        }
        TomlTable table = parsed.getTable(TABLE);
        if (table == null || table.isEmpty()) {
            return;
        }
        log.debug("Applying import settings from {}", path);
        applyTable(builder, table, path.toString());
    }

    static void applyTable(ExpansionLimits.Builder builder, TomlTable table, String source) {
        for (String key : table.keySet()) {
            Object value = table.get(key);
            String text = value == null ? null : String.valueOf(value);
            switch (key) {
                case "max-file-size" -> builder.maxFileBytes(value instanceof Long n ? n : ByteSizes.parse(text));
                case "max-command-output" -> builder.maxCommandOutputChars(toInt(key, value, source));
                case "command-timeout" -> builder.commandTimeout(toDuration(key, value, source));
                case "code-fence-timeout" -> builder.codeFenceTimeout(toDuration(key, value, source));
                case "concurrency" -> builder.concurrency(toInt(key, value, source));
                case "context-window" -> builder.contextWindowTokens(toInt(key, value, source));
                case "model" -> builder.contextWindowTokens(ExpansionLimits.contextWindowFor(text));
                case "force-context" -> builder.forceContext(Boolean.TRUE.equals(value) || "true".equalsIgnoreCase(text));
                case "tool-command" -> builder.toolCommand(text);
                default -> log.warn("Ignoring unknown setting '{}' in {}", key, source);
            }
        }
    }

    private void applyEnvironment(ExpansionLimits.Builder builder) {
        String model = env.get("MA_MODEL");
        if (model != null && !model.isBlank()) {
            builder.contextWindowTokens(ExpansionLimits.contextWindowFor(model));
        }
        String window = env.get("MA_CONTEXT_WINDOW");
        if (window != null && !window.isBlank()) {
            builder.contextWindowTokens(toInt("MA_CONTEXT_WINDOW", window.trim(), "environment"));
        }
        String force = env.get("MA_FORCE_CONTEXT");
        if (force != null && !force.isBlank()) {
            String normalized = force.trim().toLowerCase(Locale.ROOT);
            builder.forceContext(!normalized.equals("0") && !normalized.equals("false"));
        }
        String timeout = env.get("MDFLOW_COMMAND_TIMEOUT");
        if (timeout != null && !timeout.isBlank()) {
            builder.commandTimeout(toDuration("MDFLOW_COMMAND_TIMEOUT", timeout, "environment"));
        }
    }

    private static int toInt(String key, Object value, String source) {
        if (value instanceof Long n) {
            return Math.toIntExact(n);
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Setting '" + key + "' in " + source + " must be an integer: " + value, ex);
        }
    }

    private static Duration toDuration(String key, Object value, String source) {
        if (value instanceof Long n) {
            return Duration.ofMillis(n);
        }
        try {
            return DurationParser.parse(String.valueOf(value))
                .orElseThrow(() -> new IllegalArgumentException("Setting '" + key + "' in " + source + " is empty"));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Setting '" + key + "' in " + source + " is not a duration: " + value, ex);
        }
    }
}
