package work.mdflow.expand.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.mdflow.expand.support.ExpansionTestSupport.write;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ExpansionSettingsLoaderTest {
    @TempDir
    Path dir;

    @Test
    void defaultsWithoutAnySource() throws Exception {
        var home = Files.createDirectories(dir.resolve("home"));
        var project = Files.createDirectories(dir.resolve("project"));

        var limits = new ExpansionSettingsLoader(Map.of(), home).load(project);

        assertEquals(ExpansionLimits.defaults(), limits);
        assertEquals(limits.commandTimeout(), limits.codeFenceTimeout());
        assertEquals(10, limits.concurrency());
    }

    @Test
    void projectFileOverridesHomeFile() throws Exception {
        var home = dir.resolve("home");
        write(home, ".mdflow/config.toml", """
            [imports]
            concurrency = 4
            command-timeout = "45s"
            """);
        write(dir, "project/.mdflow.toml", """
            [imports]
            concurrency = 2
            max-file-size = "1MB"
            code-fence-timeout = "2m"
            tool-command = "agent"
            """);
        var nested = Files.createDirectories(dir.resolve("project/docs/deep"));

        var limits = new ExpansionSettingsLoader(Map.of(), home).load(nested);

        assertEquals(2, limits.concurrency());
        assertEquals(Duration.ofSeconds(45), limits.commandTimeout());
        assertEquals(Duration.ofMinutes(2), limits.codeFenceTimeout());
        assertEquals(1024L * 1024, limits.maxFileBytes());
        assertEquals("agent", limits.toolCommand());
    }

    @Test
    void environmentWinsOverFiles() throws Exception {
        write(dir, "project/.mdflow.toml", """
            [imports]
            context-window = 50000
            command-timeout = 1000
            """);
        var env = Map.of(
            "MA_CONTEXT_WINDOW", "64000",
            "MA_FORCE_CONTEXT", "1",
            "MDFLOW_COMMAND_TIMEOUT", "5s"
        );

        var limits = new ExpansionSettingsLoader(env, dir.resolve("home")).load(dir.resolve("project"));

        assertEquals(64_000, limits.contextWindowTokens());
        assertTrue(limits.forceContext());
        assertEquals(Duration.ofSeconds(5), limits.commandTimeout());
    }

    @Test
    void modelSelectsContextWindow() {
        var limits = new ExpansionSettingsLoader(Map.of("MA_MODEL", "claude-sonnet"), dir).load(dir);

        assertEquals(200_000, limits.contextWindowTokens());
        assertEquals(ExpansionLimits.DEFAULT_CONTEXT_WINDOW, ExpansionLimits.contextWindowFor("some-local-model"));
    }

    @Test
    void forceContextFalseValues() {
        var limits = new ExpansionSettingsLoader(Map.of("MA_FORCE_CONTEXT", "false"), dir).load(dir);

        assertFalse(limits.forceContext());
    }

    @Test
    void rejectsMalformedToml() throws Exception {
        write(dir, "project/.mdflow.toml", "[imports\nconcurrency = ");

        var loader = new ExpansionSettingsLoader(Map.of(), dir.resolve("home"));
        var ex = assertThrows(IllegalArgumentException.class, () -> loader.load(dir.resolve("project")));

        assertTrue(ex.getMessage().startsWith("Invalid settings file "));
    }

    @Test
    void rejectsBadDurationNamingTheKey() {
        var loader = new ExpansionSettingsLoader(Map.of("MDFLOW_COMMAND_TIMEOUT", "soon"), dir.resolve("home"));

        var ex = assertThrows(IllegalArgumentException.class, () -> loader.load(dir));

        assertTrue(ex.getMessage().contains("MDFLOW_COMMAND_TIMEOUT"));
    }

    @Test
    void ignoresUnknownKeys() throws Exception {
        write(dir, "project/.mdflow.toml", """
            [imports]
            colour = "blue"
            concurrency = 3
            """);

        var limits = new ExpansionSettingsLoader(Map.of(), dir.resolve("home")).load(dir.resolve("project"));

        assertEquals(3, limits.concurrency());
    }

    @Test
    void toBuilderKeepsCodeFenceTimeoutFollowingCommandTimeout() {
        var limits = ExpansionLimits.defaults().toBuilder().commandTimeout(Duration.ofSeconds(7)).build();

        assertEquals(Duration.ofSeconds(7), limits.codeFenceTimeout());
    }

    @Test
    void rejectsNonPositiveLimits() {
        assertThrows(IllegalArgumentException.class, () -> ExpansionLimits.builder().concurrency(0).build());
        assertThrows(IllegalArgumentException.class, () -> ExpansionLimits.builder().commandTimeout(Duration.ZERO).build());
    }
}
