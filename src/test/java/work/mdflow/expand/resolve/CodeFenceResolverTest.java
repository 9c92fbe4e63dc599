package work.mdflow.expand.resolve;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.mdflow.expand.support.ExpansionTestSupport.limits;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import work.mdflow.expand.directive.ImportAction.CodeFenceImport;
import work.mdflow.expand.runtime.ImportException;
import work.mdflow.expand.runtime.ImportFailure;
import work.mdflow.expand.runtime.ResolutionContext;

@DisabledOnOs(OS.WINDOWS)
class CodeFenceResolverTest {
    @TempDir
    Path scripts;

    @TempDir
    Path work;

    private static CodeFenceImport fence(String code) {
        return new CodeFenceImport("#!/bin/sh", "sh", code, "```sh\n#!/bin/sh\n" + code + "\n```", 0);
    }

    private ResolutionContext context() {
        return ResolutionContext.builder().invocationDirectory(work).build();
    }

    @Test
    void returnsCombinedOutputAndRemovesScript() throws Exception {
        var resolver = new CodeFenceResolver(limits(), scripts);

        var result = resolver.resolve(fence("echo out\necho err >&2"), work, context());

        assertEquals("{% raw %}\nout\nerr\n{% endraw %}", result);
        assertTrue(isEmpty(scripts));
    }

    @Test
    void runsInInvocationDirectory() throws Exception {
        var resolver = new CodeFenceResolver(limits(), scripts);

        var result = resolver.resolve(fence("pwd"), scripts, context());

        assertEquals("{% raw %}\n" + work.toRealPath() + "\n{% endraw %}", result);
    }

    @Test
    void nonZeroExitFailsAndRemovesScript() throws Exception {
        var resolver = new CodeFenceResolver(limits(), scripts);

        var ex = assertThrows(ImportException.class, () -> resolver.resolve(fence("echo broken >&2\nexit 2"), work, context()));

        assertEquals(ImportFailure.CODE_FENCE_FAILED, ex.failure());
        assertTrue(ex.getMessage().startsWith("Code fence failed (Exit 2): broken"));
        assertTrue(isEmpty(scripts));
    }

    @Test
    void timeoutFailsAndRemovesScript() throws Exception {
        var quick = limits().toBuilder().codeFenceTimeout(Duration.ofMillis(300)).build();
        var resolver = new CodeFenceResolver(quick, scripts);

        var ex = assertThrows(ImportException.class, () -> resolver.resolve(fence("sleep 5"), work, context()));

        assertEquals(ImportFailure.COMMAND_TIMED_OUT, ex.failure());
        assertEquals("Code fence timed out after 300ms: #!/bin/sh", ex.getMessage());
        assertTrue(isEmpty(scripts));
    }

    @Test
    void dryRunWritesNothing() throws Exception {
        var resolver = new CodeFenceResolver(limits(), scripts);
        var context = ResolutionContext.builder().invocationDirectory(work).dryRun(true).build();

        assertEquals("[Dry Run: Code fence not executed]", resolver.resolve(fence("touch made"), work, context));
        assertTrue(isEmpty(scripts));
        assertTrue(Files.notExists(work.resolve("made")));
    }

    @Test
    void scriptNamesCarryLanguageExtension() {
        assertTrue(CodeFenceResolver.scriptName("bash").endsWith(".sh"));
        assertTrue(CodeFenceResolver.scriptName("python").endsWith(".python"));
        assertTrue(CodeFenceResolver.scriptName("ts").startsWith("mdflow-"));
    }

    private static boolean isEmpty(Path directory) throws IOException {
        try (Stream<Path> entries = Files.list(directory)) {
            return entries.findAny().isEmpty();
        }
    }
}
