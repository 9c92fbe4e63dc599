package work.mdflow.expand.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.mdflow.expand.support.ExpansionTestSupport.limits;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import work.mdflow.expand.directive.ImportAction;
import work.mdflow.expand.resolve.ImportResolver;

class ImportExpanderConcurrencyTest {
    private static final Path DIR = Path.of(".").toAbsolutePath();

    private static String fiveImports() {
        return "@./a.md @./b.md @./c.md @./d.md @./e.md";
    }

    private static final class InFlightResolver implements ImportResolver {
        private final AtomicInteger inFlight = new AtomicInteger();
        private final AtomicInteger maxInFlight = new AtomicInteger();

        @Override
        public String resolve(
            ImportAction action,
            Path currentDirectory,
            ImportStack stack,
            ResolutionContext context,
            NestedExpander nested
        ) {
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(100);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(ex);
            } finally {
                inFlight.decrementAndGet();
            }
            return action.originalText().substring(3, 4).toUpperCase();
        }
    }

    @Test
    void concurrencyOneResolvesSequentially() {
        var resolver = new InFlightResolver();
        try (var expander = new ImportExpander(limits().toBuilder().concurrency(1).build(), resolver)) {
            assertEquals("A B C D E", expander.expand(fiveImports(), DIR, ResolutionContext.defaults()));
        }
        assertEquals(1, resolver.maxInFlight.get());
    }

    @Test
    void concurrencyBoundsInFlightResolutions() {
        var resolver = new InFlightResolver();
        try (var expander = new ImportExpander(limits().toBuilder().concurrency(3).build(), resolver)) {
            assertEquals("A B C D E", expander.expand(fiveImports(), DIR, ResolutionContext.defaults()));
        }
        assertTrue(resolver.maxInFlight.get() <= 3, "max in flight " + resolver.maxInFlight.get());
        assertTrue(resolver.maxInFlight.get() >= 2, "max in flight " + resolver.maxInFlight.get());
    }

    @Test
    void waitingActionsDoNotOccupyWorkers() throws Exception {
        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        ImportResolver resolver = (action, currentDirectory, stack, context, nested) -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(ex);
            }
            return action.originalText().substring(3, 4);
        };
        var pool = (ThreadPoolExecutor) ExpanderThreads.newPool("mdflow-import-test");
        try (var expander = new ImportExpander(limits().toBuilder().concurrency(1).build(), resolver, pool)) {
            var result = CompletableFuture.supplyAsync(
                () -> expander.expand(fiveImports(), DIR, ResolutionContext.defaults())
            );
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            Thread.sleep(200);

            assertEquals(1, pool.getActiveCount());
            assertEquals(1, pool.getPoolSize());

            release.countDown();
            assertEquals("a b c d e", result.get(10, TimeUnit.SECONDS));
        }
    }

    @Test
    void outputFollowsSourceOrderNotCompletionOrder() {
        ImportResolver reversed = (action, currentDirectory, stack, context, nested) -> {
            long delay = 200L - action.sourceIndex() * 4L;
            try {
                Thread.sleep(Math.max(delay, 0));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(ex);
            }
            return action.originalText().substring(3, 4);
        };
        try (var expander = new ImportExpander(limits(), reversed)) {
            assertEquals("a b c d e", expander.expand(fiveImports(), DIR, ResolutionContext.defaults()));
        }
    }

    @Test
    void firstFailureCancelsSiblings() throws Exception {
        var sibling = new CountDownLatch(1);
        var interrupted = new AtomicBoolean();
        ImportResolver resolver = (action, currentDirectory, stack, context, nested) -> {
            if (action.sourceIndex() == 0) {
                try {
                    sibling.countDown();
                    Thread.sleep(10_000);
                } catch (InterruptedException ex) {
                    interrupted.set(true);
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(ex);
                }
                return "late";
            }
            try {
                sibling.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(ex);
            }
            throw new ImportException(ImportFailure.IMPORT_NOT_FOUND, "Import not found: ./b.md", null);
        };

        try (var expander = new ImportExpander(limits(), resolver)) {
            var ex = assertThrows(ImportException.class, () -> expander.expand("@./a.md @./b.md", DIR, ResolutionContext.defaults()));
            assertEquals(ImportFailure.IMPORT_NOT_FOUND, ex.failure());
        }
        for (int i = 0; i < 50 && !interrupted.get(); i++) {
            Thread.sleep(20);
        }
        assertTrue(interrupted.get());
    }

    @Test
    void nestedLevelsDoNotDeadlockWithSmallConcurrency() {
        ImportResolver resolver = (action, currentDirectory, stack, context, nested) -> {
            if (stack.depth() < 3) {
                return nested.expand("@./x.md @./y.md", currentDirectory, stack.push(Path.of("/" + stack.depth())), context);
            }
            return "leaf";
        };
        try (var expander = new ImportExpander(limits().toBuilder().concurrency(1).build(), resolver)) {
            var result = expander.expand("@./root.md", DIR, ResolutionContext.defaults());
            assertEquals(8, result.split("leaf", -1).length - 1);
        }
    }
}
