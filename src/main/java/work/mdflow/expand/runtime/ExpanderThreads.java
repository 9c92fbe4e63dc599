package work.mdflow.expand.runtime;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Worker pool for import resolution.
 *
 * <p>The pool is unbounded: admission is controlled per nesting level by a semaphore, and a
 * resolving file import blocks its worker while the nested level runs, so a bounded pool could
 * starve the nested level.</p>
 */
final class ExpanderThreads {
    private static final Logger log = LoggerFactory.getLogger(ExpanderThreads.class);

    private ExpanderThreads() {}

    static ExecutorService newPool(String prefix) {
        String threadPrefix = (prefix == null || prefix.isBlank()) ? "mdflow-expand" : prefix;
        AtomicInteger index = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(threadPrefix + "-" + index.getAndIncrement());
            thread.setDaemon(true);
            thread.setUncaughtExceptionHandler((t, ex) -> log.error("Uncaught failure on {}", t.getName(), ex));
            return thread;
        };
        return new ThreadPoolExecutor(
            0,
            Integer.MAX_VALUE,
            30L,
            TimeUnit.SECONDS,
            new SynchronousQueue<>(),
            factory
        );
    }
}
