package work.mdflow.expand.resolve;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a subprocess to completion with both streams captured, bounded by a timeout.
 *
 * <p>The process is destroyed forcibly when the timeout elapses or the calling thread is
 * interrupted.</p>
 */
final class ProcessRunner {
    private static final long DRAIN_GRACE_MILLIS = 2_000;

    private ProcessRunner() {}

    record Completed(int exitCode, byte[] stdout, byte[] stderr) {}

    static Completed run(List<String> command, Path workingDirectory, Map<String, String> environment, Duration timeout)
        throws IOException, TimeoutException {
        ProcessBuilder builder = new ProcessBuilder(command);
        builder.directory(workingDirectory.toFile());
        Map<String, String> env = builder.environment();
        env.clear();
        env.putAll(environment);

        Process process = builder.start();
        process.getOutputStream().close();
        StreamCollector stdout = StreamCollector.start(process.getInputStream(), "stdout");
        StreamCollector stderr = StreamCollector.start(process.getErrorStream(), "stderr");
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
                throw new TimeoutException("Process exceeded " + timeout.toMillis() + "ms");
            }
            byte[] out = stdout.await(DRAIN_GRACE_MILLIS);
            byte[] err = stderr.await(DRAIN_GRACE_MILLIS);
            return new Completed(process.exitValue(), out, err);
        } catch (InterruptedException ex) {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for " + String.join(" ", command), ex);
        }
    }

    private static final class StreamCollector implements Runnable {
        private final InputStream in;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private final Thread thread;
        private volatile IOException failure;

        private StreamCollector(InputStream in, String name) {
            this.in = in;
            this.thread = new Thread(this, "mdflow-process-" + name);
            this.thread.setDaemon(true);
        }

        static StreamCollector start(InputStream in, String name) {
            StreamCollector collector = new StreamCollector(in, name);
            collector.thread.start();
            return collector;
        }

        @Override
        public void run() {
            try (InputStream stream = in) {
                stream.transferTo(buffer);
            } catch (IOException ex) {
                failure = ex;
            }
        }

        byte[] await(long graceMillis) throws InterruptedException {
            thread.join(graceMillis);
            if (failure != null) {
                throw new UncheckedIOException("Failed to read process output", failure);
            }
            return buffer.toByteArray();
        }
    }
}
