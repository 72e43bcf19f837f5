package org.neuralchilli.qrun.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes task commands through the platform shell with output capture.
 * <p>
 * stdout and stderr are drained by two independent pumps so a full pipe on
 * one stream never stalls the other. Both are always buffered in memory;
 * in stream mode every chunk is also copied to the console as it arrives.
 * <p>
 * With a timeout, process exit races the deadline. When the deadline wins
 * the process tree is killed, its termination awaited, and a
 * {@link CommandException.Kind#TIMEOUT} raised.
 */
public class ShellCommandExecutor implements CommandExecutor, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ShellCommandExecutor.class);

    private static final int CHUNK_SIZE = 8192;
    private static final long PUMP_GRACE_MILLIS = 2000;

    private final ConsoleSink console;
    private final ExecutorService pumps;

    public ShellCommandExecutor(ConsoleSink console) {
        this.console = console;
        this.pumps = Executors.newCachedThreadPool(new PumpThreadFactory());
    }

    @Override
    public ProcessOutput run(String command, Path workingDirectory, Duration timeout, boolean stream) {
        log.debug("Executing command: {}", command);

        Process process;
        try {
            ProcessBuilder pb = new ProcessBuilder(shellCommand(command));
            if (workingDirectory != null) {
                pb.directory(workingDirectory.toFile());
            }
            process = pb.start();
        } catch (IOException e) {
            throw CommandException.io(command, e);
        }

        closeStdin(process);

        CompletableFuture<byte[]> stdout = CompletableFuture.supplyAsync(
                () -> pump(process.getInputStream(), stream ? console::writeStdout : null), pumps);
        CompletableFuture<byte[]> stderr = CompletableFuture.supplyAsync(
                () -> pump(process.getErrorStream(), stream ? console::writeStderr : null), pumps);

        try {
            if (timeout != null) {
                boolean completed = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
                if (!completed) {
                    kill(process);
                    process.waitFor();
                    drainQuietly(stdout);
                    drainQuietly(stderr);
                    throw CommandException.timeout(command, timeout);
                }
            } else {
                process.waitFor();
            }

            return new ProcessOutput(process.exitValue(), await(stdout, command), await(stderr, command));

        } catch (InterruptedException e) {
            kill(process);
            Thread.currentThread().interrupt();
            throw CommandException.io(command, e);
        }
    }

    static List<String> shellCommand(String command) {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (os.startsWith("windows")) {
            return List.of("cmd", "/C", command);
        }
        return List.of("sh", "-c", command);
    }

    private static void closeStdin(Process process) {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of process {}: {}", process.pid(), e.getMessage());
        }
    }

    /**
     * Kill the process and everything it spawned, so no orphan keeps the pipes open.
     */
    private static void kill(Process process) {
        try {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
        } catch (RuntimeException e) {
            log.warn("Failed to kill timed-out process {}: {}", process.pid(), e.getMessage());
        }
    }

    private static byte[] pump(InputStream in, ChunkWriter live) {
        ByteArrayOutputStream collected = new ByteArrayOutputStream();
        byte[] buffer = new byte[CHUNK_SIZE];
        try (in) {
            int n;
            while ((n = in.read(buffer)) != -1) {
                collected.write(buffer, 0, n);
                if (live != null) {
                    live.write(buffer, 0, n);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return collected.toByteArray();
    }

    private static byte[] await(CompletableFuture<byte[]> pump, String command) throws InterruptedException {
        try {
            return pump.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() instanceof UncheckedIOException unchecked
                    ? unchecked.getCause()
                    : e.getCause();
            throw CommandException.io(command, cause);
        }
    }

    /**
     * After a kill the pumps hit end-of-stream; their content is discarded.
     */
    private static void drainQuietly(CompletableFuture<byte[]> pump) throws InterruptedException {
        try {
            pump.get(PUMP_GRACE_MILLIS, TimeUnit.MILLISECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.debug("Output pump did not finish cleanly after kill: {}", e.toString());
            pump.cancel(true);
        }
    }

    @Override
    public void close() {
        pumps.shutdownNow();
    }

    @FunctionalInterface
    private interface ChunkWriter {
        void write(byte[] buffer, int offset, int length);
    }

    private static class PumpThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r);
            t.setName("qrun-io-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
