package com.phillippitts.geminibridge.service.cli.process;

import com.phillippitts.geminibridge.util.ProcessTimeouts;
import com.phillippitts.geminibridge.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs one external command to completion with bounded output capture and a hard timeout.
 *
 * <p>Responsibilities:
 * - Start the process via {@link ProcessFactory}
 * - Feed stdin on a separate thread so a process that never reads cannot block the caller
 * - Capture stdout and stderr concurrently, each with a byte cap
 * - Enforce the timeout and terminate runaway processes (graceful, then forcible)
 *
 * <p>Unlike a process manager bound to a single child, every call keeps its own state, so one
 * instance is safe to share between concurrent requests.
 */
public final class ProcessRunner {

    private static final Logger LOG = LogManager.getLogger(ProcessRunner.class);

    private final ProcessFactory processFactory;

    public ProcessRunner(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    /**
     * Holds process execution state including process reference and stream gobblers.
     */
    private record ProcessExecution(
            Process process,
            Thread outGobbler,
            Thread errGobbler,
            ByteArrayOutputStream stdout,
            ByteArrayOutputStream stderr
    ) {}

    /**
     * Runs the command and waits for it to finish or time out.
     *
     * @param command full command line
     * @param workingDir working directory (may be null)
     * @param stdin text written to the process' stdin as UTF-8 (null closes stdin immediately)
     * @param timeout wall-clock budget
     * @param maxStdoutBytes stdout cap
     * @param maxStderrBytes stderr cap
     * @param label short name used for gobbler threads and log lines
     * @return outcome; {@link ProcessOutcome#timedOut()} is set when the process was killed
     * @throws IOException if the process cannot be started
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public ProcessOutcome run(List<String> command,
                              Path workingDir,
                              String stdin,
                              Duration timeout,
                              int maxStdoutBytes,
                              int maxStderrBytes,
                              String label) throws IOException, InterruptedException {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(timeout, "timeout");
        long startTime = System.nanoTime();

        ProcessExecution exec = start(command, workingDir, stdin, maxStdoutBytes, maxStderrBytes, label);
        try {
            boolean finished = exec.process().waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                LOG.warn("Process '{}' exceeded {}ms; terminating", label, timeout.toMillis());
                destroyProcess(exec.process());
                joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
                joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
                return new ProcessOutcome(-1, snapshot(exec.stdout()), snapshot(exec.stderr()), true,
                        TimeUtils.elapsedMillis(startTime));
            }

            // Ensure gobblers have a moment to flush
            joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);

            int exitCode = exec.process().exitValue();
            LOG.debug("Process '{}' exited code={} stdout={}B stderr={}B", label, exitCode,
                    exec.stdout().size(), exec.stderr().size());
            return new ProcessOutcome(exitCode, snapshot(exec.stdout()), snapshot(exec.stderr()), false,
                    TimeUtils.elapsedMillis(startTime));
        } catch (InterruptedException e) {
            destroyProcess(exec.process());
            throw e;
        } finally {
            if (exec.process().isAlive()) {
                destroyProcess(exec.process());
            }
        }
    }

    private ProcessExecution start(List<String> command,
                                   Path workingDir,
                                   String stdin,
                                   int maxStdoutBytes,
                                   int maxStderrBytes,
                                   String label) throws IOException {
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        ByteArrayOutputStream stderr = new ByteArrayOutputStream();

        Process process = processFactory.start(command, workingDir);

        // Start gobblers before waiting to avoid deadlock
        Thread outGobbler = startGobbler(process.getInputStream(), stdout, label + "-out", maxStdoutBytes);
        Thread errGobbler = startGobbler(process.getErrorStream(), stderr, label + "-err", maxStderrBytes);
        feedStdin(process, stdin, label);

        return new ProcessExecution(process, outGobbler, errGobbler, stdout, stderr);
    }

    private void feedStdin(Process process, String stdin, String label) {
        Thread feeder = new Thread(() -> {
            try (OutputStream os = process.getOutputStream()) {
                if (stdin != null) {
                    os.write(stdin.getBytes(StandardCharsets.UTF_8));
                    os.flush();
                }
            } catch (IOException e) {
                LOG.debug("Stdin feeder '{}' stopped: {}", label, e.toString());
            }
        }, label + "-in");
        feeder.setDaemon(true);
        feeder.start();
    }

    private static String snapshot(ByteArrayOutputStream sink) {
        synchronized (sink) {
            return sink.toString(StandardCharsets.UTF_8);
        }
    }

    private Thread startGobbler(InputStream inputStream, ByteArrayOutputStream sink, String name, int maxBytes) {
        StreamGobbler gobbler = new StreamGobbler(inputStream, sink, name, maxBytes);
        Thread thread = new Thread(gobbler, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Copies raw bytes from an input stream into a buffer until the cap is reached. Output is
     * kept byte for byte (line endings included) and decoded as UTF-8 only when read. Once the
     * cap is hit, continues draining the stream without accumulating to prevent deadlock, but
     * logs a warning to indicate data loss.
     */
    private static final class StreamGobbler implements Runnable {
        private static final int BUFFER_SIZE = 8192;

        private final InputStream inputStream;
        private final ByteArrayOutputStream sink;
        private final String name;
        private final int maxBytes;

        StreamGobbler(InputStream inputStream, ByteArrayOutputStream sink, String name, int maxBytes) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxBytes = maxBytes;
        }

        @Override
        public void run() {
            byte[] buffer = new byte[BUFFER_SIZE];
            boolean capReached = false;
            try (InputStream in = inputStream) {
                int read;
                while ((read = in.read(buffer)) != -1) {
                    if (capReached) {
                        continue;
                    }
                    synchronized (sink) {
                        int available = maxBytes - sink.size();
                        if (read > available) {
                            sink.write(buffer, 0, Math.max(0, available));
                            LOG.warn("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                            capReached = true;
                        } else {
                            sink.write(buffer, 0, read);
                        }
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying process");
        } catch (RuntimeException e) {
            LOG.warn("Error destroying process: {}", e.toString());
        }
    }
}
