package com.phillippitts.geminibridge.service.cli.process;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Shared test doubles for process execution tests.
 * Provides fake Process implementations for hermetic testing without real gemini or docker binaries.
 */
public final class ProcessTestDoubles {

    private ProcessTestDoubles() {}

    /**
     * Encapsulates test process behavior configuration.
     *
     * @param stdout stdout content to return
     * @param stderr stderr content to return
     * @param exitCode process exit code
     * @param finishAfterMillis delay before process finishes (-1 means never finish)
     */
    public record ProcessBehavior(String stdout, String stderr, int exitCode, long finishAfterMillis) {

        public static ProcessBehavior exits(int exitCode, String stdout, String stderr) {
            return new ProcessBehavior(stdout, stderr, exitCode, 0);
        }

        public static ProcessBehavior hangs() {
            return new ProcessBehavior("", "", 0, -1);
        }
    }

    /**
     * Stub ProcessFactory that returns a pre-configured Process and records what was started.
     */
    public static final class StubProcessFactory implements ProcessFactory {
        private final Process p;
        private volatile List<String> lastCommand;
        private volatile Path lastWorkingDir;

        public StubProcessFactory(Process p) {
            this.p = p;
        }

        @Override
        public Process start(List<String> command, Path workingDir) {
            this.lastCommand = List.copyOf(command);
            this.lastWorkingDir = workingDir;
            return p;
        }

        public List<String> lastCommand() {
            return lastCommand;
        }

        public Path lastWorkingDir() {
            return lastWorkingDir;
        }
    }

    /**
     * ProcessFactory that answers each command with a behavior chosen by the test.
     */
    public static final class ScriptedProcessFactory implements ProcessFactory {
        private final Function<List<String>, ProcessBehavior> script;
        private final List<List<String>> commands = new CopyOnWriteArrayList<>();

        public ScriptedProcessFactory(Function<List<String>, ProcessBehavior> script) {
            this.script = script;
        }

        @Override
        public Process start(List<String> command, Path workingDir) {
            commands.add(List.copyOf(command));
            return new TestProcess(script.apply(command));
        }

        public List<List<String>> commands() {
            return commands;
        }
    }

    /**
     * Minimal fake Process that allows controlling stdout/stderr, exit code, and termination timing.
     * Enables hermetic testing without spawning real subprocesses.
     */
    public static final class TestProcess extends Process {
        private final byte[] out;
        private final byte[] err;
        private final int exitCode;
        private final long finishAfterMillis;
        private final ByteArrayOutputStream stdin = new ByteArrayOutputStream();
        private volatile boolean alive = true;
        private volatile boolean destroyCalled = false;

        public TestProcess(ProcessBehavior behavior) {
            this.out = behavior.stdout().getBytes(StandardCharsets.UTF_8);
            this.err = behavior.stderr().getBytes(StandardCharsets.UTF_8);
            this.exitCode = behavior.exitCode();
            this.finishAfterMillis = behavior.finishAfterMillis();

            if (finishAfterMillis == 0) {
                this.alive = false;
            } else if (finishAfterMillis > 0) {
                Thread finisher = new Thread(() -> {
                    try {
                        Thread.sleep(finishAfterMillis);
                        alive = false;
                    } catch (InterruptedException ignored) {
                        Thread.currentThread().interrupt();
                    }
                }, "test-proc-finisher");
                finisher.setDaemon(true);
                finisher.start();
            }
        }

        public boolean wasDestroyCalled() {
            return destroyCalled;
        }

        public String writtenStdin() {
            synchronized (stdin) {
                return stdin.toString(StandardCharsets.UTF_8);
            }
        }

        @Override
        public OutputStream getOutputStream() {
            return new OutputStream() {
                @Override
                public void write(int b) {
                    synchronized (stdin) {
                        stdin.write(b);
                    }
                }

                @Override
                public void write(byte[] b, int off, int len) {
                    synchronized (stdin) {
                        stdin.write(b, off, len);
                    }
                }
            };
        }

        @Override
        public InputStream getInputStream() {
            return new ByteArrayInputStream(out);
        }

        @Override
        public InputStream getErrorStream() {
            return new ByteArrayInputStream(err);
        }

        @Override
        public int waitFor() {
            this.alive = false;
            return exitCode;
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
            long ms = unit.toMillis(timeout);
            if (destroyCalled) {
                return true;
            }
            if (finishAfterMillis < 0) {
                Thread.sleep(ms);
                return false; // still alive
            }
            if (finishAfterMillis <= ms) {
                Thread.sleep(Math.max(0, finishAfterMillis));
                this.alive = false;
                return true;
            } else {
                Thread.sleep(ms);
                return false;
            }
        }

        @Override
        public int exitValue() {
            return exitCode;
        }

        @Override
        public void destroy() {
            destroyCalled = true;
            alive = false;
        }

        @Override
        public Process destroyForcibly() {
            destroyCalled = true;
            alive = false;
            return this;
        }

        @Override
        public boolean isAlive() {
            return alive;
        }
    }
}
