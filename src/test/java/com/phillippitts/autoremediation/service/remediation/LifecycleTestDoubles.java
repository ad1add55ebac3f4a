package com.phillippitts.autoremediation.service.remediation;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Fake processes for hermetic tests of {@link CommandLifecycleProvider}.
 */
final class LifecycleTestDoubles {

    private LifecycleTestDoubles() {
    }

    /**
     * @param finishAfterMillis 0 = already exited, negative = never exits on its own
     */
    record ProcessBehavior(String stdout, String stderr, int exitCode, long finishAfterMillis) {

        static ProcessBehavior exits(int code, String stdout, String stderr) {
            return new ProcessBehavior(stdout, stderr, code, 0);
        }

        static ProcessBehavior hangs() {
            return new ProcessBehavior("", "", 0, -1);
        }
    }

    /**
     * Records every command and answers each with the next scripted behavior (the last one repeats).
     */
    static final class RecordingProcessFactory implements ProcessFactory {
        private final List<ProcessBehavior> behaviors;
        final List<List<String>> commands = new ArrayList<>();
        final List<TestProcess> processes = new ArrayList<>();

        RecordingProcessFactory(ProcessBehavior... behaviors) {
            this.behaviors = List.of(behaviors);
        }

        @Override
        public synchronized Process start(List<String> command) {
            commands.add(List.copyOf(command));
            ProcessBehavior behavior = behaviors.get(Math.min(processes.size(), behaviors.size() - 1));
            TestProcess process = new TestProcess(behavior);
            processes.add(process);
            return process;
        }
    }

    /**
     * Minimal fake Process with controlled output, exit code and termination timing.
     */
    static final class TestProcess extends Process {
        private final byte[] out;
        private final byte[] err;
        private final int exitCode;
        private final long finishAfterMillis;
        private volatile boolean alive;
        private volatile boolean destroyCalled;

        TestProcess(ProcessBehavior behavior) {
            this.out = behavior.stdout().getBytes(StandardCharsets.UTF_8);
            this.err = behavior.stderr().getBytes(StandardCharsets.UTF_8);
            this.exitCode = behavior.exitCode();
            this.finishAfterMillis = behavior.finishAfterMillis();
            this.alive = finishAfterMillis != 0;
        }

        boolean wasDestroyCalled() {
            return destroyCalled;
        }

        @Override
        public OutputStream getOutputStream() {
            return new ByteArrayOutputStream();
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
            alive = false;
            return exitCode;
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
            if (!alive) {
                return true;
            }
            long ms = unit.toMillis(timeout);
            if (finishAfterMillis > 0 && finishAfterMillis <= ms) {
                Thread.sleep(finishAfterMillis);
                alive = false;
                return true;
            }
            Thread.sleep(ms);
            return !alive;
        }

        @Override
        public int exitValue() {
            if (alive) {
                throw new IllegalThreadStateException("process has not exited");
            }
            return exitCode;
        }

        @Override
        public void destroy() {
            destroyCalled = true;
            alive = false;
        }

        @Override
        public Process destroyForcibly() {
            destroy();
            return this;
        }

        @Override
        public boolean isAlive() {
            return alive;
        }
    }
}
