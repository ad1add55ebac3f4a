package com.phillippitts.autoremediation.service.remediation;

import com.phillippitts.autoremediation.config.properties.LifecycleProperties;
import com.phillippitts.autoremediation.exception.LifecycleException;
import com.phillippitts.autoremediation.util.LogSanitizer;
import com.phillippitts.autoremediation.util.ProcessTimeouts;
import com.phillippitts.autoremediation.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * {@link LifecycleProvider} that runs the configured command templates (Docker CLI by default).
 *
 * <p>Templates are split on whitespace first and placeholders are substituted per argument, so a
 * target can never add arguments. No shell is involved. Each process is bounded by the timeout
 * passed with the call and destroyed when it overruns or the calling thread is interrupted.
 *
 * <p>Replica counts for scaling are tracked per target, starting at
 * {@code remediation.lifecycle.initial-replicas}.
 */
@Component
public class CommandLifecycleProvider implements LifecycleProvider {

    private static final Logger LOG = LogManager.getLogger(CommandLifecycleProvider.class);

    private static final Pattern VALID_TARGET = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_.-]*");

    private final LifecycleProperties props;
    private final ProcessFactory processFactory;
    private final ConcurrentMap<String, Integer> replicas = new ConcurrentHashMap<>();

    /** Captured result of one finished process. */
    private record CommandOutput(int exitCode, String stdout, String stderr) {}

    @Autowired
    public CommandLifecycleProvider(LifecycleProperties props) {
        this(props, new DefaultProcessFactory());
    }

    CommandLifecycleProvider(LifecycleProperties props, ProcessFactory processFactory) {
        this.props = Objects.requireNonNull(props, "props");
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    @Override
    public LifecycleResult restart(String target, Duration timeout) {
        CommandOutput out = run(expand(props.getRestartCommand(), target, null), target, timeout);
        if (out.exitCode() != 0) {
            return LifecycleResult.failed("restart exited " + out.exitCode() + ": " + out.stderr());
        }
        return LifecycleResult.ok("restarted " + target);
    }

    @Override
    public LifecycleResult scale(String target, int delta, Duration timeout) {
        validateTarget(target);
        synchronized (replicas) {
            int current = replicas.getOrDefault(target, props.getInitialReplicas());
            int desired = Math.max(0, current + delta);
            if (desired == current) {
                return LifecycleResult.ok(target + " already at " + current + " replicas");
            }
            CommandOutput out = run(expand(props.getScaleCommand(), target, desired), target, timeout);
            if (out.exitCode() != 0) {
                return LifecycleResult.failed("scale exited " + out.exitCode() + ": " + out.stderr());
            }
            replicas.put(target, desired);
            LOG.info("Scaled {} from {} to {} replicas", target, current, desired);
            return LifecycleResult.ok("scaled " + target + " to " + desired + " replicas");
        }
    }

    @Override
    public LifecycleResult health(String target, Duration timeout) {
        CommandOutput out = run(expand(props.getHealthCommand(), target, null), target, timeout);
        if (out.exitCode() == 0 && "true".equalsIgnoreCase(out.stdout().trim())) {
            return LifecycleResult.ok(target + " running");
        }
        String state = out.exitCode() == 0 ? out.stdout() : out.stderr();
        return LifecycleResult.failed(target + " not running: " + state);
    }

    /** Visible for tests */
    int replicas(String target) {
        return replicas.getOrDefault(target, props.getInitialReplicas());
    }

    // Package-private for tests
    List<String> expand(String template, String target, Integer replicaCount) {
        validateTarget(target);
        List<String> command = new ArrayList<>();
        for (String token : template.trim().split("\\s+")) {
            String arg = token.replace("{target}", target);
            if (replicaCount != null) {
                arg = arg.replace("{replicas}", String.valueOf(replicaCount));
            }
            command.add(arg);
        }
        return command;
    }

    private static void validateTarget(String target) {
        if (target == null || !VALID_TARGET.matcher(target).matches()) {
            throw new LifecycleException("Invalid lifecycle target: '" + target + "'", String.valueOf(target));
        }
    }

    private CommandOutput run(List<String> command, String target, Duration timeout) {
        long start = System.nanoTime();
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Process process;
        try {
            process = processFactory.start(command);
        } catch (IOException e) {
            throw new LifecycleException("Cannot start '" + command.get(0) + "': " + e.getMessage(), target, e);
        }
        Thread outGobbler = startGobbler(process.getInputStream(), stdout, "lifecycle-out");
        Thread errGobbler = startGobbler(process.getErrorStream(), stderr, "lifecycle-err");
        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                destroyProcess(process);
                throw new LifecycleException("Command timed out after " + timeout.toMillis() + " ms", target);
            }
            joinQuietly(outGobbler);
            joinQuietly(errGobbler);
            int exit = process.exitValue();
            LOG.debug("Command {} exited {} in {} ms", command, exit, TimeUtils.elapsedMillis(start));
            return new CommandOutput(exit,
                    LogSanitizer.singleLine(snapshot(stdout), ProcessTimeouts.MAX_OUTPUT_CHARS),
                    LogSanitizer.singleLine(snapshot(stderr), ProcessTimeouts.MAX_OUTPUT_CHARS));
        } catch (InterruptedException e) {
            destroyProcess(process);
            Thread.currentThread().interrupt();
            throw new LifecycleException("Interrupted while running lifecycle command", target, e);
        }
    }

    private static String snapshot(StringBuilder sb) {
        synchronized (sb) {
            return sb.toString();
        }
    }

    private static Thread startGobbler(InputStream inputStream, StringBuilder sink, String name) {
        Thread thread = new Thread(() -> {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = br.readLine()) != null) {
                    synchronized (sink) {
                        // Keep draining past the cap so the process never blocks on a full pipe
                        if (sink.length() < ProcessTimeouts.MAX_OUTPUT_CHARS) {
                            if (sink.length() > 0) {
                                sink.append('\n');
                            }
                            sink.append(line);
                        }
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private static void joinQuietly(Thread thread) {
        try {
            thread.join(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void destroyProcess(Process process) {
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
            process.destroyForcibly();
            Thread.currentThread().interrupt();
        }
    }
}
