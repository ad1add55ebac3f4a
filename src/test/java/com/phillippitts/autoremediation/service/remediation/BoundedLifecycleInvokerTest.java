package com.phillippitts.autoremediation.service.remediation;

import com.phillippitts.autoremediation.config.properties.LifecycleProperties;
import com.phillippitts.autoremediation.domain.ActionType;
import com.phillippitts.autoremediation.exception.LifecycleException;
import com.phillippitts.autoremediation.service.remediation.LifecycleTestDoubles.ProcessBehavior;
import com.phillippitts.autoremediation.service.remediation.LifecycleTestDoubles.RecordingProcessFactory;
import com.phillippitts.autoremediation.testutil.ScriptedLifecycleProvider;
import com.phillippitts.autoremediation.testutil.SyncExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class BoundedLifecycleInvokerTest {

    private ThreadPoolTaskExecutor pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdown();
        }
    }

    private static RemediationPlan plan(ActionType type) {
        return new RemediationPlan(type, "ar_app", "test");
    }

    @Test
    void shouldMapActionTypesToProviderCalls() {
        ScriptedLifecycleProvider provider = ScriptedLifecycleProvider.alwaysSucceeding();
        BoundedLifecycleInvoker invoker = new BoundedLifecycleInvoker(provider, new SyncExecutor());

        invoker.invoke(plan(ActionType.RESTART_CONTAINER), Duration.ofSeconds(1));
        invoker.invoke(plan(ActionType.SCALE_UP), Duration.ofSeconds(1));
        invoker.invoke(plan(ActionType.SCALE_DOWN), Duration.ofSeconds(1));

        assertThat(provider.calls()).containsExactly("restart:ar_app", "scale:ar_app:1", "scale:ar_app:-1");
    }

    @Test
    void shouldPassCallTimeoutToProvider() {
        ScriptedLifecycleProvider provider = ScriptedLifecycleProvider.alwaysSucceeding();
        BoundedLifecycleInvoker invoker = new BoundedLifecycleInvoker(provider, new SyncExecutor());

        invoker.invoke(plan(ActionType.RESTART_CONTAINER), Duration.ofSeconds(7));
        invoker.invoke(plan(ActionType.SCALE_UP), Duration.ofMillis(1500));

        assertThat(provider.timeouts()).containsExactly(Duration.ofSeconds(7), Duration.ofMillis(1500));
    }

    @Test
    void shouldLetCommandRunForTheWholeCallBound() {
        RecordingProcessFactory factory = new RecordingProcessFactory(new ProcessBehavior("", "", 0, 400));
        CommandLifecycleProvider provider = new CommandLifecycleProvider(new LifecycleProperties(), factory);
        BoundedLifecycleInvoker invoker = new BoundedLifecycleInvoker(provider, new SyncExecutor());

        LifecycleResult result = invoker.invoke(plan(ActionType.RESTART_CONTAINER), Duration.ofSeconds(5));

        assertThat(result.success()).isTrue();
        assertThat(factory.processes.get(0).wasDestroyCalled()).isFalse();
    }

    @Test
    void shouldGiveHealRestartOnlyTimeLeftAfterHealthCheck() {
        ScriptedLifecycleProvider provider = ScriptedLifecycleProvider.alwaysSucceeding();
        provider.setHealth(LifecycleResult.failed("ar_app not running: false"));
        BoundedLifecycleInvoker invoker = new BoundedLifecycleInvoker(provider, new SyncExecutor());

        invoker.invoke(plan(ActionType.HEAL), Duration.ofSeconds(5));

        List<Duration> timeouts = provider.timeouts();
        assertThat(timeouts).hasSize(2);
        assertThat(timeouts.get(0)).isEqualTo(Duration.ofSeconds(5));
        assertThat(timeouts.get(1)).isPositive().isLessThanOrEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void shouldRecordManualInterventionWithoutProviderCall() {
        LifecycleProvider provider = mock(LifecycleProvider.class);
        BoundedLifecycleInvoker invoker = new BoundedLifecycleInvoker(provider, new SyncExecutor());

        LifecycleResult result = invoker.invoke(plan(ActionType.MANUAL), Duration.ofSeconds(1));

        assertThat(result.success()).isTrue();
        verifyNoInteractions(provider);
    }

    @Test
    void shouldSkipRestartWhenHealthCheckReportsHealthy() {
        ScriptedLifecycleProvider provider = ScriptedLifecycleProvider.alwaysSucceeding();
        BoundedLifecycleInvoker invoker = new BoundedLifecycleInvoker(provider, new SyncExecutor());

        LifecycleResult result = invoker.invoke(plan(ActionType.HEAL), Duration.ofSeconds(1));

        assertThat(result.success()).isTrue();
        assertThat(provider.calls()).containsExactly("health:ar_app");
    }

    @Test
    void shouldRestartWhenHealthCheckReportsUnhealthy() {
        ScriptedLifecycleProvider provider = ScriptedLifecycleProvider.alwaysSucceeding();
        provider.setHealth(LifecycleResult.failed("ar_app not running: false"));
        BoundedLifecycleInvoker invoker = new BoundedLifecycleInvoker(provider, new SyncExecutor());

        LifecycleResult result = invoker.invoke(plan(ActionType.HEAL), Duration.ofSeconds(1));

        assertThat(result.success()).isTrue();
        assertThat(provider.calls()).containsExactly("health:ar_app", "restart:ar_app");
    }

    @Test
    void shouldConvertProviderExceptionToFailedResult() {
        LifecycleProvider provider = mock(LifecycleProvider.class);
        when(provider.restart(anyString(), any(Duration.class))).thenThrow(new LifecycleException("Cannot start 'docker'", "ar_app"));
        BoundedLifecycleInvoker invoker = new BoundedLifecycleInvoker(provider, new SyncExecutor());

        LifecycleResult result = invoker.invoke(plan(ActionType.RESTART_CONTAINER), Duration.ofSeconds(1));

        assertThat(result.success()).isFalse();
        assertThat(result.detail()).contains("Cannot start 'docker'");
    }

    @Test
    void shouldFailAndInterruptCallThatExceedsTimeout() throws InterruptedException {
        pool = new ThreadPoolTaskExecutor();
        pool.setCorePoolSize(1);
        pool.setMaxPoolSize(1);
        pool.initialize();
        CountDownLatch started = new CountDownLatch(1);
        AtomicBoolean interrupted = new AtomicBoolean();
        LifecycleProvider stuck = new ScriptedLifecycleProvider(LifecycleResult.ok("late")) {
            @Override
            public LifecycleResult restart(String target, Duration timeout) {
                started.countDown();
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    interrupted.set(true);
                    Thread.currentThread().interrupt();
                }
                return LifecycleResult.ok("late");
            }
        };
        BoundedLifecycleInvoker invoker = new BoundedLifecycleInvoker(stuck, pool);

        long start = System.nanoTime();
        LifecycleResult result = invoker.invoke(plan(ActionType.RESTART_CONTAINER), Duration.ofMillis(100));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(started.await(1, TimeUnit.SECONDS)).isTrue();
        assertThat(result.success()).isFalse();
        assertThat(result.detail()).isEqualTo("timed out after 100 ms");
        assertThat(elapsedMs).isLessThan(5_000);
        await().atMost(Duration.ofSeconds(2)).untilTrue(interrupted);
    }
}
