package com.phillippitts.autoremediation.service.orchestration;

import com.phillippitts.autoremediation.domain.RemediationSettings;
import com.phillippitts.autoremediation.testutil.TestSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MonitoringLoopTest {

    private final RemediationSettings twoServices = new RemediationSettings(List.of("a", "b"),
            TestSettings.thresholds(), TestSettings.limits(), TestSettings.policy(),
            Duration.ofSeconds(3), Duration.ofSeconds(15), Duration.ofSeconds(10), 12);

    private ServiceTickProcessor processor;
    private ServiceLocks locks;

    @BeforeEach
    void setUp() {
        processor = mock(ServiceTickProcessor.class);
        locks = new ServiceLocks();
    }

    @Test
    void shouldProcessEveryServiceWithOneSettingsSnapshot() {
        MonitoringLoop loop = new MonitoringLoop(() -> twoServices, processor, locks, Runnable::run);

        loop.tick();

        verify(processor).process("a", twoServices, 1L);
        verify(processor).process("b", twoServices, 1L);
        assertThat(locks.isBusy("a")).isFalse();
        assertThat(loop.tickCount()).isEqualTo(1);
    }

    @Test
    void shouldSkipServiceStillBusyFromPreviousTick() {
        MonitoringLoop loop = new MonitoringLoop(() -> twoServices, processor, locks, Runnable::run);
        locks.tryAcquire("a");

        loop.tick();

        verify(processor, never()).process(eq("a"), any(), anyLong());
        verify(processor).process("b", twoServices, 1L);
        assertThat(locks.isBusy("a")).isTrue();
    }

    @Test
    void shouldReleaseLockWhenProcessingThrows() {
        when(processor.process(eq("a"), any(), anyLong())).thenThrow(new IllegalStateException("boom"));
        MonitoringLoop loop = new MonitoringLoop(() -> twoServices, processor, locks, Runnable::run);

        loop.tick();

        assertThat(locks.isBusy("a")).isFalse();
        verify(processor).process("b", twoServices, 1L);
    }

    @Test
    void shouldReleaseLockWhenPoolRejects() {
        Executor rejecting = task -> {
            throw new RejectedExecutionException("saturated");
        };
        MonitoringLoop loop = new MonitoringLoop(() -> twoServices, processor, locks, rejecting);

        loop.tick();

        assertThat(locks.isBusy("a")).isFalse();
        assertThat(locks.isBusy("b")).isFalse();
        verify(processor, never()).process(any(), any(), anyLong());
    }

    @Test
    void shouldSkipTickWhenSettingsUnavailable() {
        MonitoringLoop loop = new MonitoringLoop(() -> {
            throw new IllegalStateException("overlay broken");
        }, processor, locks, Runnable::run);

        loop.tick();
        loop.tick();

        assertThat(loop.tickCount()).isEqualTo(2);
        verify(processor, never()).process(any(), any(), anyLong());
    }
}
