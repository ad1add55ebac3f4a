package com.phillippitts.autoremediation.service.snapshot;

import com.phillippitts.autoremediation.domain.MetricsSnapshot;
import com.phillippitts.autoremediation.exception.SnapshotUnavailableException;
import com.phillippitts.autoremediation.testutil.MutableClock;
import com.phillippitts.autoremediation.testutil.Snapshots;
import com.phillippitts.autoremediation.testutil.SyncExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class SnapshotCollectorTest {

    private final MutableClock clock = MutableClock.at("2024-05-01T10:00:00Z");
    private ThreadPoolTaskExecutor pool;

    @AfterEach
    void shutdown() {
        if (pool != null) {
            pool.shutdown();
        }
    }

    @Test
    void shouldReturnProviderSnapshot() {
        MetricsSnapshot expected = Snapshots.healthy().cpu(55).build();
        SnapshotCollector collector = new SnapshotCollector(service -> expected, new SyncExecutor(), clock);

        assertThat(collector.collect("ar_app", Duration.ofSeconds(1))).containsSame(expected);
    }

    @Test
    void shouldTurnProviderFailureIntoUnreachableSnapshot() {
        SnapshotCollector collector = new SnapshotCollector(service -> {
            throw new SnapshotUnavailableException("connection_refused", service);
        }, new SyncExecutor(), clock);

        MetricsSnapshot snapshot = collector.collect("ar_app", Duration.ofSeconds(1)).orElseThrow();

        assertThat(snapshot.reachable()).isFalse();
        assertThat(snapshot.unreachableReason()).isEqualTo("connection_refused");
        assertThat(snapshot.observedAt()).isEqualTo(clock.instant());
    }

    @Test
    void shouldCancelAndInterruptSlowProvider() {
        pool = new ThreadPoolTaskExecutor();
        pool.setCorePoolSize(1);
        pool.initialize();
        CountDownLatch started = new CountDownLatch(1);
        AtomicBoolean interrupted = new AtomicBoolean();
        SnapshotCollector collector = new SnapshotCollector(service -> {
            started.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.set(true);
                Thread.currentThread().interrupt();
            }
            return Snapshots.healthy().build();
        }, pool, clock);

        MetricsSnapshot snapshot = collector.collect("ar_app", Duration.ofMillis(100)).orElseThrow();

        assertThat(snapshot.reachable()).isFalse();
        assertThat(snapshot.unreachableReason()).isEqualTo("timeout");
        await().atMost(2, TimeUnit.SECONDS).untilTrue(interrupted);
    }

    @Test
    void shouldReturnNothingWhenPoolRejects() {
        SyncExecutor rejecting = new SyncExecutor() {
            @Override
            public <T> Future<T> submit(Callable<T> task) {
                throw new TaskRejectedException("full");
            }
        };
        SnapshotCollector collector = new SnapshotCollector(service -> Snapshots.healthy().build(), rejecting, clock);

        assertThat(collector.collect("ar_app", Duration.ofSeconds(1))).isEmpty();
    }

    @Test
    void shouldReturnNothingWhenCallerIsInterrupted() {
        pool = new ThreadPoolTaskExecutor();
        pool.setCorePoolSize(1);
        pool.initialize();
        SnapshotCollector collector = new SnapshotCollector(service -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Snapshots.healthy().build();
        }, pool, clock);

        Thread.currentThread().interrupt();
        try {
            assertThat(collector.collect("ar_app", Duration.ofSeconds(1))).isEmpty();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }
}
