package com.phillippitts.autoremediation.service.detect;

import com.phillippitts.autoremediation.domain.MetricsSnapshot;
import com.phillippitts.autoremediation.testutil.Snapshots;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SnapshotHistoryTest {

    @Test
    void shouldKeepNewestSnapshotsUpToCapacity() {
        SnapshotHistory history = new SnapshotHistory();
        for (int i = 1; i <= 5; i++) {
            history.record(Snapshots.healthy().cpu(i).build(), 3);
        }

        assertThat(history.recent("ar_app")).extracting(MetricsSnapshot::cpuPercent).containsExactly(3.0, 4.0, 5.0);
    }

    @Test
    void shouldSeparateServicesAndReturnEmptyForUnknown() {
        SnapshotHistory history = new SnapshotHistory();
        history.record(Snapshots.healthy().service("a").build(), 5);

        assertThat(history.recent("a")).hasSize(1);
        assertThat(history.recent("b")).isEmpty();
    }

    @Test
    void shouldReturnDetachedCopy() {
        SnapshotHistory history = new SnapshotHistory();
        history.record(Snapshots.healthy().build(), 5);
        var copy = history.recent("ar_app");
        history.record(Snapshots.healthy().build(), 5);

        assertThat(copy).hasSize(1);
    }
}
