package com.phillippitts.autoremediation.domain;

import com.phillippitts.autoremediation.exception.UnknownActionTypeException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DomainCodesTest {

    @Test
    void shouldParseCodesLeniently() {
        assertThat(ActionType.fromCode("restart_container")).isEqualTo(ActionType.RESTART_CONTAINER);
        assertThat(ActionType.fromCode(" Scale-Up ")).isEqualTo(ActionType.SCALE_UP);
        assertThat(ActionType.fromCode("MANUAL")).isEqualTo(ActionType.MANUAL);
    }

    @Test
    void shouldRejectUnknownAndNullCodes() {
        assertThatThrownBy(() -> ActionType.fromCode("reboot_host"))
                .isInstanceOf(UnknownActionTypeException.class);
        assertThatThrownBy(() -> ActionType.fromCode(null))
                .isInstanceOf(UnknownActionTypeException.class);
    }

    @Test
    void shouldParseFindingKinds() {
        assertThat(FindingKind.fromCode("memory_leak")).isEqualTo(FindingKind.MEMORY_LEAK);
        assertThatThrownBy(() -> FindingKind.fromCode("disk_full")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldCompareSeverities() {
        assertThat(Severity.CRITICAL.isHigherThan(Severity.WARNING)).isTrue();
        assertThat(Severity.WARNING.isHigherThan(Severity.WARNING)).isFalse();
        assertThat(Severity.max(Severity.INFO, null)).isEqualTo(Severity.INFO);
    }
}
