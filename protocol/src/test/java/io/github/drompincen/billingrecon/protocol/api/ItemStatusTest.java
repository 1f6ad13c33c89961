package io.github.drompincen.billingrecon.protocol.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ItemStatusTest {

    @Test
    void allStatusValuesExist() {
        assertThat(ItemStatus.values()).containsExactly(
                ItemStatus.PENDING,
                ItemStatus.APPROVED,
                ItemStatus.DISMISSED,
                ItemStatus.ADJUSTED);
    }

    @Test
    void snapshotStatusValues() {
        assertThat(SnapshotStatus.values()).containsExactly(
                SnapshotStatus.IN_PROGRESS,
                SnapshotStatus.COMPLETED,
                SnapshotStatus.FAILED);
    }
}
