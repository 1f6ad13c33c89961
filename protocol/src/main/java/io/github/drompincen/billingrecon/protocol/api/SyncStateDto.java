package io.github.drompincen.billingrecon.protocol.api;

import java.time.Instant;

public record SyncStateDto(
        Instant lastSyncAt,
        String lastSyncStatus,
        int processed,
        int errors,
        int total
) {}
