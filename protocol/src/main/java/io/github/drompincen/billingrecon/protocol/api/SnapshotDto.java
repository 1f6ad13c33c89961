package io.github.drompincen.billingrecon.protocol.api;

import java.time.Instant;
import java.util.List;

public record SnapshotDto(
        String snapshotId,
        String companyId,
        String triggeredBy,
        SnapshotStatus status,
        ReconciliationSummary summary,
        List<VendorFailure> vendorFailures,
        String errorMessage,
        Instant createdAt,
        Instant completedAt
) {}
