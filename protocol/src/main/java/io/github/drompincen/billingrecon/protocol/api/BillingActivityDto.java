package io.github.drompincen.billingrecon.protocol.api;

import java.time.Instant;

public record BillingActivityDto(
        String entryId,
        String companyId,
        String companyName,
        String agreementName,
        String productName,
        String vendorId,
        String vendorProductName,
        int psaQty,
        int vendorQty,
        int change,
        ActivityAction action,
        ActivityResult result,
        String resultNote,
        String actorId,
        String actorName,
        String snapshotId,
        String itemId,
        Instant createdAt
) {}
