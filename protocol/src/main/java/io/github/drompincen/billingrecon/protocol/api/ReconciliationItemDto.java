package io.github.drompincen.billingrecon.protocol.api;

import java.math.BigDecimal;
import java.time.Instant;

public record ReconciliationItemDto(
        String itemId,
        String snapshotId,
        String companyId,
        String productName,
        String vendorId,
        String vendorProductKey,
        String vendorProductName,
        int psaQty,
        int vendorQty,
        int discrepancy,
        BigDecimal unitPrice,
        BigDecimal revenueImpact,
        ItemStatus status,
        String linkedAgreementId,
        String linkedLineId,
        String agreementName,
        String resolvedBy,
        Instant resolvedAt,
        String resolvedNote,
        Instant createdAt
) {}
