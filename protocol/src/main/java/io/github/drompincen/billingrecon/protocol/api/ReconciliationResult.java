package io.github.drompincen.billingrecon.protocol.api;

import java.math.BigDecimal;
import java.util.List;

public record ReconciliationResult(
        String snapshotId,
        String companyId,
        String companyName,
        int totalItems,
        int discrepancies,
        BigDecimal totalRevenueImpact,
        List<VendorFailure> vendorFailures
) {}
