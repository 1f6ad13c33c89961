package io.github.drompincen.billingrecon.protocol.api;

import java.math.BigDecimal;

public record ReconciliationSummary(
        int totalItems,
        int discrepancies,
        BigDecimal totalRevenueImpact,
        int matchedCount
) {
    public static ReconciliationSummary empty() {
        return new ReconciliationSummary(0, 0, BigDecimal.ZERO, 0);
    }
}
