package io.github.drompincen.billingrecon.protocol.api;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Totals over the latest completed snapshot of every company.
 */
public record BillingOverviewDto(
        int totalItems,
        int discrepancies,
        BigDecimal totalRevenueImpact,
        int matchedCount,
        int companiesWithIssues,
        Instant lastSyncAt
) {}
