package io.github.drompincen.billingrecon.gateway.controller;

import io.github.drompincen.billingrecon.persistence.document.BillingActivityDocument;
import io.github.drompincen.billingrecon.persistence.document.CompanyProductAssignmentDocument;
import io.github.drompincen.billingrecon.persistence.document.ProductMappingDocument;
import io.github.drompincen.billingrecon.persistence.document.ReconciliationItemDocument;
import io.github.drompincen.billingrecon.persistence.document.ReconciliationSnapshotDocument;
import io.github.drompincen.billingrecon.persistence.document.VendorProductDocument;
import io.github.drompincen.billingrecon.protocol.api.*;

import java.util.List;
import java.util.stream.Collectors;

final class BillingDtos {

    private BillingDtos() {}

    static ReconciliationItemDto toDto(ReconciliationItemDocument d) {
        return new ReconciliationItemDto(d.getItemId(), d.getSnapshotId(), d.getCompanyId(), d.getProductName(),
                d.getVendorId(), d.getVendorProductKey(), d.getVendorProductName(), d.getPsaQty(),
                d.getVendorQty(), d.getDiscrepancy(), d.getUnitPrice(), d.getRevenueImpact(), d.getStatus(),
                d.getLinkedAgreementId(), d.getLinkedLineId(), d.getAgreementName(), d.getResolvedBy(),
                d.getResolvedAt(), d.getResolvedNote(), d.getCreatedAt());
    }

    static SnapshotDto toDto(ReconciliationSnapshotDocument d) {
        ReconciliationSnapshotDocument.Summary s = d.getSummary();
        ReconciliationSummary summary = s == null
                ? ReconciliationSummary.empty()
                : new ReconciliationSummary(s.getTotalItems(), s.getDiscrepancies(), s.getTotalRevenueImpact(),
                        s.getMatchedCount());
        List<VendorFailure> failures = d.getVendorFailures() == null
                ? List.of()
                : d.getVendorFailures().stream()
                        .map(f -> new VendorFailure(f.getVendorId(), f.getCompanyExternalId(), f.getReason()))
                        .collect(Collectors.toList());
        return new SnapshotDto(d.getSnapshotId(), d.getCompanyId(), d.getTriggeredBy(), d.getStatus(), summary,
                failures, d.getErrorMessage(), d.getCreatedAt(), d.getCompletedAt());
    }

    static ProductMappingDto toDto(ProductMappingDocument d) {
        return new ProductMappingDto(d.getMappingId(), d.getVendorId(), d.getVendorProductKey(),
                d.getVendorProductName(), d.getPsaProductName(), d.getCountMethod(), d.getUnitLabel(),
                d.isActive(), d.getNotes(), d.getCreatedBy(), d.getCreatedAt(), d.getUpdatedAt());
    }

    static VendorProductDto toDto(VendorProductDocument d) {
        return new VendorProductDto(d.getVendorProductId(), d.getVendorId(), d.getProductKey(), d.getProductName(),
                d.getUnit(), d.isActive(), d.isAutoDiscovered());
    }

    static CompanyAssignmentDto toDto(CompanyProductAssignmentDocument d) {
        return new CompanyAssignmentDto(d.getAssignmentId(), d.getCompanyId(), d.getVendorProductId(),
                d.isAutoDiscovered(), d.getCreatedAt());
    }

    static BillingActivityDto toDto(BillingActivityDocument d) {
        return new BillingActivityDto(d.getEntryId(), d.getCompanyId(), d.getCompanyName(), d.getAgreementName(),
                d.getProductName(), d.getVendorId(), d.getVendorProductName(), d.getPsaQty(), d.getVendorQty(),
                d.getChange(), d.getAction(), d.getResult(), d.getResultNote(), d.getActorId(), d.getActorName(),
                d.getSnapshotId(), d.getItemId(), d.getCreatedAt());
    }
}
