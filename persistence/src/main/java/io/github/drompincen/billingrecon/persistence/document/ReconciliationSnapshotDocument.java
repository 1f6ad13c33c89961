package io.github.drompincen.billingrecon.persistence.document;

import io.github.drompincen.billingrecon.protocol.api.SnapshotStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Document(collection = "reconciliation_snapshots")
@CompoundIndex(name = "company_created", def = "{'companyId': 1, 'createdAt': -1}")
public class ReconciliationSnapshotDocument {

    @Id
    private String snapshotId;
    private String companyId;
    private String triggeredBy;
    private SnapshotStatus status;
    private Summary summary;
    private List<VendorFailureEntry> vendorFailures = new ArrayList<>();
    private String errorMessage;
    private Instant createdAt;
    private Instant completedAt;

    public ReconciliationSnapshotDocument() {}

    public String getSnapshotId() { return snapshotId; }
    public void setSnapshotId(String snapshotId) { this.snapshotId = snapshotId; }

    public String getCompanyId() { return companyId; }
    public void setCompanyId(String companyId) { this.companyId = companyId; }

    public String getTriggeredBy() { return triggeredBy; }
    public void setTriggeredBy(String triggeredBy) { this.triggeredBy = triggeredBy; }

    public SnapshotStatus getStatus() { return status; }
    public void setStatus(SnapshotStatus status) { this.status = status; }

    public Summary getSummary() { return summary; }
    public void setSummary(Summary summary) { this.summary = summary; }

    public List<VendorFailureEntry> getVendorFailures() { return vendorFailures; }
    public void setVendorFailures(List<VendorFailureEntry> vendorFailures) { this.vendorFailures = vendorFailures; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }

    public static class Summary {
        private int totalItems;
        private int discrepancies;
        private BigDecimal totalRevenueImpact = BigDecimal.ZERO;
        private int matchedCount;

        public Summary() {}

        public Summary(int totalItems, int discrepancies, BigDecimal totalRevenueImpact, int matchedCount) {
            this.totalItems = totalItems;
            this.discrepancies = discrepancies;
            this.totalRevenueImpact = totalRevenueImpact;
            this.matchedCount = matchedCount;
        }

        public int getTotalItems() { return totalItems; }
        public void setTotalItems(int totalItems) { this.totalItems = totalItems; }
        public int getDiscrepancies() { return discrepancies; }
        public void setDiscrepancies(int discrepancies) { this.discrepancies = discrepancies; }
        public BigDecimal getTotalRevenueImpact() { return totalRevenueImpact; }
        public void setTotalRevenueImpact(BigDecimal totalRevenueImpact) { this.totalRevenueImpact = totalRevenueImpact; }
        public int getMatchedCount() { return matchedCount; }
        public void setMatchedCount(int matchedCount) { this.matchedCount = matchedCount; }
    }

    public static class VendorFailureEntry {
        private String vendorId;
        private String companyExternalId;
        private String reason;

        public VendorFailureEntry() {}

        public VendorFailureEntry(String vendorId, String companyExternalId, String reason) {
            this.vendorId = vendorId;
            this.companyExternalId = companyExternalId;
            this.reason = reason;
        }

        public String getVendorId() { return vendorId; }
        public void setVendorId(String vendorId) { this.vendorId = vendorId; }
        public String getCompanyExternalId() { return companyExternalId; }
        public void setCompanyExternalId(String companyExternalId) { this.companyExternalId = companyExternalId; }
        public String getReason() { return reason; }
        public void setReason(String reason) { this.reason = reason; }
    }
}
