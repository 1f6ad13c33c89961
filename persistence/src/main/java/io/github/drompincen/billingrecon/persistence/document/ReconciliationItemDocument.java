package io.github.drompincen.billingrecon.persistence.document;

import io.github.drompincen.billingrecon.protocol.api.ItemStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One vendor-count-versus-billing comparison inside a snapshot.
 * {@code discrepancy} is always {@code vendorQty - psaQty}; {@code revenueImpact} is null
 * when no PSA line matched.
 */
@Document(collection = "reconciliation_items")
@CompoundIndex(name = "snapshot_status", def = "{'snapshotId': 1, 'status': 1}")
public class ReconciliationItemDocument {

    @Id
    private String itemId;
    private String snapshotId;
    @Indexed
    private String companyId;
    private String productName;
    private String vendorId;
    private String vendorProductKey;
    private String vendorProductName;
    private int psaQty;
    private int vendorQty;
    private int discrepancy;
    private BigDecimal unitPrice;
    private BigDecimal revenueImpact;
    private ItemStatus status;
    private String linkedAgreementId;
    private String linkedLineId;
    /** Quantity billed on matched PSA lines other than the linked one. */
    private int otherLinesQty;
    private String agreementName;
    private String resolvedBy;
    private Instant resolvedAt;
    private String resolvedNote;
    private Instant createdAt;

    public ReconciliationItemDocument() {}

    public boolean isLinkedToPsa() {
        return linkedAgreementId != null && linkedLineId != null;
    }

    public String getItemId() { return itemId; }
    public void setItemId(String itemId) { this.itemId = itemId; }

    public String getSnapshotId() { return snapshotId; }
    public void setSnapshotId(String snapshotId) { this.snapshotId = snapshotId; }

    public String getCompanyId() { return companyId; }
    public void setCompanyId(String companyId) { this.companyId = companyId; }

    public String getProductName() { return productName; }
    public void setProductName(String productName) { this.productName = productName; }

    public String getVendorId() { return vendorId; }
    public void setVendorId(String vendorId) { this.vendorId = vendorId; }

    public String getVendorProductKey() { return vendorProductKey; }
    public void setVendorProductKey(String vendorProductKey) { this.vendorProductKey = vendorProductKey; }

    public String getVendorProductName() { return vendorProductName; }
    public void setVendorProductName(String vendorProductName) { this.vendorProductName = vendorProductName; }

    public int getPsaQty() { return psaQty; }
    public void setPsaQty(int psaQty) { this.psaQty = psaQty; }

    public int getVendorQty() { return vendorQty; }
    public void setVendorQty(int vendorQty) { this.vendorQty = vendorQty; }

    public int getDiscrepancy() { return discrepancy; }
    public void setDiscrepancy(int discrepancy) { this.discrepancy = discrepancy; }

    public BigDecimal getUnitPrice() { return unitPrice; }
    public void setUnitPrice(BigDecimal unitPrice) { this.unitPrice = unitPrice; }

    public BigDecimal getRevenueImpact() { return revenueImpact; }
    public void setRevenueImpact(BigDecimal revenueImpact) { this.revenueImpact = revenueImpact; }

    public ItemStatus getStatus() { return status; }
    public void setStatus(ItemStatus status) { this.status = status; }

    public String getLinkedAgreementId() { return linkedAgreementId; }
    public void setLinkedAgreementId(String linkedAgreementId) { this.linkedAgreementId = linkedAgreementId; }

    public String getLinkedLineId() { return linkedLineId; }
    public void setLinkedLineId(String linkedLineId) { this.linkedLineId = linkedLineId; }

    public int getOtherLinesQty() { return otherLinesQty; }
    public void setOtherLinesQty(int otherLinesQty) { this.otherLinesQty = otherLinesQty; }

    public String getAgreementName() { return agreementName; }
    public void setAgreementName(String agreementName) { this.agreementName = agreementName; }

    public String getResolvedBy() { return resolvedBy; }
    public void setResolvedBy(String resolvedBy) { this.resolvedBy = resolvedBy; }

    public Instant getResolvedAt() { return resolvedAt; }
    public void setResolvedAt(Instant resolvedAt) { this.resolvedAt = resolvedAt; }

    public String getResolvedNote() { return resolvedNote; }
    public void setResolvedNote(String resolvedNote) { this.resolvedNote = resolvedNote; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
