package io.github.drompincen.billingrecon.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Local copy of one PSA agreement billing line. The PSA line id is the document id.
 */
@Document(collection = "billing_lines")
public class BillingLineDocument {

    @Id
    private String externalLineId;
    @Indexed
    private String companyId;
    private String agreementId;
    private String externalAgreementId;
    private String agreementName;
    private String productName;
    private int quantity;
    private BigDecimal unitPrice;
    private BigDecimal unitCost;
    private boolean billable;
    private boolean cancelled;
    private Instant lastSyncedAt;

    public BillingLineDocument() {}

    public String getExternalLineId() { return externalLineId; }
    public void setExternalLineId(String externalLineId) { this.externalLineId = externalLineId; }

    public String getCompanyId() { return companyId; }
    public void setCompanyId(String companyId) { this.companyId = companyId; }

    public String getAgreementId() { return agreementId; }
    public void setAgreementId(String agreementId) { this.agreementId = agreementId; }

    public String getExternalAgreementId() { return externalAgreementId; }
    public void setExternalAgreementId(String externalAgreementId) { this.externalAgreementId = externalAgreementId; }

    public String getAgreementName() { return agreementName; }
    public void setAgreementName(String agreementName) { this.agreementName = agreementName; }

    public String getProductName() { return productName; }
    public void setProductName(String productName) { this.productName = productName; }

    public int getQuantity() { return quantity; }
    public void setQuantity(int quantity) { this.quantity = quantity; }

    public BigDecimal getUnitPrice() { return unitPrice; }
    public void setUnitPrice(BigDecimal unitPrice) { this.unitPrice = unitPrice; }

    public BigDecimal getUnitCost() { return unitCost; }
    public void setUnitCost(BigDecimal unitCost) { this.unitCost = unitCost; }

    public boolean isBillable() { return billable; }
    public void setBillable(boolean billable) { this.billable = billable; }

    public boolean isCancelled() { return cancelled; }
    public void setCancelled(boolean cancelled) { this.cancelled = cancelled; }

    public Instant getLastSyncedAt() { return lastSyncedAt; }
    public void setLastSyncedAt(Instant lastSyncedAt) { this.lastSyncedAt = lastSyncedAt; }
}
