package io.github.drompincen.billingrecon.persistence.document;

import io.github.drompincen.billingrecon.protocol.api.ActivityAction;
import io.github.drompincen.billingrecon.protocol.api.ActivityResult;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Append-only audit row. Carries enough context to rebuild a company's billing history
 * without joining any other collection.
 */
@Document(collection = "billing_activity")
@CompoundIndex(name = "company_created", def = "{'companyId': 1, 'createdAt': -1}")
public class BillingActivityDocument {

    @Id
    private String entryId;
    private String companyId;
    private String companyName;
    private String agreementName;
    private String productName;
    private String vendorId;
    private String vendorProductName;
    private int psaQty;
    private int vendorQty;
    private int change;
    private ActivityAction action;
    private ActivityResult result;
    private String resultNote;
    private String actorId;
    private String actorName;
    private String snapshotId;
    @Indexed
    private String itemId;
    @Indexed
    private Instant createdAt;

    public BillingActivityDocument() {}

    public String getEntryId() { return entryId; }
    public void setEntryId(String entryId) { this.entryId = entryId; }

    public String getCompanyId() { return companyId; }
    public void setCompanyId(String companyId) { this.companyId = companyId; }

    public String getCompanyName() { return companyName; }
    public void setCompanyName(String companyName) { this.companyName = companyName; }

    public String getAgreementName() { return agreementName; }
    public void setAgreementName(String agreementName) { this.agreementName = agreementName; }

    public String getProductName() { return productName; }
    public void setProductName(String productName) { this.productName = productName; }

    public String getVendorId() { return vendorId; }
    public void setVendorId(String vendorId) { this.vendorId = vendorId; }

    public String getVendorProductName() { return vendorProductName; }
    public void setVendorProductName(String vendorProductName) { this.vendorProductName = vendorProductName; }

    public int getPsaQty() { return psaQty; }
    public void setPsaQty(int psaQty) { this.psaQty = psaQty; }

    public int getVendorQty() { return vendorQty; }
    public void setVendorQty(int vendorQty) { this.vendorQty = vendorQty; }

    public int getChange() { return change; }
    public void setChange(int change) { this.change = change; }

    public ActivityAction getAction() { return action; }
    public void setAction(ActivityAction action) { this.action = action; }

    public ActivityResult getResult() { return result; }
    public void setResult(ActivityResult result) { this.result = result; }

    public String getResultNote() { return resultNote; }
    public void setResultNote(String resultNote) { this.resultNote = resultNote; }

    public String getActorId() { return actorId; }
    public void setActorId(String actorId) { this.actorId = actorId; }

    public String getActorName() { return actorName; }
    public void setActorName(String actorName) { this.actorName = actorName; }

    public String getSnapshotId() { return snapshotId; }
    public void setSnapshotId(String snapshotId) { this.snapshotId = snapshotId; }

    public String getItemId() { return itemId; }
    public void setItemId(String itemId) { this.itemId = itemId; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
