package io.github.drompincen.billingrecon.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "company_product_assignments")
@CompoundIndex(name = "company_vendor_product", def = "{'companyId': 1, 'vendorProductId': 1}", unique = true)
public class CompanyProductAssignmentDocument {

    @Id
    private String assignmentId;
    private String companyId;
    private String vendorProductId;
    private boolean autoDiscovered;
    private Instant createdAt;

    public CompanyProductAssignmentDocument() {}

    public String getAssignmentId() { return assignmentId; }
    public void setAssignmentId(String assignmentId) { this.assignmentId = assignmentId; }

    public String getCompanyId() { return companyId; }
    public void setCompanyId(String companyId) { this.companyId = companyId; }

    public String getVendorProductId() { return vendorProductId; }
    public void setVendorProductId(String vendorProductId) { this.vendorProductId = vendorProductId; }

    public boolean isAutoDiscovered() { return autoDiscovered; }
    public void setAutoDiscovered(boolean autoDiscovered) { this.autoDiscovered = autoDiscovered; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
