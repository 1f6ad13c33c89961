package io.github.drompincen.billingrecon.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * Operator-maintained rule saying which PSA product a vendor product bills under.
 * {@code vendorProductKey} is either an exact key or one of {@link #WILDCARD_KEYS}.
 */
@Document(collection = "product_mappings")
@CompoundIndex(name = "vendor_key_psa", def = "{'vendorId': 1, 'vendorProductKey': 1, 'psaProductName': 1}", unique = true)
public class ProductMappingDocument {

    public static final List<String> WILDCARD_KEYS = List.of("*", "all_devices", "all_agents");

    @Id
    private String mappingId;
    private String vendorId;
    private String vendorProductKey;
    private String vendorProductName;
    private String psaProductName;
    private String countMethod;
    private String unitLabel;
    private boolean active = true;
    private String notes;
    private String createdBy;
    private Instant createdAt;
    private Instant updatedAt;

    public ProductMappingDocument() {}

    public boolean isWildcard() {
        return WILDCARD_KEYS.contains(vendorProductKey);
    }

    public String getMappingId() { return mappingId; }
    public void setMappingId(String mappingId) { this.mappingId = mappingId; }

    public String getVendorId() { return vendorId; }
    public void setVendorId(String vendorId) { this.vendorId = vendorId; }

    public String getVendorProductKey() { return vendorProductKey; }
    public void setVendorProductKey(String vendorProductKey) { this.vendorProductKey = vendorProductKey; }

    public String getVendorProductName() { return vendorProductName; }
    public void setVendorProductName(String vendorProductName) { this.vendorProductName = vendorProductName; }

    public String getPsaProductName() { return psaProductName; }
    public void setPsaProductName(String psaProductName) { this.psaProductName = psaProductName; }

    public String getCountMethod() { return countMethod; }
    public void setCountMethod(String countMethod) { this.countMethod = countMethod; }

    public String getUnitLabel() { return unitLabel; }
    public void setUnitLabel(String unitLabel) { this.unitLabel = unitLabel; }

    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }

    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }

    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
