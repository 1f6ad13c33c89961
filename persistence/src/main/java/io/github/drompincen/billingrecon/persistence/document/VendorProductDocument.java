package io.github.drompincen.billingrecon.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "vendor_products")
@CompoundIndex(name = "vendor_product_key", def = "{'vendorId': 1, 'productKey': 1}", unique = true)
public class VendorProductDocument {

    @Id
    private String vendorProductId;
    private String vendorId;
    private String productKey;
    private String productName;
    private String unit;
    private boolean active = true;
    private boolean autoDiscovered;
    private Instant createdAt;

    public VendorProductDocument() {}

    public String getVendorProductId() { return vendorProductId; }
    public void setVendorProductId(String vendorProductId) { this.vendorProductId = vendorProductId; }

    public String getVendorId() { return vendorId; }
    public void setVendorId(String vendorId) { this.vendorId = vendorId; }

    public String getProductKey() { return productKey; }
    public void setProductKey(String productKey) { this.productKey = productKey; }

    public String getProductName() { return productName; }
    public void setProductName(String productName) { this.productName = productName; }

    public String getUnit() { return unit; }
    public void setUnit(String unit) { this.unit = unit; }

    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }

    public boolean isAutoDiscovered() { return autoDiscovered; }
    public void setAutoDiscovered(boolean autoDiscovered) { this.autoDiscovered = autoDiscovered; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
