package io.github.drompincen.billingrecon.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Links a company to its identifier inside one vendor platform.
 */
@Document(collection = "integration_mappings")
@CompoundIndex(name = "company_vendor", def = "{'companyId': 1, 'vendorId': 1}", unique = true)
public class IntegrationMappingDocument {

    @Id
    private String mappingId;
    private String companyId;
    @Indexed
    private String vendorId;
    private String externalId;

    public IntegrationMappingDocument() {}

    public String getMappingId() { return mappingId; }
    public void setMappingId(String mappingId) { this.mappingId = mappingId; }

    public String getCompanyId() { return companyId; }
    public void setCompanyId(String companyId) { this.companyId = companyId; }

    public String getVendorId() { return vendorId; }
    public void setVendorId(String vendorId) { this.vendorId = vendorId; }

    public String getExternalId() { return externalId; }
    public void setExternalId(String externalId) { this.externalId = externalId; }
}
