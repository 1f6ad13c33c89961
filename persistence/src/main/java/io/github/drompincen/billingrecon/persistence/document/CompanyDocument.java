package io.github.drompincen.billingrecon.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = "companies")
public class CompanyDocument {

    @Id
    private String companyId;
    private String name;
    private boolean syncEnabled;
    private boolean hasActiveAgreement;

    public CompanyDocument() {}

    public String getCompanyId() { return companyId; }
    public void setCompanyId(String companyId) { this.companyId = companyId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public boolean isSyncEnabled() { return syncEnabled; }
    public void setSyncEnabled(boolean syncEnabled) { this.syncEnabled = syncEnabled; }

    public boolean isHasActiveAgreement() { return hasActiveAgreement; }
    public void setHasActiveAgreement(boolean hasActiveAgreement) { this.hasActiveAgreement = hasActiveAgreement; }
}
