package io.github.drompincen.billingrecon.runtime.lock;

/**
 * Another reconciliation or write-back currently holds the company's lease.
 */
public class CompanyBusyException extends RuntimeException {

    private final String companyId;

    public CompanyBusyException(String companyId) {
        super("Company " + companyId + " is busy with another billing operation");
        this.companyId = companyId;
    }

    public String getCompanyId() {
        return companyId;
    }
}
