package io.github.drompincen.billingrecon.protocol.api;

/**
 * One company's entry in a batch reconciliation. {@code error} is null only when the
 * run completed and every vendor source answered.
 */
public record CompanyReconcileOutcome(
        String companyId,
        String companyName,
        String snapshotId,
        int discrepancies,
        String error
) {
    public static CompanyReconcileOutcome failed(String companyId, String companyName, String error) {
        return new CompanyReconcileOutcome(companyId, companyName, null, 0, error);
    }

    public boolean hasError() {
        return error != null;
    }
}
