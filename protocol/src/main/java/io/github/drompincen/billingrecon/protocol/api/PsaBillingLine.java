package io.github.drompincen.billingrecon.protocol.api;

import java.math.BigDecimal;

public record PsaBillingLine(
        String agreementId,
        String externalAgreementId,
        String externalLineId,
        String agreementName,
        String productName,
        int quantity,
        BigDecimal unitPrice,
        BigDecimal unitCost,
        boolean billable,
        boolean cancelled
) {
    public boolean isActive() {
        return billable && !cancelled;
    }
}
