package io.github.drompincen.billingrecon.runtime.psa;

import io.github.drompincen.billingrecon.protocol.api.PsaBillingLine;

import java.util.List;

/**
 * The PSA's agreement billing lines. Implementations wrap the PSA's HTTP API.
 */
public interface PsaClient {

    /** Every billing line on the company's agreements, cancelled and non-billable ones included. */
    List<PsaBillingLine> listBillingLines(String companyId);

    void updateLineQuantity(String agreementExternalId, String lineExternalId, int newQty);
}
