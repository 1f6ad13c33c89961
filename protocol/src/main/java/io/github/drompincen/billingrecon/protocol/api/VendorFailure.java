package io.github.drompincen.billingrecon.protocol.api;

/**
 * A vendor source that contributed no data for a company during one aggregation pass.
 */
public record VendorFailure(
        String vendorId,
        String companyExternalId,
        String reason
) {}
