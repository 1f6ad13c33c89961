package io.github.drompincen.billingrecon.protocol.api;

/**
 * One usage bucket reported by a vendor for a single company, before it is
 * stamped with vendor and company identity.
 */
public record VendorProductCount(
        String productKey,
        String productName,
        int count,
        String unit
) {}
