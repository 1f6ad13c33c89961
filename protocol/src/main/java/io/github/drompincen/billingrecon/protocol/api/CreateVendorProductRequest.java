package io.github.drompincen.billingrecon.protocol.api;

/**
 * Manually added catalog product. {@code unit} defaults to {@code devices} when absent.
 */
public record CreateVendorProductRequest(
        String vendorId,
        String productKey,
        String productName,
        String unit
) {}
