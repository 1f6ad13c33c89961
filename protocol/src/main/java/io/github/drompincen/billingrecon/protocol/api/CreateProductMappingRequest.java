package io.github.drompincen.billingrecon.protocol.api;

public record CreateProductMappingRequest(
        String vendorId,
        String vendorProductKey,
        String vendorProductName,
        String psaProductName,
        String countMethod,
        String unitLabel,
        String notes
) {}
