package io.github.drompincen.billingrecon.protocol.api;

public record VendorProductDto(
        String vendorProductId,
        String vendorId,
        String productKey,
        String productName,
        String unit,
        boolean active,
        boolean autoDiscovered
) {}
