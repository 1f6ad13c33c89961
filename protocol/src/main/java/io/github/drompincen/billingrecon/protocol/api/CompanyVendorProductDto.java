package io.github.drompincen.billingrecon.protocol.api;

public record CompanyVendorProductDto(
        String vendorId,
        String productKey,
        String productName,
        int quantity,
        String unit,
        boolean mapped,
        String mappingId,
        String psaProductName
) {}
