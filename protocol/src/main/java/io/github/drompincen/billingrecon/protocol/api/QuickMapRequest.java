package io.github.drompincen.billingrecon.protocol.api;

public record QuickMapRequest(
        String vendorId,
        String vendorProductKey,
        String vendorProductName,
        String psaProductName
) {}
