package io.github.drompincen.billingrecon.protocol.api;

/**
 * Partial update; null fields are left unchanged.
 */
public record UpdateProductMappingRequest(
        String psaProductName,
        String countMethod,
        String unitLabel,
        Boolean active,
        String notes
) {}
