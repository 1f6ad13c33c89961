package io.github.drompincen.billingrecon.protocol.api;

import java.time.Instant;

public record ProductMappingDto(
        String mappingId,
        String vendorId,
        String vendorProductKey,
        String vendorProductName,
        String psaProductName,
        String countMethod,
        String unitLabel,
        boolean active,
        String notes,
        String createdBy,
        Instant createdAt,
        Instant updatedAt
) {}
