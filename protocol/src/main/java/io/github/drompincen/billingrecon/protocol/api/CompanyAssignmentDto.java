package io.github.drompincen.billingrecon.protocol.api;

import java.time.Instant;

public record CompanyAssignmentDto(
        String assignmentId,
        String companyId,
        String vendorProductId,
        boolean autoDiscovered,
        Instant createdAt
) {}
