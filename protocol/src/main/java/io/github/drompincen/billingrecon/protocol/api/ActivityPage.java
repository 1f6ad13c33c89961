package io.github.drompincen.billingrecon.protocol.api;

import java.util.List;

public record ActivityPage(
        List<BillingActivityDto> items,
        int page,
        int size,
        boolean hasMore
) {}
