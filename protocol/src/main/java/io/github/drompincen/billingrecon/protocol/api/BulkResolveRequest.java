package io.github.drompincen.billingrecon.protocol.api;

import java.util.List;

public record BulkResolveRequest(
        List<String> itemIds,
        ResolveAction action,
        String actorId,
        String note
) {}
