package io.github.drompincen.billingrecon.protocol.api;

import java.util.List;

public record BulkWriteBackRequest(
        List<String> itemIds,
        String actorId
) {}
