package io.github.drompincen.billingrecon.protocol.api;

public record ResolveItemRequest(
        ResolveAction action,
        String actorId,
        String note
) {}
