package io.github.drompincen.billingrecon.protocol.api;

public record WriteBackResult(
        String itemId,
        String productName,
        int oldQty,
        int newQty,
        String error
) {
    public static WriteBackResult success(String itemId, String productName, int oldQty, int newQty) {
        return new WriteBackResult(itemId, productName, oldQty, newQty, null);
    }

    public static WriteBackResult failure(String itemId, String error) {
        return new WriteBackResult(itemId, null, 0, 0, error);
    }

    public boolean succeeded() {
        return error == null;
    }
}
