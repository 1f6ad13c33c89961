package io.github.drompincen.billingrecon.protocol.api;

import java.time.Instant;

public record VendorCount(
        String vendorId,
        String productKey,
        String productName,
        int count,
        String unit,
        String companyExternalId,
        Instant observedAt
) {
    public static VendorCount of(String vendorId, String companyExternalId,
                                 VendorProductCount bucket, Instant observedAt) {
        return new VendorCount(vendorId, bucket.productKey(), bucket.productName(),
                bucket.count(), bucket.unit(), companyExternalId, observedAt);
    }
}
