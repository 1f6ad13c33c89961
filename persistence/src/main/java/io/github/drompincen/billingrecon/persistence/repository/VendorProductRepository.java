package io.github.drompincen.billingrecon.persistence.repository;

import io.github.drompincen.billingrecon.persistence.document.VendorProductDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface VendorProductRepository extends MongoRepository<VendorProductDocument, String> {
    Optional<VendorProductDocument> findByVendorIdAndProductKey(String vendorId, String productKey);
    List<VendorProductDocument> findByVendorIdOrderByProductKeyAsc(String vendorId);
    List<VendorProductDocument> findByVendorIdAndActiveTrueOrderByProductKeyAsc(String vendorId);
    List<VendorProductDocument> findByActiveTrue();
}
