package io.github.drompincen.billingrecon.persistence.repository;

import io.github.drompincen.billingrecon.persistence.document.ProductMappingDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;

public interface ProductMappingRepository extends MongoRepository<ProductMappingDocument, String> {
    List<ProductMappingDocument> findByVendorIdOrderByVendorProductKeyAsc(String vendorId);
    List<ProductMappingDocument> findByVendorIdAndVendorProductKeyAndActiveTrue(String vendorId, String vendorProductKey);
    List<ProductMappingDocument> findByVendorIdAndVendorProductKeyInAndActiveTrue(String vendorId, Collection<String> keys);
    List<ProductMappingDocument> findByActiveTrue();
}
