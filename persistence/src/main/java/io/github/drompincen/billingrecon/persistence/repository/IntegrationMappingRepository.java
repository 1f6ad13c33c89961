package io.github.drompincen.billingrecon.persistence.repository;

import io.github.drompincen.billingrecon.persistence.document.IntegrationMappingDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface IntegrationMappingRepository extends MongoRepository<IntegrationMappingDocument, String> {
    List<IntegrationMappingDocument> findByCompanyId(String companyId);
    List<IntegrationMappingDocument> findByVendorIdIn(List<String> vendorIds);
    Optional<IntegrationMappingDocument> findByCompanyIdAndVendorId(String companyId, String vendorId);
}
