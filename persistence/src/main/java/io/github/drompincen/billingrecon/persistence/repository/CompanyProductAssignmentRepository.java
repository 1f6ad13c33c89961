package io.github.drompincen.billingrecon.persistence.repository;

import io.github.drompincen.billingrecon.persistence.document.CompanyProductAssignmentDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface CompanyProductAssignmentRepository extends MongoRepository<CompanyProductAssignmentDocument, String> {
    List<CompanyProductAssignmentDocument> findByCompanyId(String companyId);
    Optional<CompanyProductAssignmentDocument> findByCompanyIdAndVendorProductId(String companyId, String vendorProductId);
    long countByCompanyIdAndVendorProductId(String companyId, String vendorProductId);
    long deleteByVendorProductId(String vendorProductId);
}
