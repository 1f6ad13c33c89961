package io.github.drompincen.billingrecon.persistence.repository;

import io.github.drompincen.billingrecon.persistence.document.LeaseDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface LeaseRepository extends MongoRepository<LeaseDocument, String> {
    Optional<LeaseDocument> findByCompanyId(String companyId);
    void deleteByCompanyId(String companyId);
}
