package io.github.drompincen.billingrecon.persistence.repository;

import io.github.drompincen.billingrecon.persistence.document.CompanyDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface CompanyRepository extends MongoRepository<CompanyDocument, String> {
    List<CompanyDocument> findBySyncEnabledTrueAndHasActiveAgreementTrueOrderByNameAsc();
}
