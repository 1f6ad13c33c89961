package io.github.drompincen.billingrecon.persistence.repository;

import io.github.drompincen.billingrecon.persistence.document.BillingLineDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface BillingLineRepository extends MongoRepository<BillingLineDocument, String> {
    List<BillingLineDocument> findByCompanyId(String companyId);
    List<BillingLineDocument> findByCompanyIdAndBillableTrueAndCancelledFalse(String companyId);
    void deleteByCompanyId(String companyId);
}
