package io.github.drompincen.billingrecon.persistence.repository;

import io.github.drompincen.billingrecon.persistence.document.BillingActivityDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface BillingActivityRepository extends MongoRepository<BillingActivityDocument, String> {
    List<BillingActivityDocument> findByItemId(String itemId);
    List<BillingActivityDocument> findByCompanyIdOrderByCreatedAtDesc(String companyId);
    List<BillingActivityDocument> findBySnapshotId(String snapshotId);
}
