package io.github.drompincen.billingrecon.persistence.repository;

import io.github.drompincen.billingrecon.persistence.document.ReconciliationSnapshotDocument;
import io.github.drompincen.billingrecon.protocol.api.SnapshotStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface ReconciliationSnapshotRepository extends MongoRepository<ReconciliationSnapshotDocument, String> {
    List<ReconciliationSnapshotDocument> findByCompanyIdOrderByCreatedAtDesc(String companyId);
    Optional<ReconciliationSnapshotDocument> findFirstByCompanyIdAndStatusOrderByCreatedAtDesc(String companyId, SnapshotStatus status);
    List<ReconciliationSnapshotDocument> findByStatus(SnapshotStatus status);
}
