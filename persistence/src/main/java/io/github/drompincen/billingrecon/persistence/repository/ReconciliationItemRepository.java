package io.github.drompincen.billingrecon.persistence.repository;

import io.github.drompincen.billingrecon.persistence.document.ReconciliationItemDocument;
import io.github.drompincen.billingrecon.protocol.api.ItemStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ReconciliationItemRepository extends MongoRepository<ReconciliationItemDocument, String> {
    List<ReconciliationItemDocument> findBySnapshotId(String snapshotId);
    List<ReconciliationItemDocument> findBySnapshotIdAndStatus(String snapshotId, ItemStatus status);
    List<ReconciliationItemDocument> findBySnapshotIdIn(List<String> snapshotIds);
}
