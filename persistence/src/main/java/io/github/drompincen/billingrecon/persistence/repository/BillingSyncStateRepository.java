package io.github.drompincen.billingrecon.persistence.repository;

import io.github.drompincen.billingrecon.persistence.document.BillingSyncStateDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface BillingSyncStateRepository extends MongoRepository<BillingSyncStateDocument, String> {
}
