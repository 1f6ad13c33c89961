package io.github.drompincen.billingrecon.runtime.mapping;

import io.github.drompincen.billingrecon.persistence.document.CompanyProductAssignmentDocument;
import io.github.drompincen.billingrecon.persistence.repository.CompanyProductAssignmentRepository;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Which vendor products each company uses. At most one row exists per
 * (companyId, vendorProductId) no matter how often a pairing is observed.
 */
@Service
public class CompanyAssignmentService {

    private final CompanyProductAssignmentRepository assignmentRepository;
    private final MongoTemplate mongoTemplate;

    public CompanyAssignmentService(CompanyProductAssignmentRepository assignmentRepository,
                                    MongoTemplate mongoTemplate) {
        this.assignmentRepository = assignmentRepository;
        this.mongoTemplate = mongoTemplate;
    }

    public CompanyProductAssignmentDocument ensureAssigned(String companyId, String vendorProductId,
                                                           boolean autoDiscovered) {
        Query query = new Query()
                .addCriteria(Criteria.where("companyId").is(companyId))
                .addCriteria(Criteria.where("vendorProductId").is(vendorProductId));
        Update update = new Update()
                .setOnInsert("_id", UUID.randomUUID().toString())
                .setOnInsert("autoDiscovered", autoDiscovered)
                .setOnInsert("createdAt", Instant.now());
        return mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().upsert(true).returnNew(true),
                CompanyProductAssignmentDocument.class);
    }

    public List<CompanyProductAssignmentDocument> listForCompany(String companyId) {
        return assignmentRepository.findByCompanyId(companyId);
    }

    public boolean remove(String assignmentId) {
        if (!assignmentRepository.existsById(assignmentId)) {
            return false;
        }
        assignmentRepository.deleteById(assignmentId);
        return true;
    }
}
