package io.github.drompincen.billingrecon.persistence;

import io.github.drompincen.billingrecon.persistence.document.CompanyProductAssignmentDocument;
import io.github.drompincen.billingrecon.persistence.document.IntegrationMappingDocument;
import io.github.drompincen.billingrecon.persistence.document.LeaseDocument;
import io.github.drompincen.billingrecon.persistence.document.ProductMappingDocument;
import io.github.drompincen.billingrecon.persistence.document.VendorProductDocument;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.IndexResolver;
import org.springframework.data.mongodb.core.index.MongoPersistentEntityIndexResolver;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.ContextConfiguration;

import java.util.List;

@DataMongoTest
@ActiveProfiles("test")
@ContextConfiguration(classes = TestMongoConfiguration.class)
public abstract class AbstractMongoIntegrationTest {

    private static final List<Class<?>> UNIQUE_KEYED = List.of(
            ProductMappingDocument.class,
            VendorProductDocument.class,
            CompanyProductAssignmentDocument.class,
            IntegrationMappingDocument.class,
            LeaseDocument.class);

    @Autowired
    protected MongoTemplate mongoTemplate;

    @BeforeEach
    void cleanDatabase() {
        for (String collectionName : mongoTemplate.getCollectionNames()) {
            mongoTemplate.dropCollection(collectionName);
        }
        ensureIndexes();
    }

    private void ensureIndexes() {
        // Dropping a collection drops its indexes; the natural-key upserts rely on them.
        IndexResolver resolver = new MongoPersistentEntityIndexResolver(mongoTemplate.getConverter().getMappingContext());
        for (Class<?> type : UNIQUE_KEYED) {
            var indexOps = mongoTemplate.indexOps(type);
            resolver.resolveIndexFor(type).forEach(indexOps::ensureIndex);
        }
    }
}
