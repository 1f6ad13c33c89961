package io.github.drompincen.billingrecon.runtime.mapping;

import io.github.drompincen.billingrecon.persistence.document.ProductMappingDocument;
import io.github.drompincen.billingrecon.persistence.repository.ProductMappingRepository;
import io.github.drompincen.billingrecon.protocol.api.CreateProductMappingRequest;
import io.github.drompincen.billingrecon.protocol.api.QuickMapRequest;
import io.github.drompincen.billingrecon.protocol.api.UpdateProductMappingRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Operator-side management of vendor-product to PSA-product mappings.
 */
@Service
public class ProductMappingService {

    private static final Logger log = LoggerFactory.getLogger(ProductMappingService.class);

    private final ProductMappingRepository productMappingRepository;
    private final VendorProductCatalog catalog;
    private final MongoTemplate mongoTemplate;

    public ProductMappingService(ProductMappingRepository productMappingRepository,
                                 VendorProductCatalog catalog,
                                 MongoTemplate mongoTemplate) {
        this.productMappingRepository = productMappingRepository;
        this.catalog = catalog;
        this.mongoTemplate = mongoTemplate;
    }

    public List<ProductMappingDocument> list(String vendorId) {
        if (vendorId != null) {
            return productMappingRepository.findByVendorIdOrderByVendorProductKeyAsc(vendorId);
        }
        return productMappingRepository.findAll();
    }

    public Optional<ProductMappingDocument> findById(String mappingId) {
        return productMappingRepository.findById(mappingId);
    }

    /**
     * Creates the mapping, or refreshes it if one already exists for the same vendor key and
     * PSA product. A refreshed mapping is reactivated.
     */
    public ProductMappingDocument create(CreateProductMappingRequest request, String actorId) {
        requireText(request.vendorId(), "vendorId");
        requireText(request.vendorProductKey(), "vendorProductKey");
        requireText(request.psaProductName(), "psaProductName");

        Query query = new Query()
                .addCriteria(Criteria.where("vendorId").is(request.vendorId()))
                .addCriteria(Criteria.where("vendorProductKey").is(request.vendorProductKey()))
                .addCriteria(Criteria.where("psaProductName").is(request.psaProductName()));
        Instant now = Instant.now();
        Update update = new Update()
                .setOnInsert("_id", UUID.randomUUID().toString())
                .setOnInsert("createdBy", actorId)
                .setOnInsert("createdAt", now)
                .set("vendorProductName", request.vendorProductName())
                .set("countMethod", request.countMethod())
                .set("unitLabel", request.unitLabel())
                .set("notes", request.notes())
                .set("active", true)
                .set("updatedAt", now);
        ProductMappingDocument saved = mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().upsert(true).returnNew(true), ProductMappingDocument.class);
        log.info("Mapped {}/{} to PSA product '{}'", request.vendorId(), request.vendorProductKey(),
                request.psaProductName());
        return saved;
    }

    public Optional<ProductMappingDocument> update(String mappingId, UpdateProductMappingRequest request) {
        return productMappingRepository.findById(mappingId).map(mapping -> {
            if (request.psaProductName() != null) {
                requireText(request.psaProductName(), "psaProductName");
                mapping.setPsaProductName(request.psaProductName());
            }
            if (request.countMethod() != null) mapping.setCountMethod(request.countMethod());
            if (request.unitLabel() != null) mapping.setUnitLabel(request.unitLabel());
            if (request.active() != null) mapping.setActive(request.active());
            if (request.notes() != null) mapping.setNotes(request.notes());
            mapping.setUpdatedAt(Instant.now());
            return productMappingRepository.save(mapping);
        });
    }

    public boolean delete(String mappingId) {
        if (!productMappingRepository.existsById(mappingId)) {
            return false;
        }
        productMappingRepository.deleteById(mappingId);
        return true;
    }

    /** Maps a vendor product seen in live data, registering it in the catalog first if needed. */
    public ProductMappingDocument quickMap(QuickMapRequest request, String actorId) {
        requireText(request.vendorId(), "vendorId");
        requireText(request.vendorProductKey(), "vendorProductKey");
        catalog.ensureProduct(request.vendorId(), request.vendorProductKey(), request.vendorProductName(), null);
        return create(new CreateProductMappingRequest(request.vendorId(), request.vendorProductKey(),
                request.vendorProductName(), request.psaProductName(), "per_unit", null, null), actorId);
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }
}
