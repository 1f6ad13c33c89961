package io.github.drompincen.billingrecon.runtime.mapping;

import io.github.drompincen.billingrecon.persistence.document.VendorProductDocument;
import io.github.drompincen.billingrecon.persistence.repository.CompanyProductAssignmentRepository;
import io.github.drompincen.billingrecon.persistence.repository.VendorProductRepository;
import io.github.drompincen.billingrecon.protocol.api.VendorCount;
import io.github.drompincen.billingrecon.runtime.reconcile.BillingPreconditionException;
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
 * The set of products each vendor can report. Rows are unique per (vendorId, productKey)
 * and only ever inserted through an upsert, so concurrent registration of the same key is safe.
 */
@Service
public class VendorProductCatalog {

    private static final Logger log = LoggerFactory.getLogger(VendorProductCatalog.class);

    record KnownProduct(String vendorId, String productKey, String productName, String unit) {}

    static final List<KnownProduct> KNOWN_PRODUCTS = List.of(
            new KnownProduct("ninjaone", "workstations", "NinjaOne Workstations", "devices"),
            new KnownProduct("ninjaone", "servers", "NinjaOne Servers", "devices"),
            new KnownProduct("ninjaone", "backup_workstations", "NinjaOne Backup Workstations", "devices"),
            new KnownProduct("ninjaone", "backup_servers", "NinjaOne Backup Servers", "devices"),
            new KnownProduct("sentinelone", "complete", "SentinelOne Complete", "agents"),
            new KnownProduct("sentinelone", "control", "SentinelOne Control", "agents"),
            new KnownProduct("cove", "server_backup", "Cove Server Backup", "devices"),
            new KnownProduct("cove", "workstation_backup", "Cove Workstation Backup", "devices"),
            new KnownProduct("cove", "m365_backup", "Cove M365 Backup", "tenants"),
            new KnownProduct("pax8", "microsoft_365_business_basic", "Microsoft 365 Business Basic", "licenses"),
            new KnownProduct("pax8", "microsoft_365_business_standard", "Microsoft 365 Business Standard", "licenses"),
            new KnownProduct("pax8", "microsoft_365_business_premium", "Microsoft 365 Business Premium", "licenses"),
            new KnownProduct("pax8", "microsoft_defender_for_business", "Microsoft Defender for Business", "licenses"),
            new KnownProduct("pax8", "microsoft_365_e3", "Microsoft 365 E3", "licenses"),
            new KnownProduct("pax8", "microsoft_365_e5", "Microsoft 365 E5", "licenses"));

    static final String DEFAULT_UNIT = "devices";

    private final VendorProductRepository vendorProductRepository;
    private final CompanyProductAssignmentRepository assignmentRepository;
    private final MongoTemplate mongoTemplate;

    public VendorProductCatalog(VendorProductRepository vendorProductRepository,
                                CompanyProductAssignmentRepository assignmentRepository,
                                MongoTemplate mongoTemplate) {
        this.vendorProductRepository = vendorProductRepository;
        this.assignmentRepository = assignmentRepository;
        this.mongoTemplate = mongoTemplate;
    }

    /** Inserts the built-in vendor products once; a non-empty catalog is left alone. */
    public void ensureSeeded() {
        if (vendorProductRepository.count() > 0) return;
        for (KnownProduct p : KNOWN_PRODUCTS) {
            upsert(p.vendorId(), p.productKey(), p.productName(), p.unit(), false);
        }
        log.info("Seeded vendor product catalog with {} products", KNOWN_PRODUCTS.size());
    }

    /** Catalog row for an observed vendor count, created as auto-discovered if the key is new. */
    public VendorProductDocument register(VendorCount count) {
        return upsert(count.vendorId(), count.productKey(), count.productName(), count.unit(), true);
    }

    public VendorProductDocument ensureProduct(String vendorId, String productKey, String productName, String unit) {
        return upsert(vendorId, productKey, productName != null ? productName : productKey, unit, false);
    }

    public List<VendorProductDocument> listByVendor(String vendorId, boolean includeInactive) {
        return includeInactive
                ? vendorProductRepository.findByVendorIdOrderByProductKeyAsc(vendorId)
                : vendorProductRepository.findByVendorIdAndActiveTrueOrderByProductKeyAsc(vendorId);
    }

    public List<VendorProductDocument> listAll(boolean includeInactive) {
        return includeInactive ? vendorProductRepository.findAll() : vendorProductRepository.findByActiveTrue();
    }

    /**
     * Adds a manually maintained product.
     *
     * @throws IllegalArgumentException if vendor id, product key or name is blank
     * @throws BillingPreconditionException if the vendor already has a product with that key
     */
    public VendorProductDocument create(String vendorId, String productKey, String productName, String unit) {
        if (isBlank(vendorId) || isBlank(productKey) || isBlank(productName)) {
            throw new IllegalArgumentException("vendorId, productKey and productName are required");
        }
        if (vendorProductRepository.findByVendorIdAndProductKey(vendorId, productKey).isPresent()) {
            throw new BillingPreconditionException("Vendor product " + vendorId + "/" + productKey + " already exists");
        }
        VendorProductDocument created = upsert(vendorId, productKey, productName,
                isBlank(unit) ? DEFAULT_UNIT : unit, false);
        log.info("Created vendor product {}/{} ({})", vendorId, productKey, created.getVendorProductId());
        return created;
    }

    /**
     * Removes a manual product together with every company assignment of it.
     * Auto-discovered products are deactivated instead, since the next run would rediscover them.
     *
     * @return false if no such product exists
     * @throws BillingPreconditionException if the product was auto-discovered
     */
    public boolean delete(String vendorProductId) {
        Optional<VendorProductDocument> product = vendorProductRepository.findById(vendorProductId);
        if (product.isEmpty()) {
            return false;
        }
        if (product.get().isAutoDiscovered()) {
            throw new BillingPreconditionException(
                    "Cannot delete auto-discovered product " + vendorProductId + ", deactivate it instead");
        }
        long removed = assignmentRepository.deleteByVendorProductId(vendorProductId);
        vendorProductRepository.deleteById(vendorProductId);
        log.info("Deleted vendor product {} and {} company assignments", vendorProductId, removed);
        return true;
    }

    public Optional<VendorProductDocument> setActive(String vendorProductId, boolean active) {
        return vendorProductRepository.findById(vendorProductId).map(product -> {
            product.setActive(active);
            return vendorProductRepository.save(product);
        });
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private VendorProductDocument upsert(String vendorId, String productKey, String productName,
                                         String unit, boolean autoDiscovered) {
        Query query = new Query()
                .addCriteria(Criteria.where("vendorId").is(vendorId))
                .addCriteria(Criteria.where("productKey").is(productKey));
        Update update = new Update()
                .setOnInsert("_id", UUID.randomUUID().toString())
                .setOnInsert("productName", productName)
                .setOnInsert("unit", unit)
                .setOnInsert("active", true)
                .setOnInsert("autoDiscovered", autoDiscovered)
                .setOnInsert("createdAt", Instant.now());
        return mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().upsert(true).returnNew(true), VendorProductDocument.class);
    }
}
