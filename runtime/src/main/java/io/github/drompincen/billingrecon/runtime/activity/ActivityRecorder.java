package io.github.drompincen.billingrecon.runtime.activity;

import io.github.drompincen.billingrecon.persistence.document.BillingActivityDocument;
import io.github.drompincen.billingrecon.persistence.document.ReconciliationItemDocument;
import io.github.drompincen.billingrecon.protocol.api.ActivityAction;
import io.github.drompincen.billingrecon.protocol.api.ActivityResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Append-only billing audit trail. Entries are inserted, never updated or deleted.
 */
@Service
public class ActivityRecorder {

    public static final String SYSTEM_ACTOR = "system";
    public static final int DEFAULT_PAGE_SIZE = 50;
    public static final int MAX_PAGE_SIZE = 100;
    private static final Logger log = LoggerFactory.getLogger(ActivityRecorder.class);

    private final MongoTemplate mongoTemplate;

    public ActivityRecorder(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public BillingActivityDocument record(BillingActivityDocument entry) {
        if (entry.getEntryId() != null) {
            throw new IllegalArgumentException("Activity entries are append-only; entry already has id " + entry.getEntryId());
        }
        entry.setEntryId(UUID.randomUUID().toString());
        entry.setCreatedAt(Instant.now());
        BillingActivityDocument saved = mongoTemplate.insert(entry);
        log.debug("Activity {} {} for item {} ({} -> {})", saved.getAction(), saved.getResult(),
                saved.getItemId(), saved.getPsaQty(), saved.getVendorQty());
        return saved;
    }

    /**
     * A new entry pre-filled from an item: company, product, vendor, both quantities and
     * {@code change = discrepancy}. Callers adjust quantities where the transition changes them.
     */
    public static BillingActivityDocument entryFor(ReconciliationItemDocument item, String companyName,
                                                   ActivityAction action, ActivityResult result,
                                                   String note, String actor) {
        BillingActivityDocument entry = new BillingActivityDocument();
        entry.setCompanyId(item.getCompanyId());
        entry.setCompanyName(companyName);
        entry.setAgreementName(item.getAgreementName());
        entry.setProductName(item.getProductName());
        entry.setVendorId(item.getVendorId());
        entry.setVendorProductName(item.getVendorProductName());
        entry.setPsaQty(item.getPsaQty());
        entry.setVendorQty(item.getVendorQty());
        entry.setChange(item.getDiscrepancy());
        entry.setAction(action);
        entry.setResult(result);
        entry.setResultNote(note);
        entry.setActorId(actorId(actor));
        entry.setActorName(actorName(actor));
        entry.setSnapshotId(item.getSnapshotId());
        entry.setItemId(item.getItemId());
        return entry;
    }

    public static String actorId(String actor) {
        return actor == null || SYSTEM_ACTOR.equals(actor) ? null : actor;
    }

    public static String actorName(String actor) {
        return actor == null || SYSTEM_ACTOR.equals(actor) ? "System" : actor;
    }

    public List<BillingActivityDocument> historyForItem(String itemId) {
        Query query = new Query(Criteria.where("itemId").is(itemId)).with(Sort.by(Sort.Direction.ASC, "createdAt"));
        return mongoTemplate.find(query, BillingActivityDocument.class);
    }

    /**
     * Newest-first page of entries. All filters are optional; {@code search} matches company,
     * product and vendor product names case-insensitively.
     *
     * @return at most {@code size} entries plus whether another page follows
     */
    public ActivitySlice page(String companyId, ActivityAction action, String vendorId,
                              String search, int page, int size) {
        int pageSize = size <= 0 ? DEFAULT_PAGE_SIZE : Math.min(size, MAX_PAGE_SIZE);
        int pageIndex = Math.max(page, 0);

        List<Criteria> filters = new ArrayList<>();
        if (companyId != null) filters.add(Criteria.where("companyId").is(companyId));
        if (action != null) filters.add(Criteria.where("action").is(action));
        if (vendorId != null) filters.add(Criteria.where("vendorId").is(vendorId));
        if (search != null && !search.isBlank()) {
            String pattern = Pattern.quote(search.trim());
            filters.add(new Criteria().orOperator(
                    Criteria.where("companyName").regex(pattern, "i"),
                    Criteria.where("productName").regex(pattern, "i"),
                    Criteria.where("vendorProductName").regex(pattern, "i")));
        }
        Query query = filters.isEmpty()
                ? new Query()
                : new Query(new Criteria().andOperator(filters.toArray(new Criteria[0])));
        query.with(Sort.by(Sort.Direction.DESC, "createdAt"))
                .skip((long) pageIndex * pageSize)
                .limit(pageSize + 1);

        List<BillingActivityDocument> rows = mongoTemplate.find(query, BillingActivityDocument.class);
        boolean hasMore = rows.size() > pageSize;
        return new ActivitySlice(hasMore ? rows.subList(0, pageSize) : rows, pageIndex, pageSize, hasMore);
    }

    public record ActivitySlice(List<BillingActivityDocument> entries, int page, int size, boolean hasMore) {}
}
