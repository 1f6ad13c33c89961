package io.github.drompincen.billingrecon.runtime.reconcile;

import io.github.drompincen.billingrecon.persistence.document.CompanyDocument;
import io.github.drompincen.billingrecon.persistence.document.ReconciliationItemDocument;
import io.github.drompincen.billingrecon.persistence.repository.CompanyRepository;
import io.github.drompincen.billingrecon.persistence.repository.ReconciliationItemRepository;
import io.github.drompincen.billingrecon.protocol.api.ActivityResult;
import io.github.drompincen.billingrecon.protocol.api.ItemStatus;
import io.github.drompincen.billingrecon.protocol.api.ResolveAction;
import io.github.drompincen.billingrecon.runtime.activity.ActivityRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Operator approval and dismissal of reconciliation items. Items already written back to
 * the PSA are final.
 */
@Service
public class ItemResolutionService {

    private static final Logger log = LoggerFactory.getLogger(ItemResolutionService.class);

    private final ReconciliationItemRepository itemRepository;
    private final CompanyRepository companyRepository;
    private final ActivityRecorder activityRecorder;

    public ItemResolutionService(ReconciliationItemRepository itemRepository,
                                 CompanyRepository companyRepository,
                                 ActivityRecorder activityRecorder) {
        this.itemRepository = itemRepository;
        this.companyRepository = companyRepository;
        this.activityRecorder = activityRecorder;
    }

    public ReconciliationItemDocument resolve(String itemId, ResolveAction action, String actorId, String note) {
        ReconciliationItemDocument item = itemRepository.findById(itemId)
                .orElseThrow(() -> new BillingNotFoundException("reconciliation item", itemId));
        String defaultNote = action == ResolveAction.APPROVE ? "Approved by user" : "Dismissed by user";
        return apply(item, action, actorId, note != null ? note : defaultNote);
    }

    /**
     * Resolves every listed item that exists and is not yet adjusted; the rest are skipped.
     *
     * @return the items that changed
     */
    public List<ReconciliationItemDocument> bulkResolve(List<String> itemIds, ResolveAction action,
                                                        String actorId, String note) {
        String bulkNote = note != null ? note : "Bulk " + action.name().toLowerCase();
        List<ReconciliationItemDocument> updated = new ArrayList<>();
        for (ReconciliationItemDocument item : itemRepository.findAllById(itemIds)) {
            if (item.getStatus() == ItemStatus.ADJUSTED) {
                log.info("Skipping item {}: already written back to the PSA", item.getItemId());
                continue;
            }
            updated.add(apply(item, action, actorId, bulkNote));
        }
        return updated;
    }

    private ReconciliationItemDocument apply(ReconciliationItemDocument item, ResolveAction action,
                                             String actorId, String note) {
        if (item.getStatus() == ItemStatus.ADJUSTED) {
            throw new BillingPreconditionException("Item " + item.getItemId() + " was already written back to the PSA");
        }
        item.setStatus(action.targetStatus());
        item.setResolvedBy(actorId);
        item.setResolvedAt(Instant.now());
        item.setResolvedNote(note);
        ReconciliationItemDocument saved = itemRepository.save(item);

        String companyName = companyRepository.findById(item.getCompanyId())
                .map(CompanyDocument::getName)
                .orElse("Unknown");
        activityRecorder.record(ActivityRecorder.entryFor(saved, companyName, action.activityAction(),
                ActivityResult.SUCCESS, note, actorId));
        return saved;
    }
}
