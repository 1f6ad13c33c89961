package io.github.drompincen.billingrecon.runtime.writeback;

import io.github.drompincen.billingrecon.persistence.document.BillingActivityDocument;
import io.github.drompincen.billingrecon.persistence.document.CompanyDocument;
import io.github.drompincen.billingrecon.persistence.document.IntegrationMappingDocument;
import io.github.drompincen.billingrecon.persistence.document.ReconciliationItemDocument;
import io.github.drompincen.billingrecon.persistence.repository.CompanyRepository;
import io.github.drompincen.billingrecon.persistence.repository.IntegrationMappingRepository;
import io.github.drompincen.billingrecon.persistence.repository.ReconciliationItemRepository;
import io.github.drompincen.billingrecon.protocol.api.ActivityAction;
import io.github.drompincen.billingrecon.protocol.api.ActivityResult;
import io.github.drompincen.billingrecon.protocol.api.ItemStatus;
import io.github.drompincen.billingrecon.protocol.api.WriteBackResult;
import io.github.drompincen.billingrecon.runtime.activity.ActivityRecorder;
import io.github.drompincen.billingrecon.runtime.lock.CompanyLeaseService;
import io.github.drompincen.billingrecon.runtime.psa.PsaBillingLineService;
import io.github.drompincen.billingrecon.runtime.reconcile.BillingNotFoundException;
import io.github.drompincen.billingrecon.runtime.reconcile.BillingPreconditionException;
import io.github.drompincen.billingrecon.runtime.vendor.VendorCountAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Pushes the live vendor count of a reconciled item into its linked PSA billing line.
 *
 * <p>The count is fetched again at write-back time rather than taken from the snapshot,
 * so the PSA receives what the vendor reports now. After a successful write the item is
 * {@code ADJUSTED} with both quantities equal to the live count.
 *
 * <p>When the item was matched against several PSA lines, only the linked line is written;
 * it receives the live count minus what the other matched lines bill.
 */
@Service
public class PsaWriteBackCoordinator {

    private static final Logger log = LoggerFactory.getLogger(PsaWriteBackCoordinator.class);

    private final ReconciliationItemRepository itemRepository;
    private final CompanyRepository companyRepository;
    private final IntegrationMappingRepository integrationMappingRepository;
    private final VendorCountAggregator aggregator;
    private final PsaBillingLineService billingLineService;
    private final ActivityRecorder activityRecorder;
    private final CompanyLeaseService leaseService;

    public PsaWriteBackCoordinator(ReconciliationItemRepository itemRepository,
                                   CompanyRepository companyRepository,
                                   IntegrationMappingRepository integrationMappingRepository,
                                   VendorCountAggregator aggregator,
                                   PsaBillingLineService billingLineService,
                                   ActivityRecorder activityRecorder,
                                   CompanyLeaseService leaseService) {
        this.itemRepository = itemRepository;
        this.companyRepository = companyRepository;
        this.integrationMappingRepository = integrationMappingRepository;
        this.aggregator = aggregator;
        this.billingLineService = billingLineService;
        this.activityRecorder = activityRecorder;
        this.leaseService = leaseService;
    }

    /**
     * @throws BillingNotFoundException if the item does not exist
     * @throws BillingPreconditionException if the item has no linked PSA line, the company has
     *         no integration mapping for the item's vendor, no PSA client is configured, or the
     *         live count is below the quantity billed on the other matched lines
     * @throws io.github.drompincen.billingrecon.runtime.lock.CompanyBusyException if the
     *         company is being reconciled or written back
     */
    public WriteBackResult writeBack(String itemId, String actorId) {
        ReconciliationItemDocument item = itemRepository.findById(itemId)
                .orElseThrow(() -> new BillingNotFoundException("reconciliation item", itemId));
        if (!item.isLinkedToPsa()) {
            throw new BillingPreconditionException("Item " + itemId + " is not linked to a PSA agreement line");
        }
        String actor = actorId != null ? actorId : ActivityRecorder.SYSTEM_ACTOR;
        return leaseService.withLease(item.getCompanyId(), "write-back", () -> apply(item, actor));
    }

    /**
     * Writes back each item in order. A failing item is reported with its error and does not
     * stop the rest.
     */
    public List<WriteBackResult> writeBackMany(List<String> itemIds, String actorId) {
        List<WriteBackResult> results = new ArrayList<>();
        for (String itemId : itemIds) {
            try {
                results.add(writeBack(itemId, actorId));
            } catch (RuntimeException e) {
                log.warn("Write-back of item {} failed: {}", itemId, e.getMessage());
                results.add(WriteBackResult.failure(itemId,
                        e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
            }
        }
        return results;
    }

    private WriteBackResult apply(ReconciliationItemDocument item, String actor) {
        IntegrationMappingDocument mapping = integrationMappingRepository
                .findByCompanyIdAndVendorId(item.getCompanyId(), item.getVendorId())
                .orElseThrow(() -> new BillingPreconditionException(
                        "Company " + item.getCompanyId() + " has no " + item.getVendorId() + " integration mapping"));
        if (!billingLineService.isConfigured()) {
            throw new BillingPreconditionException("No PSA client configured for write-back");
        }

        int liveCount = aggregator.liveCount(item.getVendorId(), mapping.getExternalId(), item.getVendorProductKey());
        int oldQty = item.getPsaQty();
        // other matched lines keep their quantity; the linked line absorbs the difference
        int lineQty = liveCount - item.getOtherLinesQty();
        if (lineQty < 0) {
            throw new BillingPreconditionException("Live count " + liveCount + " for item " + item.getItemId()
                    + " is below the " + item.getOtherLinesQty() + " billed on other matched PSA lines");
        }
        billingLineService.updateQuantity(item.getLinkedAgreementId(), item.getLinkedLineId(), lineQty);

        String note = "Updated PSA qty from " + oldQty + " to " + liveCount;
        item.setStatus(ItemStatus.ADJUSTED);
        item.setPsaQty(liveCount);
        item.setVendorQty(liveCount);
        item.setDiscrepancy(0);
        item.setRevenueImpact(BigDecimal.ZERO);
        item.setResolvedBy(actor);
        item.setResolvedAt(Instant.now());
        item.setResolvedNote(note);
        itemRepository.save(item);

        String companyName = companyRepository.findById(item.getCompanyId())
                .map(CompanyDocument::getName)
                .orElse("Unknown");
        BillingActivityDocument entry = ActivityRecorder.entryFor(item, companyName,
                ActivityAction.SYNCED_TO_PSA, ActivityResult.SUCCESS, note, actor);
        entry.setPsaQty(oldQty);
        entry.setVendorQty(liveCount);
        entry.setChange(liveCount - oldQty);
        activityRecorder.record(entry);

        log.info("Wrote back item {} ({}): PSA quantity {} -> {}", item.getItemId(), item.getProductName(),
                oldQty, liveCount);
        return WriteBackResult.success(item.getItemId(), item.getProductName(), oldQty, liveCount);
    }
}
