package io.github.drompincen.billingrecon.runtime.reconcile;

import io.github.drompincen.billingrecon.persistence.document.CompanyDocument;
import io.github.drompincen.billingrecon.persistence.document.ProductMappingDocument;
import io.github.drompincen.billingrecon.persistence.document.ReconciliationItemDocument;
import io.github.drompincen.billingrecon.persistence.document.ReconciliationSnapshotDocument;
import io.github.drompincen.billingrecon.persistence.document.VendorProductDocument;
import io.github.drompincen.billingrecon.persistence.repository.CompanyRepository;
import io.github.drompincen.billingrecon.persistence.repository.ReconciliationItemRepository;
import io.github.drompincen.billingrecon.persistence.repository.ReconciliationSnapshotRepository;
import io.github.drompincen.billingrecon.protocol.api.*;
import io.github.drompincen.billingrecon.runtime.activity.ActivityRecorder;
import io.github.drompincen.billingrecon.runtime.lock.CompanyLeaseService;
import io.github.drompincen.billingrecon.runtime.mapping.CompanyAssignmentService;
import io.github.drompincen.billingrecon.runtime.mapping.ProductMappingResolver;
import io.github.drompincen.billingrecon.runtime.mapping.VendorProductCatalog;
import io.github.drompincen.billingrecon.runtime.psa.BillingLineMatcher;
import io.github.drompincen.billingrecon.runtime.psa.PsaBillingLineService;
import io.github.drompincen.billingrecon.runtime.vendor.AggregationReport;
import io.github.drompincen.billingrecon.runtime.vendor.VendorCountAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Compares one company's vendor usage against its PSA billing lines and stores the result
 * as a snapshot of items.
 *
 * <p>For each vendor count and each mapping that applies to it, the PSA lines whose product
 * name matches the mapped name are summed ({@code psaQty}) and their unit prices averaged.
 * {@code discrepancy = vendorQty - psaQty}; {@code revenueImpact = discrepancy * avgUnitPrice},
 * or null when no line matched. Only a discrepancy of exactly zero is auto-approved.
 *
 * <p>A run that throws marks its snapshot {@code FAILED} with the partial summary and the
 * error message before the exception propagates.
 */
@Service
public class ReconciliationEngine {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);
    static final int PRICE_SCALE = 4;

    private final CompanyRepository companyRepository;
    private final ReconciliationSnapshotRepository snapshotRepository;
    private final ReconciliationItemRepository itemRepository;
    private final VendorCountAggregator aggregator;
    private final ProductMappingResolver mappingResolver;
    private final PsaBillingLineService billingLineService;
    private final BillingLineMatcher lineMatcher;
    private final VendorProductCatalog catalog;
    private final CompanyAssignmentService assignmentService;
    private final ActivityRecorder activityRecorder;
    private final CompanyLeaseService leaseService;

    public ReconciliationEngine(CompanyRepository companyRepository,
                                ReconciliationSnapshotRepository snapshotRepository,
                                ReconciliationItemRepository itemRepository,
                                VendorCountAggregator aggregator,
                                ProductMappingResolver mappingResolver,
                                PsaBillingLineService billingLineService,
                                BillingLineMatcher lineMatcher,
                                VendorProductCatalog catalog,
                                CompanyAssignmentService assignmentService,
                                ActivityRecorder activityRecorder,
                                CompanyLeaseService leaseService) {
        this.companyRepository = companyRepository;
        this.snapshotRepository = snapshotRepository;
        this.itemRepository = itemRepository;
        this.aggregator = aggregator;
        this.mappingResolver = mappingResolver;
        this.billingLineService = billingLineService;
        this.lineMatcher = lineMatcher;
        this.catalog = catalog;
        this.assignmentService = assignmentService;
        this.activityRecorder = activityRecorder;
        this.leaseService = leaseService;
    }

    public ReconciliationResult reconcile(String companyId, String actorId) {
        return reconcile(companyId, actorId, null);
    }

    /**
     * @param prefetched vendor counts already fetched by a bulk pass, or null to aggregate now
     * @throws BillingNotFoundException if the company does not exist
     * @throws io.github.drompincen.billingrecon.runtime.lock.CompanyBusyException if another
     *         reconciliation or write-back holds the company
     */
    public ReconciliationResult reconcile(String companyId, String actorId, AggregationReport prefetched) {
        CompanyDocument company = companyRepository.findById(companyId)
                .orElseThrow(() -> new BillingNotFoundException("company", companyId));
        String actor = actorId != null ? actorId : ActivityRecorder.SYSTEM_ACTOR;
        return leaseService.withLease(companyId, "reconcile", () -> run(company, actor, prefetched));
    }

    private ReconciliationResult run(CompanyDocument company, String actor, AggregationReport prefetched) {
        String companyId = company.getCompanyId();
        catalog.ensureSeeded();

        ReconciliationSnapshotDocument snapshot = new ReconciliationSnapshotDocument();
        snapshot.setSnapshotId(UUID.randomUUID().toString());
        snapshot.setCompanyId(companyId);
        snapshot.setTriggeredBy(actor);
        snapshot.setStatus(SnapshotStatus.IN_PROGRESS);
        snapshot.setSummary(new ReconciliationSnapshotDocument.Summary());
        snapshot.setCreatedAt(Instant.now());
        snapshotRepository.save(snapshot);

        Tally tally = new Tally();
        AggregationReport report = AggregationReport.empty();
        try {
            List<PsaBillingLine> lines = billingLineService.currentLines(companyId);
            report = prefetched != null ? prefetched : aggregator.aggregate(companyId);
            recordAssignments(companyId, report.counts());

            for (VendorCount count : report.counts()) {
                for (ProductMappingDocument mapping : mappingResolver.resolve(count.vendorId(), count.productKey())) {
                    ReconciliationItemDocument item = reconcileCount(snapshot, company, count, mapping, lines, actor);
                    if (item != null) {
                        tally.add(item);
                    }
                }
            }

            finish(snapshot, SnapshotStatus.COMPLETED, tally, report.failures(), null);
            log.info("Reconciled company {} ({}): {} items, {} discrepancies, revenue impact {}{}",
                    companyId, company.getName(), tally.totalItems, tally.discrepancies, tally.revenueImpact,
                    report.hasFailures() ? ", " + report.failures().size() + " vendor sources failed" : "");
            return new ReconciliationResult(snapshot.getSnapshotId(), companyId, company.getName(),
                    tally.totalItems, tally.discrepancies, tally.revenueImpact, report.failures());
        } catch (RuntimeException e) {
            finish(snapshot, SnapshotStatus.FAILED, tally, report.failures(),
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            log.error("Reconciliation of company {} failed after {} items", companyId, tally.totalItems, e);
            throw e;
        }
    }

    private void recordAssignments(String companyId, List<VendorCount> counts) {
        for (VendorCount count : counts) {
            if (count.count() == 0) continue;
            VendorProductDocument product = catalog.register(count);
            assignmentService.ensureAssigned(companyId, product.getVendorProductId(), true);
        }
    }

    private ReconciliationItemDocument reconcileCount(ReconciliationSnapshotDocument snapshot, CompanyDocument company,
                                                      VendorCount count, ProductMappingDocument mapping,
                                                      List<PsaBillingLine> lines, String actor) {
        List<PsaBillingLine> matched = lineMatcher.matching(lines, mapping.getPsaProductName());

        ReconciliationItemDocument item = new ReconciliationItemDocument();
        item.setItemId(UUID.randomUUID().toString());
        item.setSnapshotId(snapshot.getSnapshotId());
        item.setCompanyId(company.getCompanyId());
        item.setVendorId(count.vendorId());
        item.setVendorProductKey(count.productKey());
        item.setVendorProductName(count.productName());
        item.setVendorQty(count.count());
        item.setCreatedAt(Instant.now());

        ActivityAction action;
        ActivityResult result;
        String note;
        if (matched.isEmpty()) {
            if (count.count() == 0) {
                return null;
            }
            item.setProductName(mapping.getPsaProductName());
            item.setPsaQty(0);
            item.setDiscrepancy(count.count());
            item.setStatus(ItemStatus.PENDING);
            action = ActivityAction.DETECTED;
            result = ActivityResult.PENDING;
            note = "No matching PSA line found";
        } else {
            PsaBillingLine first = matched.get(0);
            int psaQty = matched.stream().mapToInt(PsaBillingLine::quantity).sum();
            BigDecimal avgPrice = averageUnitPrice(matched);
            int diff = count.count() - psaQty;

            item.setProductName(first.productName());
            item.setAgreementName(first.agreementName());
            item.setLinkedAgreementId(first.externalAgreementId());
            item.setLinkedLineId(first.externalLineId());
            item.setOtherLinesQty(psaQty - first.quantity());
            item.setPsaQty(psaQty);
            item.setDiscrepancy(diff);
            item.setUnitPrice(avgPrice);
            item.setRevenueImpact(avgPrice.multiply(BigDecimal.valueOf(diff)));
            if (diff == 0) {
                item.setStatus(ItemStatus.APPROVED);
                action = ActivityAction.AUTO_APPROVED;
                result = ActivityResult.NO_ACTION;
                note = "Counts match";
            } else {
                item.setStatus(ItemStatus.PENDING);
                action = ActivityAction.DETECTED;
                result = ActivityResult.PENDING;
                note = diff > 0 ? "Underbilled by " + diff : "Overbilled by " + Math.abs(diff);
            }
        }

        itemRepository.save(item);
        activityRecorder.record(ActivityRecorder.entryFor(item, company.getName(), action, result, note, actor));
        return item;
    }

    static BigDecimal averageUnitPrice(List<PsaBillingLine> lines) {
        BigDecimal total = lines.stream()
                .map(PsaBillingLine::unitPrice)
                .map(p -> Objects.requireNonNullElse(p, BigDecimal.ZERO))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return total.divide(BigDecimal.valueOf(lines.size()), PRICE_SCALE, RoundingMode.HALF_UP);
    }

    private void finish(ReconciliationSnapshotDocument snapshot, SnapshotStatus status, Tally tally,
                        List<VendorFailure> failures, String errorMessage) {
        snapshot.setStatus(status);
        snapshot.setSummary(new ReconciliationSnapshotDocument.Summary(tally.totalItems, tally.discrepancies,
                tally.revenueImpact, tally.totalItems - tally.discrepancies));
        snapshot.setVendorFailures(failures.stream()
                .map(f -> new ReconciliationSnapshotDocument.VendorFailureEntry(f.vendorId(), f.companyExternalId(), f.reason()))
                .collect(Collectors.toList()));
        snapshot.setErrorMessage(errorMessage);
        snapshot.setCompletedAt(Instant.now());
        snapshotRepository.save(snapshot);
    }

    private static final class Tally {
        int totalItems;
        int discrepancies;
        BigDecimal revenueImpact = BigDecimal.ZERO;

        void add(ReconciliationItemDocument item) {
            totalItems++;
            if (item.getDiscrepancy() != 0) discrepancies++;
            if (item.getRevenueImpact() != null) revenueImpact = revenueImpact.add(item.getRevenueImpact());
        }
    }
}
