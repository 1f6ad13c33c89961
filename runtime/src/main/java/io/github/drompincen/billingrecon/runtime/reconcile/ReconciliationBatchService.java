package io.github.drompincen.billingrecon.runtime.reconcile;

import io.github.drompincen.billingrecon.persistence.document.BillingSyncStateDocument;
import io.github.drompincen.billingrecon.persistence.document.CompanyDocument;
import io.github.drompincen.billingrecon.persistence.repository.BillingSyncStateRepository;
import io.github.drompincen.billingrecon.persistence.repository.CompanyRepository;
import io.github.drompincen.billingrecon.protocol.api.CompanyReconcileOutcome;
import io.github.drompincen.billingrecon.protocol.api.ReconciliationResult;
import io.github.drompincen.billingrecon.protocol.api.VendorFailure;
import io.github.drompincen.billingrecon.runtime.activity.ActivityRecorder;
import io.github.drompincen.billingrecon.runtime.vendor.AggregationReport;
import io.github.drompincen.billingrecon.runtime.vendor.VendorCountAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reconciles every sync-enabled company with an active agreement, one company at a time.
 * A company that throws is reported with its error and the batch moves on; re-running the
 * batch simply reconciles every company again.
 */
@Service
public class ReconciliationBatchService {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationBatchService.class);
    static final String STATUS_COMPLETED = "completed";
    static final String STATUS_COMPLETED_WITH_ERRORS = "completed_with_errors";

    private final CompanyRepository companyRepository;
    private final BillingSyncStateRepository syncStateRepository;
    private final ReconciliationEngine engine;
    private final VendorCountAggregator aggregator;
    private final boolean bulkPrefetch;
    private final boolean scheduleEnabled;

    public ReconciliationBatchService(CompanyRepository companyRepository,
                                      BillingSyncStateRepository syncStateRepository,
                                      ReconciliationEngine engine,
                                      VendorCountAggregator aggregator,
                                      @Value("${billing.reconcile.bulk-prefetch:true}") boolean bulkPrefetch,
                                      @Value("${billing.reconcile.schedule.enabled:false}") boolean scheduleEnabled) {
        this.companyRepository = companyRepository;
        this.syncStateRepository = syncStateRepository;
        this.engine = engine;
        this.aggregator = aggregator;
        this.bulkPrefetch = bulkPrefetch;
        this.scheduleEnabled = scheduleEnabled;
    }

    public List<CompanyReconcileOutcome> reconcileAll(String actorId) {
        List<CompanyDocument> companies = companyRepository.findBySyncEnabledTrueAndHasActiveAgreementTrueOrderByNameAsc();
        log.info("Starting batch reconciliation of {} companies (bulk prefetch {})",
                companies.size(), bulkPrefetch ? "on" : "off");

        Map<String, AggregationReport> prefetched = bulkPrefetch ? aggregator.aggregateAll() : null;

        List<CompanyReconcileOutcome> outcomes = new ArrayList<>();
        for (CompanyDocument company : companies) {
            outcomes.add(reconcileOne(company, actorId, prefetched));
        }

        long errors = outcomes.stream().filter(CompanyReconcileOutcome::hasError).count();
        recordSyncState(outcomes.size(), (int) errors);
        log.info("Batch reconciliation finished: {} companies, {} with errors", outcomes.size(), errors);
        return outcomes;
    }

    @Scheduled(cron = "${billing.reconcile.schedule.cron:0 0 6 * * *}")
    public void scheduledReconcileAll() {
        if (!scheduleEnabled) {
            return;
        }
        reconcileAll(ActivityRecorder.SYSTEM_ACTOR);
    }

    private CompanyReconcileOutcome reconcileOne(CompanyDocument company, String actorId,
                                                 Map<String, AggregationReport> prefetched) {
        String companyId = company.getCompanyId();
        try {
            AggregationReport counts = prefetched == null
                    ? null
                    : prefetched.getOrDefault(companyId, AggregationReport.empty());
            ReconciliationResult result = engine.reconcile(companyId, actorId, counts);
            return new CompanyReconcileOutcome(companyId, company.getName(), result.snapshotId(),
                    result.discrepancies(), describe(result.vendorFailures()));
        } catch (RuntimeException e) {
            log.warn("Batch reconciliation of company {} failed: {}", companyId, e.getMessage());
            return CompanyReconcileOutcome.failed(companyId, company.getName(),
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    static String describe(List<VendorFailure> failures) {
        if (failures == null || failures.isEmpty()) {
            return null;
        }
        return failures.stream()
                .map(f -> f.vendorId() + " unavailable: " + f.reason())
                .collect(Collectors.joining("; "));
    }

    private void recordSyncState(int total, int errors) {
        BillingSyncStateDocument state = syncStateRepository.findById(BillingSyncStateDocument.DEFAULT_ID)
                .orElseGet(BillingSyncStateDocument::new);
        state.setLastSyncAt(Instant.now());
        state.setLastSyncStatus(errors == 0 ? STATUS_COMPLETED : STATUS_COMPLETED_WITH_ERRORS);
        state.setProcessed(total - errors);
        state.setErrors(errors);
        state.setTotal(total);
        syncStateRepository.save(state);
    }
}
