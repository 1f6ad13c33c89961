package io.github.drompincen.billingrecon.runtime.reconcile;

import io.github.drompincen.billingrecon.persistence.document.BillingSyncStateDocument;
import io.github.drompincen.billingrecon.persistence.document.CompanyDocument;
import io.github.drompincen.billingrecon.persistence.document.ProductMappingDocument;
import io.github.drompincen.billingrecon.persistence.document.ReconciliationItemDocument;
import io.github.drompincen.billingrecon.persistence.document.ReconciliationSnapshotDocument;
import io.github.drompincen.billingrecon.persistence.repository.BillingSyncStateRepository;
import io.github.drompincen.billingrecon.persistence.repository.CompanyRepository;
import io.github.drompincen.billingrecon.persistence.repository.ReconciliationItemRepository;
import io.github.drompincen.billingrecon.persistence.repository.ReconciliationSnapshotRepository;
import io.github.drompincen.billingrecon.protocol.api.BillingOverviewDto;
import io.github.drompincen.billingrecon.protocol.api.CompanyVendorProductDto;
import io.github.drompincen.billingrecon.protocol.api.ItemStatus;
import io.github.drompincen.billingrecon.protocol.api.SnapshotStatus;
import io.github.drompincen.billingrecon.protocol.api.SyncStateDto;
import io.github.drompincen.billingrecon.protocol.api.VendorCount;
import io.github.drompincen.billingrecon.runtime.mapping.ProductMappingResolver;
import io.github.drompincen.billingrecon.runtime.vendor.AggregationReport;
import io.github.drompincen.billingrecon.runtime.vendor.VendorCountAggregator;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read side of reconciliation: snapshots, items, the cross-company overview and live
 * vendor products of a company.
 */
@Service
public class BillingQueryService {

    private final CompanyRepository companyRepository;
    private final ReconciliationSnapshotRepository snapshotRepository;
    private final ReconciliationItemRepository itemRepository;
    private final BillingSyncStateRepository syncStateRepository;
    private final VendorCountAggregator aggregator;
    private final ProductMappingResolver mappingResolver;

    public BillingQueryService(CompanyRepository companyRepository,
                               ReconciliationSnapshotRepository snapshotRepository,
                               ReconciliationItemRepository itemRepository,
                               BillingSyncStateRepository syncStateRepository,
                               VendorCountAggregator aggregator,
                               ProductMappingResolver mappingResolver) {
        this.companyRepository = companyRepository;
        this.snapshotRepository = snapshotRepository;
        this.itemRepository = itemRepository;
        this.syncStateRepository = syncStateRepository;
        this.aggregator = aggregator;
        this.mappingResolver = mappingResolver;
    }

    public List<ReconciliationSnapshotDocument> snapshots(String companyId) {
        return snapshotRepository.findByCompanyIdOrderByCreatedAtDesc(companyId);
    }

    public Optional<ReconciliationSnapshotDocument> latestCompleted(String companyId) {
        return snapshotRepository.findFirstByCompanyIdAndStatusOrderByCreatedAtDesc(companyId, SnapshotStatus.COMPLETED);
    }

    public Optional<ReconciliationSnapshotDocument> snapshot(String snapshotId) {
        return snapshotRepository.findById(snapshotId);
    }

    public List<ReconciliationItemDocument> items(String snapshotId, ItemStatus status) {
        return status == null
                ? itemRepository.findBySnapshotId(snapshotId)
                : itemRepository.findBySnapshotIdAndStatus(snapshotId, status);
    }

    public Optional<ReconciliationItemDocument> item(String itemId) {
        return itemRepository.findById(itemId);
    }

    /**
     * Totals over the latest completed snapshot of every company. Discrepancies and revenue
     * impact only count items still pending; matched items are those with no discrepancy.
     */
    public BillingOverviewDto overview() {
        List<String> latestSnapshotIds = new ArrayList<>();
        for (CompanyDocument company : companyRepository.findAll()) {
            latestCompleted(company.getCompanyId())
                    .map(ReconciliationSnapshotDocument::getSnapshotId)
                    .ifPresent(latestSnapshotIds::add);
        }
        List<ReconciliationItemDocument> items = latestSnapshotIds.isEmpty()
                ? List.of()
                : itemRepository.findBySnapshotIdIn(latestSnapshotIds);

        int discrepancies = 0;
        int matched = 0;
        BigDecimal revenueImpact = BigDecimal.ZERO;
        Set<String> companiesWithIssues = new HashSet<>();
        for (ReconciliationItemDocument item : items) {
            if (item.getDiscrepancy() == 0) {
                matched++;
            } else if (item.getStatus() == ItemStatus.PENDING) {
                discrepancies++;
                companiesWithIssues.add(item.getCompanyId());
                if (item.getRevenueImpact() != null) {
                    revenueImpact = revenueImpact.add(item.getRevenueImpact());
                }
            }
        }
        return new BillingOverviewDto(items.size(), discrepancies, revenueImpact, matched,
                companiesWithIssues.size(), syncState().lastSyncAt());
    }

    /**
     * Live vendor counts of a company, one row per applicable mapping, or a single unmapped
     * row when no mapping resolves. Vendors that fail to answer are left out.
     */
    public List<CompanyVendorProductDto> companyVendorProducts(String companyId) {
        if (!companyRepository.existsById(companyId)) {
            throw new BillingNotFoundException("company", companyId);
        }
        AggregationReport report = aggregator.aggregate(companyId);
        List<CompanyVendorProductDto> rows = new ArrayList<>();
        for (VendorCount count : report.counts()) {
            List<ProductMappingDocument> mappings = mappingResolver.resolve(count.vendorId(), count.productKey());
            if (mappings.isEmpty()) {
                rows.add(new CompanyVendorProductDto(count.vendorId(), count.productKey(), count.productName(),
                        count.count(), count.unit(), false, null, null));
                continue;
            }
            rows.addAll(mappings.stream()
                    .map(m -> new CompanyVendorProductDto(count.vendorId(), count.productKey(), count.productName(),
                            count.count(), count.unit(), true, m.getMappingId(), m.getPsaProductName()))
                    .collect(Collectors.toList()));
        }
        return rows;
    }

    public SyncStateDto syncState() {
        return syncStateRepository.findById(BillingSyncStateDocument.DEFAULT_ID)
                .map(s -> new SyncStateDto(s.getLastSyncAt(), s.getLastSyncStatus(), s.getProcessed(),
                        s.getErrors(), s.getTotal()))
                .orElseGet(() -> new SyncStateDto(null, null, 0, 0, 0));
    }
}
