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
import io.github.drompincen.billingrecon.protocol.api.VendorCount;
import io.github.drompincen.billingrecon.runtime.mapping.ProductMappingResolver;
import io.github.drompincen.billingrecon.runtime.vendor.AggregationReport;
import io.github.drompincen.billingrecon.runtime.vendor.VendorCountAggregator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class BillingQueryServiceTest {

    @Mock private CompanyRepository companyRepository;
    @Mock private ReconciliationSnapshotRepository snapshotRepository;
    @Mock private ReconciliationItemRepository itemRepository;
    @Mock private BillingSyncStateRepository syncStateRepository;
    @Mock private VendorCountAggregator aggregator;
    @Mock private ProductMappingResolver mappingResolver;

    private BillingQueryService service;

    @BeforeEach
    void setUp() {
        service = new BillingQueryService(companyRepository, snapshotRepository, itemRepository,
                syncStateRepository, aggregator, mappingResolver);
    }

    @Test
    void overviewCountsOnlyLatestCompletedSnapshots() {
        when(companyRepository.findAll()).thenReturn(List.of(company("a"), company("b"), company("c")));
        when(snapshotRepository.findFirstByCompanyIdAndStatusOrderByCreatedAtDesc("a", SnapshotStatus.COMPLETED))
                .thenReturn(Optional.of(snapshot("snap-a")));
        when(snapshotRepository.findFirstByCompanyIdAndStatusOrderByCreatedAtDesc("b", SnapshotStatus.COMPLETED))
                .thenReturn(Optional.of(snapshot("snap-b")));
        when(snapshotRepository.findFirstByCompanyIdAndStatusOrderByCreatedAtDesc("c", SnapshotStatus.COMPLETED))
                .thenReturn(Optional.empty());
        when(itemRepository.findBySnapshotIdIn(List.of("snap-a", "snap-b"))).thenReturn(List.of(
                item("a", ItemStatus.PENDING, 5, "62.50"),
                item("a", ItemStatus.APPROVED, 0, "0"),
                item("a", ItemStatus.DISMISSED, -2, "-10.00"),
                item("b", ItemStatus.PENDING, 3, null),
                item("b", ItemStatus.ADJUSTED, 0, "0")));
        BillingSyncStateDocument state = new BillingSyncStateDocument();
        Instant lastSync = Instant.parse("2026-10-01T06:00:00Z");
        state.setLastSyncAt(lastSync);
        when(syncStateRepository.findById(BillingSyncStateDocument.DEFAULT_ID)).thenReturn(Optional.of(state));

        BillingOverviewDto overview = service.overview();

        assertThat(overview.totalItems()).isEqualTo(5);
        assertThat(overview.discrepancies()).isEqualTo(2);
        assertThat(overview.totalRevenueImpact()).isEqualByComparingTo("62.50");
        assertThat(overview.matchedCount()).isEqualTo(2);
        assertThat(overview.companiesWithIssues()).isEqualTo(2);
        assertThat(overview.lastSyncAt()).isEqualTo(lastSync);
    }

    @Test
    void overviewWithoutSnapshotsIsEmpty() {
        when(companyRepository.findAll()).thenReturn(List.of());

        BillingOverviewDto overview = service.overview();

        assertThat(overview.totalItems()).isZero();
        assertThat(overview.totalRevenueImpact()).isEqualByComparingTo("0");
        assertThat(overview.lastSyncAt()).isNull();
    }

    @Test
    void companyVendorProductsShowsMappingStatus() {
        when(companyRepository.existsById("a")).thenReturn(true);
        when(aggregator.aggregate("a")).thenReturn(new AggregationReport(List.of(
                new VendorCount("ninjaone", "workstations", "NinjaOne Workstations", 12, "devices", "org-a", Instant.now()),
                new VendorCount("pax8", "exchange_online", "Exchange Online", 4, "licenses", "p-a", Instant.now())),
                List.of()));
        ProductMappingDocument mapping = new ProductMappingDocument();
        mapping.setMappingId("m1");
        mapping.setPsaProductName("Managed Workstation");
        when(mappingResolver.resolve("ninjaone", "workstations")).thenReturn(List.of(mapping));
        when(mappingResolver.resolve("pax8", "exchange_online")).thenReturn(List.of());

        List<CompanyVendorProductDto> rows = service.companyVendorProducts("a");

        assertThat(rows).extracting(CompanyVendorProductDto::productKey, CompanyVendorProductDto::mapped,
                        CompanyVendorProductDto::psaProductName)
                .containsExactly(
                        tuple("workstations", true, "Managed Workstation"),
                        tuple("exchange_online", false, null));
    }

    @Test
    void companyVendorProductsRejectsUnknownCompany() {
        when(companyRepository.existsById("x")).thenReturn(false);

        assertThatThrownBy(() -> service.companyVendorProducts("x")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void itemsFilterByStatusWhenGiven() {
        when(itemRepository.findBySnapshotIdAndStatus("s1", ItemStatus.PENDING))
                .thenReturn(List.of(item("a", ItemStatus.PENDING, 1, null)));

        assertThat(service.items("s1", ItemStatus.PENDING)).hasSize(1);
        assertThat(service.items("s1", null)).isEmpty();
    }

    private static CompanyDocument company(String id) {
        CompanyDocument company = new CompanyDocument();
        company.setCompanyId(id);
        company.setName(id.toUpperCase());
        return company;
    }

    private static ReconciliationSnapshotDocument snapshot(String id) {
        ReconciliationSnapshotDocument snapshot = new ReconciliationSnapshotDocument();
        snapshot.setSnapshotId(id);
        snapshot.setStatus(SnapshotStatus.COMPLETED);
        return snapshot;
    }

    private static ReconciliationItemDocument item(String companyId, ItemStatus status, int discrepancy,
                                                   String revenueImpact) {
        ReconciliationItemDocument item = new ReconciliationItemDocument();
        item.setCompanyId(companyId);
        item.setStatus(status);
        item.setDiscrepancy(discrepancy);
        item.setRevenueImpact(revenueImpact == null ? null : new BigDecimal(revenueImpact));
        return item;
    }
}
