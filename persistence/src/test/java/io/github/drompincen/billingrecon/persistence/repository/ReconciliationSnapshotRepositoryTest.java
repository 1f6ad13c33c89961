package io.github.drompincen.billingrecon.persistence.repository;

import io.github.drompincen.billingrecon.persistence.AbstractMongoIntegrationTest;
import io.github.drompincen.billingrecon.persistence.document.ReconciliationItemDocument;
import io.github.drompincen.billingrecon.persistence.document.ReconciliationSnapshotDocument;
import io.github.drompincen.billingrecon.protocol.api.ItemStatus;
import io.github.drompincen.billingrecon.protocol.api.SnapshotStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ReconciliationSnapshotRepositoryTest extends AbstractMongoIntegrationTest {

    @Autowired
    private ReconciliationSnapshotRepository snapshotRepository;

    @Autowired
    private ReconciliationItemRepository itemRepository;

    @Test
    void findByCompanyIdOrdersNewestFirst() {
        Instant now = Instant.now();
        snapshotRepository.save(createSnapshot("s1", "c1", SnapshotStatus.COMPLETED, now.minusSeconds(120)));
        snapshotRepository.save(createSnapshot("s2", "c1", SnapshotStatus.COMPLETED, now));
        snapshotRepository.save(createSnapshot("s3", "c2", SnapshotStatus.COMPLETED, now));

        List<ReconciliationSnapshotDocument> result = snapshotRepository.findByCompanyIdOrderByCreatedAtDesc("c1");

        assertThat(result).extracting(ReconciliationSnapshotDocument::getSnapshotId).containsExactly("s2", "s1");
    }

    @Test
    void latestCompletedSkipsInProgressAndFailed() {
        Instant now = Instant.now();
        snapshotRepository.save(createSnapshot("s1", "c1", SnapshotStatus.COMPLETED, now.minusSeconds(300)));
        snapshotRepository.save(createSnapshot("s2", "c1", SnapshotStatus.FAILED, now.minusSeconds(60)));
        snapshotRepository.save(createSnapshot("s3", "c1", SnapshotStatus.IN_PROGRESS, now));

        Optional<ReconciliationSnapshotDocument> latest =
                snapshotRepository.findFirstByCompanyIdAndStatusOrderByCreatedAtDesc("c1", SnapshotStatus.COMPLETED);

        assertThat(latest).isPresent();
        assertThat(latest.get().getSnapshotId()).isEqualTo("s1");
    }

    @Test
    void summaryAndVendorFailuresRoundTrip() {
        ReconciliationSnapshotDocument doc = createSnapshot("s1", "c1", SnapshotStatus.COMPLETED, Instant.now());
        doc.setSummary(new ReconciliationSnapshotDocument.Summary(3, 1, new java.math.BigDecimal("10.00"), 2));
        doc.getVendorFailures().add(new ReconciliationSnapshotDocument.VendorFailureEntry("cove", "cust-1", "timeout"));
        snapshotRepository.save(doc);

        ReconciliationSnapshotDocument loaded = snapshotRepository.findById("s1").orElseThrow();

        assertThat(loaded.getSummary().getTotalItems()).isEqualTo(3);
        assertThat(loaded.getSummary().getTotalRevenueImpact()).isEqualByComparingTo("10.00");
        assertThat(loaded.getVendorFailures()).hasSize(1);
        assertThat(loaded.getVendorFailures().get(0).getReason()).isEqualTo("timeout");
    }

    @Test
    void itemsFilterBySnapshotAndStatus() {
        itemRepository.save(createItem("i1", "s1", ItemStatus.PENDING));
        itemRepository.save(createItem("i2", "s1", ItemStatus.APPROVED));
        itemRepository.save(createItem("i3", "s2", ItemStatus.PENDING));

        assertThat(itemRepository.findBySnapshotId("s1")).hasSize(2);
        assertThat(itemRepository.findBySnapshotIdAndStatus("s1", ItemStatus.PENDING))
                .extracting(ReconciliationItemDocument::getItemId).containsExactly("i1");
    }

    private ReconciliationSnapshotDocument createSnapshot(String id, String companyId, SnapshotStatus status, Instant createdAt) {
        ReconciliationSnapshotDocument doc = new ReconciliationSnapshotDocument();
        doc.setSnapshotId(id);
        doc.setCompanyId(companyId);
        doc.setTriggeredBy("system");
        doc.setStatus(status);
        doc.setCreatedAt(createdAt);
        return doc;
    }

    private ReconciliationItemDocument createItem(String id, String snapshotId, ItemStatus status) {
        ReconciliationItemDocument doc = new ReconciliationItemDocument();
        doc.setItemId(id);
        doc.setSnapshotId(snapshotId);
        doc.setCompanyId("c1");
        doc.setVendorId("ninjaone");
        doc.setVendorProductKey("servers");
        doc.setStatus(status);
        doc.setCreatedAt(Instant.now());
        return doc;
    }
}
