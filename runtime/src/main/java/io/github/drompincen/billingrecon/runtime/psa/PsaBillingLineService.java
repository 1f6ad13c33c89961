package io.github.drompincen.billingrecon.runtime.psa;

import io.github.drompincen.billingrecon.persistence.document.BillingLineDocument;
import io.github.drompincen.billingrecon.persistence.repository.BillingLineRepository;
import io.github.drompincen.billingrecon.protocol.api.PsaBillingLine;
import io.github.drompincen.billingrecon.runtime.reconcile.BillingPreconditionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reads and writes PSA billing lines, keeping the local billing-line cache in step.
 */
@Service
public class PsaBillingLineService {

    private static final Logger log = LoggerFactory.getLogger(PsaBillingLineService.class);

    private final ObjectProvider<PsaClient> psaClientProvider;
    private final BillingLineRepository billingLineRepository;

    public PsaBillingLineService(ObjectProvider<PsaClient> psaClientProvider,
                                 BillingLineRepository billingLineRepository) {
        this.psaClientProvider = psaClientProvider;
        this.billingLineRepository = billingLineRepository;
    }

    /**
     * Billable, non-cancelled lines of the company. The PSA is queried and the cache refreshed;
     * when the PSA is unreachable or not configured the cached lines are used instead.
     */
    public List<PsaBillingLine> currentLines(String companyId) {
        PsaClient client = psaClientProvider.getIfAvailable();
        if (client != null) {
            try {
                List<PsaBillingLine> lines = client.listBillingLines(companyId);
                refreshCache(companyId, lines);
                return lines.stream().filter(PsaBillingLine::isActive).collect(Collectors.toList());
            } catch (RuntimeException e) {
                log.warn("PSA billing lines unavailable for company {}, using cached lines: {}",
                        companyId, e.getMessage());
            }
        } else {
            log.warn("No PSA client configured, using cached billing lines for company {}", companyId);
        }
        return billingLineRepository.findByCompanyIdAndBillableTrueAndCancelledFalse(companyId).stream()
                .map(PsaBillingLineService::toLine)
                .collect(Collectors.toList());
    }

    public boolean isConfigured() {
        return psaClientProvider.getIfAvailable() != null;
    }

    /**
     * Pushes a new quantity to the PSA and mirrors it in the cache. PSA errors propagate.
     */
    public void updateQuantity(String agreementExternalId, String lineExternalId, int newQty) {
        PsaClient client = psaClientProvider.getIfAvailable();
        if (client == null) {
            throw new BillingPreconditionException("No PSA client configured for write-back");
        }
        client.updateLineQuantity(agreementExternalId, lineExternalId, newQty);
        billingLineRepository.findById(lineExternalId).ifPresent(line -> {
            line.setQuantity(newQty);
            line.setLastSyncedAt(Instant.now());
            billingLineRepository.save(line);
        });
        log.info("PSA line {} on agreement {} set to quantity {}", lineExternalId, agreementExternalId, newQty);
    }

    private void refreshCache(String companyId, List<PsaBillingLine> lines) {
        Instant now = Instant.now();
        billingLineRepository.deleteByCompanyId(companyId);
        billingLineRepository.saveAll(lines.stream()
                .filter(l -> l.externalLineId() != null)
                .map(l -> toDocument(companyId, l, now))
                .collect(Collectors.toList()));
    }

    static BillingLineDocument toDocument(String companyId, PsaBillingLine line, Instant syncedAt) {
        BillingLineDocument doc = new BillingLineDocument();
        doc.setExternalLineId(line.externalLineId());
        doc.setCompanyId(companyId);
        doc.setAgreementId(line.agreementId());
        doc.setExternalAgreementId(line.externalAgreementId());
        doc.setAgreementName(line.agreementName());
        doc.setProductName(line.productName());
        doc.setQuantity(line.quantity());
        doc.setUnitPrice(line.unitPrice());
        doc.setUnitCost(line.unitCost());
        doc.setBillable(line.billable());
        doc.setCancelled(line.cancelled());
        doc.setLastSyncedAt(syncedAt);
        return doc;
    }

    static PsaBillingLine toLine(BillingLineDocument doc) {
        return new PsaBillingLine(doc.getAgreementId(), doc.getExternalAgreementId(), doc.getExternalLineId(),
                doc.getAgreementName(), doc.getProductName(), doc.getQuantity(), doc.getUnitPrice(),
                doc.getUnitCost(), doc.isBillable(), doc.isCancelled());
    }
}
