package io.github.drompincen.billingrecon.runtime.psa;

import io.github.drompincen.billingrecon.persistence.document.BillingLineDocument;
import io.github.drompincen.billingrecon.persistence.repository.BillingLineRepository;
import io.github.drompincen.billingrecon.protocol.api.PsaBillingLine;
import io.github.drompincen.billingrecon.runtime.reconcile.BillingPreconditionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PsaBillingLineServiceTest {

    @Mock private ObjectProvider<PsaClient> psaClientProvider;
    @Mock private PsaClient psaClient;
    @Mock private BillingLineRepository billingLineRepository;
    @Captor private ArgumentCaptor<List<BillingLineDocument>> cachedCaptor;

    private PsaBillingLineService service;

    @BeforeEach
    void setUp() {
        service = new PsaBillingLineService(psaClientProvider, billingLineRepository);
    }

    private static PsaBillingLine line(String lineId, String product, int qty, boolean billable, boolean cancelled) {
        return new PsaBillingLine("agr-1", "ext-agr-1", lineId, "Managed Services", product, qty,
                new BigDecimal("12.50"), new BigDecimal("4.00"), billable, cancelled);
    }

    private static BillingLineDocument cached(String lineId, String product, int qty) {
        return PsaBillingLineService.toDocument("c1", line(lineId, product, qty, true, false), Instant.now());
    }

    @Test
    void currentLinesDropsNonBillableAndCancelledLines() {
        when(psaClientProvider.getIfAvailable()).thenReturn(psaClient);
        when(psaClient.listBillingLines("c1")).thenReturn(List.of(
                line("l1", "Managed Workstation", 50, true, false),
                line("l2", "Onboarding Fee", 1, false, false),
                line("l3", "Legacy AV", 20, true, true)));

        List<PsaBillingLine> lines = service.currentLines("c1");

        assertThat(lines).extracting(PsaBillingLine::externalLineId).containsExactly("l1");
    }

    @Test
    void currentLinesReplacesTheCompanyCacheWithEveryFetchedLine() {
        when(psaClientProvider.getIfAvailable()).thenReturn(psaClient);
        when(psaClient.listBillingLines("c1")).thenReturn(List.of(
                line("l1", "Managed Workstation", 50, true, false),
                line("l3", "Legacy AV", 20, true, true),
                line(null, "Unsynced Line", 2, true, false)));

        service.currentLines("c1");

        InOrder inOrder = inOrder(billingLineRepository);
        inOrder.verify(billingLineRepository).deleteByCompanyId("c1");
        inOrder.verify(billingLineRepository).saveAll(cachedCaptor.capture());
        List<BillingLineDocument> cachedLines = cachedCaptor.getValue();
        assertThat(cachedLines).extracting(BillingLineDocument::getExternalLineId).containsExactly("l1", "l3");
        assertThat(cachedLines).allSatisfy(doc -> {
            assertThat(doc.getCompanyId()).isEqualTo("c1");
            assertThat(doc.getLastSyncedAt()).isNotNull();
        });
        assertThat(cachedLines.get(1).isCancelled()).isTrue();
    }

    @Test
    void currentLinesFallsBackToCacheWhenPsaFails() {
        when(psaClientProvider.getIfAvailable()).thenReturn(psaClient);
        when(psaClient.listBillingLines("c1")).thenThrow(new IllegalStateException("HTTP 502"));
        when(billingLineRepository.findByCompanyIdAndBillableTrueAndCancelledFalse("c1"))
                .thenReturn(List.of(cached("l1", "Managed Workstation", 48)));

        List<PsaBillingLine> lines = service.currentLines("c1");

        assertThat(lines).hasSize(1);
        assertThat(lines.get(0).quantity()).isEqualTo(48);
        assertThat(lines.get(0).externalAgreementId()).isEqualTo("ext-agr-1");
        verify(billingLineRepository, never()).deleteByCompanyId(anyString());
    }

    @Test
    void currentLinesUsesCacheWhenNoClientIsConfigured() {
        when(psaClientProvider.getIfAvailable()).thenReturn(null);
        when(billingLineRepository.findByCompanyIdAndBillableTrueAndCancelledFalse("c1"))
                .thenReturn(List.of(cached("l1", "Managed Workstation", 48), cached("l2", "Managed Server", 3)));

        assertThat(service.currentLines("c1")).extracting(PsaBillingLine::productName)
                .containsExactly("Managed Workstation", "Managed Server");
        assertThat(service.isConfigured()).isFalse();
    }

    @Test
    void updateQuantityWritesPsaThenCachedLine() {
        BillingLineDocument cachedLine = cached("l1", "Acme AV License", 10);
        when(psaClientProvider.getIfAvailable()).thenReturn(psaClient);
        when(billingLineRepository.findById("l1")).thenReturn(Optional.of(cachedLine));

        service.updateQuantity("ext-agr-1", "l1", 12);

        InOrder inOrder = inOrder(psaClient, billingLineRepository);
        inOrder.verify(psaClient).updateLineQuantity("ext-agr-1", "l1", 12);
        inOrder.verify(billingLineRepository).save(cachedLine);
        assertThat(cachedLine.getQuantity()).isEqualTo(12);
    }

    @Test
    void updateQuantityWithoutCachedLineOnlyWritesPsa() {
        when(psaClientProvider.getIfAvailable()).thenReturn(psaClient);
        when(billingLineRepository.findById("l9")).thenReturn(Optional.empty());

        service.updateQuantity("ext-agr-1", "l9", 4);

        verify(psaClient).updateLineQuantity("ext-agr-1", "l9", 4);
        verify(billingLineRepository, never()).save(any());
    }

    @Test
    void psaErrorOnUpdateLeavesCacheUntouched() {
        when(psaClientProvider.getIfAvailable()).thenReturn(psaClient);
        doThrow(new IllegalStateException("HTTP 500")).when(psaClient).updateLineQuantity("ext-agr-1", "l1", 12);

        assertThatThrownBy(() -> service.updateQuantity("ext-agr-1", "l1", 12))
                .isInstanceOf(IllegalStateException.class);
        verifyNoInteractions(billingLineRepository);
    }

    @Test
    void updateQuantityWithoutClientIsAPreconditionFailure() {
        when(psaClientProvider.getIfAvailable()).thenReturn(null);

        assertThatThrownBy(() -> service.updateQuantity("ext-agr-1", "l1", 12))
                .isInstanceOf(BillingPreconditionException.class);
        verify(psaClient, never()).updateLineQuantity(anyString(), anyString(), anyInt());
    }
}
