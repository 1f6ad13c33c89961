package io.github.drompincen.billingrecon.gateway.controller;

import io.github.drompincen.billingrecon.protocol.api.*;
import io.github.drompincen.billingrecon.runtime.reconcile.BillingQueryService;
import io.github.drompincen.billingrecon.runtime.reconcile.ReconciliationBatchService;
import io.github.drompincen.billingrecon.runtime.reconcile.ReconciliationEngine;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/billing")
public class ReconciliationController {

    private final ReconciliationEngine engine;
    private final ReconciliationBatchService batchService;
    private final BillingQueryService queryService;

    public ReconciliationController(ReconciliationEngine engine,
                                    ReconciliationBatchService batchService,
                                    BillingQueryService queryService) {
        this.engine = engine;
        this.batchService = batchService;
        this.queryService = queryService;
    }

    @PostMapping("/companies/{companyId}/reconcile")
    public ReconciliationResult reconcile(@PathVariable String companyId,
                                          @RequestParam(required = false) String actorId) {
        return engine.reconcile(companyId, actorId);
    }

    @PostMapping("/reconcile-all")
    public List<CompanyReconcileOutcome> reconcileAll(@RequestParam(required = false) String actorId) {
        return batchService.reconcileAll(actorId);
    }

    @GetMapping("/companies/{companyId}/snapshots")
    public List<SnapshotDto> snapshots(@PathVariable String companyId) {
        return queryService.snapshots(companyId).stream().map(BillingDtos::toDto).collect(Collectors.toList());
    }

    @GetMapping("/companies/{companyId}/snapshots/latest")
    public ResponseEntity<SnapshotDto> latestSnapshot(@PathVariable String companyId) {
        return queryService.latestCompleted(companyId)
                .map(s -> ResponseEntity.ok(BillingDtos.toDto(s)))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/snapshots/{snapshotId}")
    public ResponseEntity<SnapshotDto> snapshot(@PathVariable String snapshotId) {
        return queryService.snapshot(snapshotId)
                .map(s -> ResponseEntity.ok(BillingDtos.toDto(s)))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/snapshots/{snapshotId}/items")
    public List<ReconciliationItemDto> items(@PathVariable String snapshotId,
                                             @RequestParam(required = false) ItemStatus status) {
        return queryService.items(snapshotId, status).stream().map(BillingDtos::toDto).collect(Collectors.toList());
    }

    @GetMapping("/overview")
    public BillingOverviewDto overview() {
        return queryService.overview();
    }

    @GetMapping("/companies/{companyId}/vendor-products")
    public List<CompanyVendorProductDto> companyVendorProducts(@PathVariable String companyId) {
        return queryService.companyVendorProducts(companyId);
    }

    @GetMapping("/sync-state")
    public SyncStateDto syncState() {
        return queryService.syncState();
    }
}
