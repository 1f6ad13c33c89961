package io.github.drompincen.billingrecon.gateway.controller;

import io.github.drompincen.billingrecon.protocol.api.*;
import io.github.drompincen.billingrecon.runtime.activity.ActivityRecorder;
import io.github.drompincen.billingrecon.runtime.reconcile.BillingQueryService;
import io.github.drompincen.billingrecon.runtime.reconcile.ItemResolutionService;
import io.github.drompincen.billingrecon.runtime.writeback.PsaWriteBackCoordinator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/billing/items")
public class BillingItemController {

    private final BillingQueryService queryService;
    private final ItemResolutionService resolutionService;
    private final PsaWriteBackCoordinator writeBackCoordinator;
    private final ActivityRecorder activityRecorder;

    public BillingItemController(BillingQueryService queryService,
                                 ItemResolutionService resolutionService,
                                 PsaWriteBackCoordinator writeBackCoordinator,
                                 ActivityRecorder activityRecorder) {
        this.queryService = queryService;
        this.resolutionService = resolutionService;
        this.writeBackCoordinator = writeBackCoordinator;
        this.activityRecorder = activityRecorder;
    }

    @GetMapping("/{itemId}")
    public ResponseEntity<ReconciliationItemDto> get(@PathVariable String itemId) {
        return queryService.item(itemId)
                .map(i -> ResponseEntity.ok(BillingDtos.toDto(i)))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{itemId}/history")
    public List<BillingActivityDto> history(@PathVariable String itemId) {
        return activityRecorder.historyForItem(itemId).stream()
                .map(BillingDtos::toDto)
                .collect(Collectors.toList());
    }

    @PostMapping("/{itemId}/resolve")
    public ReconciliationItemDto resolve(@PathVariable String itemId, @RequestBody ResolveItemRequest request) {
        if (request.action() == null) {
            throw new IllegalArgumentException("action is required");
        }
        return BillingDtos.toDto(resolutionService.resolve(itemId, request.action(), request.actorId(), request.note()));
    }

    @PostMapping("/bulk-resolve")
    public Map<String, Object> bulkResolve(@RequestBody BulkResolveRequest request) {
        if (request.action() == null || request.itemIds() == null || request.itemIds().isEmpty()) {
            throw new IllegalArgumentException("action and itemIds are required");
        }
        int updated = resolutionService.bulkResolve(request.itemIds(), request.action(), request.actorId(),
                request.note()).size();
        return Map.of("updated", updated);
    }

    @PostMapping("/{itemId}/write-back")
    public WriteBackResult writeBack(@PathVariable String itemId, @RequestParam(required = false) String actorId) {
        return writeBackCoordinator.writeBack(itemId, actorId);
    }

    @PostMapping("/bulk-write-back")
    public List<WriteBackResult> bulkWriteBack(@RequestBody BulkWriteBackRequest request) {
        if (request.itemIds() == null || request.itemIds().isEmpty()) {
            throw new IllegalArgumentException("itemIds are required");
        }
        return writeBackCoordinator.writeBackMany(request.itemIds(), request.actorId());
    }
}
