package io.github.drompincen.billingrecon.gateway.controller;

import io.github.drompincen.billingrecon.protocol.api.*;
import io.github.drompincen.billingrecon.runtime.mapping.CompanyAssignmentService;
import io.github.drompincen.billingrecon.runtime.mapping.ProductMappingService;
import io.github.drompincen.billingrecon.runtime.mapping.VendorProductCatalog;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/billing")
public class ProductMappingController {

    private final ProductMappingService mappingService;
    private final VendorProductCatalog catalog;
    private final CompanyAssignmentService assignmentService;

    public ProductMappingController(ProductMappingService mappingService,
                                    VendorProductCatalog catalog,
                                    CompanyAssignmentService assignmentService) {
        this.mappingService = mappingService;
        this.catalog = catalog;
        this.assignmentService = assignmentService;
    }

    @GetMapping("/mappings")
    public List<ProductMappingDto> list(@RequestParam(required = false) String vendorId) {
        return mappingService.list(vendorId).stream().map(BillingDtos::toDto).collect(Collectors.toList());
    }

    @GetMapping("/mappings/{mappingId}")
    public ResponseEntity<ProductMappingDto> get(@PathVariable String mappingId) {
        return mappingService.findById(mappingId)
                .map(m -> ResponseEntity.ok(BillingDtos.toDto(m)))
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/mappings")
    public ProductMappingDto create(@RequestBody CreateProductMappingRequest request,
                                    @RequestParam(required = false) String actorId) {
        return BillingDtos.toDto(mappingService.create(request, actorId));
    }

    @PutMapping("/mappings/{mappingId}")
    public ResponseEntity<ProductMappingDto> update(@PathVariable String mappingId,
                                                    @RequestBody UpdateProductMappingRequest request) {
        return mappingService.update(mappingId, request)
                .map(m -> ResponseEntity.ok(BillingDtos.toDto(m)))
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/mappings/{mappingId}")
    public ResponseEntity<Void> delete(@PathVariable String mappingId) {
        return mappingService.delete(mappingId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @PostMapping("/mappings/quick-map")
    public ProductMappingDto quickMap(@RequestBody QuickMapRequest request,
                                      @RequestParam(required = false) String actorId) {
        return BillingDtos.toDto(mappingService.quickMap(request, actorId));
    }

    @GetMapping("/vendor-products")
    public List<VendorProductDto> vendorProducts(@RequestParam(required = false) String vendorId,
                                                 @RequestParam(defaultValue = "false") boolean includeInactive) {
        var products = vendorId != null
                ? catalog.listByVendor(vendorId, includeInactive)
                : catalog.listAll(includeInactive);
        return products.stream().map(BillingDtos::toDto).collect(Collectors.toList());
    }

    @PostMapping("/vendor-products")
    public VendorProductDto createVendorProduct(@RequestBody CreateVendorProductRequest request) {
        return BillingDtos.toDto(catalog.create(request.vendorId(), request.productKey(), request.productName(),
                request.unit()));
    }

    @PutMapping("/vendor-products/{vendorProductId}/active")
    public ResponseEntity<VendorProductDto> setVendorProductActive(@PathVariable String vendorProductId,
                                                                   @RequestParam boolean active) {
        return catalog.setActive(vendorProductId, active)
                .map(p -> ResponseEntity.ok(BillingDtos.toDto(p)))
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/vendor-products/{vendorProductId}")
    public ResponseEntity<Void> deleteVendorProduct(@PathVariable String vendorProductId) {
        return catalog.delete(vendorProductId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @GetMapping("/companies/{companyId}/assignments")
    public List<CompanyAssignmentDto> assignments(@PathVariable String companyId) {
        return assignmentService.listForCompany(companyId).stream()
                .map(BillingDtos::toDto)
                .collect(Collectors.toList());
    }

    @PostMapping("/companies/{companyId}/assignments")
    public CompanyAssignmentDto assign(@PathVariable String companyId, @RequestBody Map<String, String> body) {
        String vendorProductId = body.get("vendorProductId");
        if (vendorProductId == null || vendorProductId.isBlank()) {
            throw new IllegalArgumentException("vendorProductId is required");
        }
        return BillingDtos.toDto(assignmentService.ensureAssigned(companyId, vendorProductId, false));
    }

    @DeleteMapping("/assignments/{assignmentId}")
    public ResponseEntity<Void> unassign(@PathVariable String assignmentId) {
        return assignmentService.remove(assignmentId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }
}
