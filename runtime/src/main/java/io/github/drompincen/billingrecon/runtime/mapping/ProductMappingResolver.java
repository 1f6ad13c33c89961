package io.github.drompincen.billingrecon.runtime.mapping;

import io.github.drompincen.billingrecon.persistence.document.ProductMappingDocument;
import io.github.drompincen.billingrecon.persistence.repository.ProductMappingRepository;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Finds the active mappings that apply to a vendor product. Mappings for the exact key win;
 * the vendor's wildcard mappings are used only when no usable exact mapping exists.
 */
@Component
public class ProductMappingResolver {

    private final ProductMappingRepository productMappingRepository;

    public ProductMappingResolver(ProductMappingRepository productMappingRepository) {
        this.productMappingRepository = productMappingRepository;
    }

    public List<ProductMappingDocument> resolve(String vendorId, String productKey) {
        List<ProductMappingDocument> exact = usable(
                productMappingRepository.findByVendorIdAndVendorProductKeyAndActiveTrue(vendorId, productKey));
        if (!exact.isEmpty()) {
            return exact;
        }
        return usable(productMappingRepository.findByVendorIdAndVendorProductKeyInAndActiveTrue(
                vendorId, ProductMappingDocument.WILDCARD_KEYS));
    }

    private static List<ProductMappingDocument> usable(List<ProductMappingDocument> mappings) {
        return mappings.stream()
                .filter(m -> m.getPsaProductName() != null && !m.getPsaProductName().isBlank())
                .collect(Collectors.toList());
    }
}
