package io.github.drompincen.billingrecon.runtime.mapping;

import io.github.drompincen.billingrecon.persistence.document.ProductMappingDocument;
import io.github.drompincen.billingrecon.persistence.repository.ProductMappingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProductMappingResolverTest {

    @Mock private ProductMappingRepository productMappingRepository;

    private ProductMappingResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new ProductMappingResolver(productMappingRepository);
    }

    @Test
    void exactMappingsWinOverWildcard() {
        when(productMappingRepository.findByVendorIdAndVendorProductKeyAndActiveTrue("ninjaone", "workstations"))
                .thenReturn(List.of(mapping("m1", "workstations", "Managed Workstation")));

        List<ProductMappingDocument> resolved = resolver.resolve("ninjaone", "workstations");

        assertThat(resolved).extracting(ProductMappingDocument::getMappingId).containsExactly("m1");
        verify(productMappingRepository, never()).findByVendorIdAndVendorProductKeyInAndActiveTrue(
                "ninjaone", ProductMappingDocument.WILDCARD_KEYS);
    }

    @Test
    void allExactMappingsAreReturned() {
        when(productMappingRepository.findByVendorIdAndVendorProductKeyAndActiveTrue("ninjaone", "servers"))
                .thenReturn(List.of(
                        mapping("m1", "servers", "Managed Server"),
                        mapping("m2", "servers", "Server Monitoring")));

        assertThat(resolver.resolve("ninjaone", "servers")).hasSize(2);
    }

    @Test
    void wildcardUsedWhenNoExactMapping() {
        when(productMappingRepository.findByVendorIdAndVendorProductKeyAndActiveTrue("ninjaone", "servers"))
                .thenReturn(List.of());
        when(productMappingRepository.findByVendorIdAndVendorProductKeyInAndActiveTrue(
                "ninjaone", ProductMappingDocument.WILDCARD_KEYS))
                .thenReturn(List.of(mapping("w1", "all_devices", "Managed Device")));

        assertThat(resolver.resolve("ninjaone", "servers"))
                .extracting(ProductMappingDocument::getPsaProductName)
                .containsExactly("Managed Device");
    }

    @Test
    void exactMappingWithoutPsaNameFallsThroughToWildcard() {
        when(productMappingRepository.findByVendorIdAndVendorProductKeyAndActiveTrue("ninjaone", "servers"))
                .thenReturn(List.of(mapping("m1", "servers", " ")));
        when(productMappingRepository.findByVendorIdAndVendorProductKeyInAndActiveTrue(
                "ninjaone", ProductMappingDocument.WILDCARD_KEYS))
                .thenReturn(List.of(mapping("w1", "*", "Managed Device"), mapping("w2", "*", null)));

        assertThat(resolver.resolve("ninjaone", "servers"))
                .extracting(ProductMappingDocument::getMappingId)
                .containsExactly("w1");
    }

    @Test
    void nothingResolvesToEmptyList() {
        when(productMappingRepository.findByVendorIdAndVendorProductKeyAndActiveTrue("pax8", "x")).thenReturn(List.of());
        when(productMappingRepository.findByVendorIdAndVendorProductKeyInAndActiveTrue(
                "pax8", ProductMappingDocument.WILDCARD_KEYS)).thenReturn(List.of());

        assertThat(resolver.resolve("pax8", "x")).isEmpty();
    }

    static ProductMappingDocument mapping(String id, String key, String psaName) {
        ProductMappingDocument doc = new ProductMappingDocument();
        doc.setMappingId(id);
        doc.setVendorId("ninjaone");
        doc.setVendorProductKey(key);
        doc.setPsaProductName(psaName);
        return doc;
    }
}
