package com.example.inventory.support;

import com.example.inventory.infrastructure.persistence.entity.BundleComponentEntity;
import com.example.inventory.infrastructure.persistence.entity.ProductEntity;
import com.example.inventory.infrastructure.persistence.entity.SupplierEntity;
import com.example.inventory.infrastructure.persistence.repository.BundleComponentJpaRepository;
import com.example.inventory.infrastructure.persistence.repository.IdempotencyRepository;
import com.example.inventory.infrastructure.persistence.repository.InventoryChangeJpaRepository;
import com.example.inventory.infrastructure.persistence.repository.InventoryProjectionJpaRepository;
import com.example.inventory.infrastructure.persistence.repository.ProductJpaRepository;
import com.example.inventory.infrastructure.persistence.repository.SupplierJpaRepository;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Duration;

/**
 * Base class for integration tests running against the H2 in-memory database with the local catalog.
 * Every test starts from an empty ledger and catalog; products are seeded through the helpers below.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
@ActiveProfiles("test")
public abstract class LedgerTestSupport {

    @Autowired
    protected WebTestClient webTestClient;

    @Autowired
    protected InventoryChangeJpaRepository changeRepository;

    @Autowired
    protected InventoryProjectionJpaRepository projectionRepository;

    @Autowired
    protected ProductJpaRepository productRepository;

    @Autowired
    protected BundleComponentJpaRepository bundleComponentRepository;

    @Autowired
    protected SupplierJpaRepository supplierRepository;

    @Autowired
    protected IdempotencyRepository idempotencyRepository;

    @BeforeEach
    void resetLedgerAndCatalog() {
        webTestClient = webTestClient.mutate().responseTimeout(Duration.ofSeconds(30)).build();

        idempotencyRepository.deleteAllInBatch();
        changeRepository.deleteAllInBatch();
        projectionRepository.deleteAllInBatch();
        bundleComponentRepository.deleteAllInBatch();
        productRepository.deleteAllInBatch();
        supplierRepository.deleteAllInBatch();
    }

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", () -> "jdbc:h2:mem:inventorydb_test;MODE=PostgreSQL;DB_CLOSE_DELAY=-1;DB_CLOSE_ON_EXIT=FALSE");
        registry.add("spring.datasource.username", () -> "sa");
        registry.add("spring.datasource.password", () -> "");
        registry.add("spring.datasource.driver-class-name", () -> "org.h2.Driver");
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
        registry.add("spring.jpa.properties.hibernate.dialect", () -> "org.hibernate.dialect.H2Dialect");
        registry.add("catalog.mode", () -> "local");
    }

    // ==================== Catalog Seeding ====================

    protected ProductEntity givenProduct(long productId, String sku) {
        return productRepository.save(product(productId, sku, false));
    }

    protected ProductEntity givenRetiredProduct(long productId, String sku) {
        ProductEntity product = product(productId, sku, false);
        product.setStatus("RETIRED");
        return productRepository.save(product);
    }

    protected ProductEntity givenProductWithThreshold(long productId, String sku, int threshold, Long supplierId) {
        ProductEntity product = product(productId, sku, false);
        product.setLowStockThreshold(threshold);
        product.setSupplierId(supplierId);
        return productRepository.save(product);
    }

    protected SupplierEntity givenSupplier(long supplierId, String name, String contactEmail) {
        return supplierRepository.save(new SupplierEntity(supplierId, name, contactEmail));
    }

    /**
     * Seeds a bundle; {@code lines} alternates component product id and quantity per bundle.
     */
    protected ProductEntity givenBundle(long bundleId, String sku, long... lines) {
        ProductEntity bundle = productRepository.save(product(bundleId, sku, true));
        for (int i = 0; i + 1 < lines.length; i += 2) {
            bundleComponentRepository.save(
                    new BundleComponentEntity(bundleId, lines[i], (int) lines[i + 1], i / 2));
        }
        return bundle;
    }

    private ProductEntity product(long productId, String sku, boolean bundle) {
        ProductEntity product = new ProductEntity();
        product.setId(productId);
        product.setSku(sku);
        product.setName(sku + " name");
        product.setBundle(bundle);
        product.setStatus("ACTIVE");
        return product;
    }

    // ==================== Ledger Helpers ====================

    protected WebTestClient.ResponseSpec submit(long warehouseId, long productId, String changeType, int delta) {
        return submit(warehouseId, productId, changeType, delta, null);
    }

    protected WebTestClient.ResponseSpec submit(long warehouseId, long productId, String changeType, int delta,
                                                String reference) {
        String referenceJson = reference == null ? "null" : "\"" + reference + "\"";
        return webTestClient.post()
                .uri("/api/inventory/{w}/{p}/changes", warehouseId, productId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {
                            "changeType": "%s",
                            "quantityDelta": %d,
                            "reference": %s
                        }
                        """.formatted(changeType, delta, referenceJson))
                .exchange();
    }

    protected WebTestClient.ResponseSpec getQuantity(long warehouseId, long productId) {
        return webTestClient.get()
                .uri("/api/inventory/{w}/{p}", warehouseId, productId)
                .exchange();
    }

    protected void expectQuantity(long warehouseId, long productId, int quantity) {
        getQuantity(warehouseId, productId)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.currentQuantity").isEqualTo(quantity);
    }
}
