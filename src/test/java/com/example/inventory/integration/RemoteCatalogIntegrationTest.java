package com.example.inventory.integration;

import com.example.inventory.application.port.out.ReferenceCatalogPort;
import com.example.inventory.domain.model.Product;
import com.example.inventory.infrastructure.exception.NonRetryableServiceException;
import com.example.inventory.infrastructure.exception.ServiceUnavailableException;
import com.example.inventory.support.CatalogWireMockSupport;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for the remote Reference Catalog adapter.
 *
 * Scenarios:
 * - transient 5xx responses are retried
 * - 404 means unknown product, other 4xx are not retried
 * - exhausted retries surface as 503
 * - repeated failures open the circuit breaker
 */
@DisplayName("Remote Catalog Integration Tests")
class RemoteCatalogIntegrationTest extends CatalogWireMockSupport {

    private static final long W = 1;

    @Autowired
    private WebTestClient webTestClient;

    @Autowired
    private ReferenceCatalogPort catalogPort;

    @Autowired
    private CircuitBreakerRegistry circuitBreakerRegistry;

    private WebTestClient client() {
        return webTestClient.mutate().responseTimeout(Duration.ofSeconds(30)).build();
    }

    private WebTestClient.ResponseSpec submit(long productId, String type, int delta, String reference) {
        return client().post()
                .uri("/api/inventory/{w}/{p}/changes", W, productId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("changeType", type, "quantityDelta", delta, "reference", reference))
                .exchange();
    }

    @Test
    @DisplayName("should_succeed_after_transient_catalog_failures")
    void should_succeed_after_transient_catalog_failures() {
        // Given: two 503s, then the product
        stubProductTransientFailureThenSuccess(100, 2);

        // When
        Optional<Product> product = catalogPort.getProduct(100);

        // Then
        assertThat(product).isPresent();
        assertThat(product.get().getSku()).isEqualTo("SKU-100");
        verifyProductLookups(100, 3);
    }

    @Test
    @DisplayName("should_not_retry_client_errors")
    void should_not_retry_client_errors() {
        stubCatalogBadRequest(101);

        assertThatThrownBy(() -> catalogPort.getProduct(101))
                .isInstanceOf(NonRetryableServiceException.class);
        verifyProductLookups(101, 1);
    }

    @Test
    @DisplayName("should_return_502_when_catalog_rejects_the_lookup")
    void should_return_502_when_catalog_rejects_the_lookup() {
        stubCatalogBadRequest(102);

        submit(102, "received", 5, "PO-1")
                .expectStatus().isEqualTo(502)
                .expectBody()
                .jsonPath("$.error").isEqualTo("SERVICE_ERROR");
    }

    @Test
    @DisplayName("should_treat_404_as_unknown_product")
    void should_treat_404_as_unknown_product() {
        stubProductNotFound(200);

        assertThat(catalogPort.getProduct(200)).isEmpty();
        verifyProductLookups(200, 1);

        submit(200, "received", 5, "PO-1")
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("UNKNOWN_PRODUCT");
    }

    @Test
    @DisplayName("should_return_503_after_exhausting_retries")
    void should_return_503_after_exhausting_retries() {
        stubCatalogPermanentFailure();

        submit(300, "received", 5, "PO-1")
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.error").isEqualTo("SERVICE_UNAVAILABLE")
                .jsonPath("$.service").isEqualTo("catalog");

        verifyProductLookups(300, 3);
    }

    @Test
    @DisplayName("should_open_circuit_breaker_after_repeated_failures")
    void should_open_circuit_breaker_after_repeated_failures() {
        stubCatalogPermanentFailure();

        // Two lookups of three attempts each exceed the minimum number of calls
        assertThatThrownBy(() -> catalogPort.getProduct(301))
                .isInstanceOf(ServiceUnavailableException.class);
        assertThatThrownBy(() -> catalogPort.getProduct(302))
                .isInstanceOf(ServiceUnavailableException.class);

        CircuitBreaker breaker = circuitBreakerRegistry.circuitBreaker("catalogCB");
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);

        // An open breaker short-circuits without reaching the catalog
        int requestsBefore = catalogServer.getAllServeEvents().size();
        submit(303, "received", 5, "PO-1")
                .expectStatus().isEqualTo(503);
        assertThat(catalogServer.getAllServeEvents()).hasSize(requestsBefore);
    }

    @Test
    @DisplayName("should_compute_bundle_availability_from_remote_components")
    void should_compute_bundle_availability_from_remote_components() {
        // Given: B = 2xP + 1xQ served by the catalog
        stubProduct(1, false);
        stubProduct(2, false);
        stubProduct(10, true);
        stubComponents(10, 1, 2, 2, 1);

        submit(1, "received", 70, "PO-1").expectStatus().isCreated();
        submit(2, "received", 3, "PO-2").expectStatus().isCreated();

        // When & Then
        client().get()
                .uri("/api/bundles/{b}/availability?warehouseId={w}", 10, W)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.bundle").isEqualTo(true)
                .jsonPath("$.availability").isEqualTo(3);
    }
}
