package com.example.inventory.infrastructure.adapter.out.catalog;

import com.example.inventory.application.port.out.ReferenceCatalogPort;
import com.example.inventory.domain.model.BundleComponent;
import com.example.inventory.domain.model.Product;
import com.example.inventory.infrastructure.adapter.out.catalog.dto.CatalogComponentResponse;
import com.example.inventory.infrastructure.adapter.out.catalog.dto.CatalogProductResponse;
import com.example.inventory.infrastructure.adapter.out.catalog.mapper.CatalogMapper;
import com.example.inventory.infrastructure.exception.NonRetryableServiceException;
import com.example.inventory.infrastructure.exception.RetryableServiceException;
import com.example.inventory.infrastructure.exception.ServiceUnavailableException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;

/**
 * Reference Catalog read from the remote catalog service.
 * Decorator order: Retry → CircuitBreaker → HTTP call. Only the retry carries a fallback, so an open
 * breaker and exhausted retries both surface as {@link ServiceUnavailableException}.
 * <p>
 * Calls block; callers run on the bounded elastic scheduler.
 */
@Component
@ConditionalOnProperty(name = "catalog.mode", havingValue = "remote")
public class RemoteReferenceCatalogAdapter implements ReferenceCatalogPort {

    private static final Logger log = LoggerFactory.getLogger(RemoteReferenceCatalogAdapter.class);
    private static final String SERVICE_NAME = "catalog";

    private final WebClient webClient;
    private final CatalogMapper mapper;

    public RemoteReferenceCatalogAdapter(
            @Qualifier("catalogWebClient") WebClient webClient,
            CatalogMapper mapper) {
        this.webClient = webClient;
        this.mapper = mapper;
    }

    @Override
    @Retry(name = "catalogRetry", fallbackMethod = "getProductFallback")
    @CircuitBreaker(name = "catalogCB")
    public Optional<Product> getProduct(long productId) {
        log.debug("Fetching product {} from catalog", productId);

        return webClient.get()
                .uri("/api/catalog/products/{id}", productId)
                .exchangeToMono(response -> {
                    if (response.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
                        return response.releaseBody().then(Mono.<CatalogProductResponse>empty());
                    }
                    if (response.statusCode().isError()) {
                        return this.<CatalogProductResponse>toError(response);
                    }
                    return response.bodyToMono(CatalogProductResponse.class);
                })
                .onErrorMap(WebClientRequestException.class, e ->
                        new RetryableServiceException(SERVICE_NAME, "Catalog service unreachable", e))
                .map(mapper::toDomain)
                .blockOptional();
    }

    @Override
    @Retry(name = "catalogRetry", fallbackMethod = "getComponentsFallback")
    @CircuitBreaker(name = "catalogCB")
    public List<BundleComponent> getComponents(long bundleId) {
        log.debug("Fetching components of bundle {} from catalog", bundleId);

        List<BundleComponent> components = webClient.get()
                .uri("/api/catalog/products/{id}/components", bundleId)
                .exchangeToMono(response -> {
                    if (response.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
                        return response.releaseBody().then(Mono.just(List.<CatalogComponentResponse>of()));
                    }
                    if (response.statusCode().isError()) {
                        return this.<List<CatalogComponentResponse>>toError(response);
                    }
                    return response.bodyToFlux(CatalogComponentResponse.class).collectList();
                })
                .onErrorMap(WebClientRequestException.class, e ->
                        new RetryableServiceException(SERVICE_NAME, "Catalog service unreachable", e))
                .map(lines -> lines.stream().map(mapper::toDomain).toList())
                .block();
        return components != null ? components : List.of();
    }

    private <T> Mono<T> toError(ClientResponse response) {
        int statusCode = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> {
                    if (response.statusCode().is5xxServerError()) {
                        return Mono.error(new RetryableServiceException(
                                SERVICE_NAME, statusCode, "Catalog service temporarily unavailable"));
                    }
                    return Mono.error(new NonRetryableServiceException(
                            SERVICE_NAME, statusCode, "Catalog service error: " + body));
                });
    }

    /**
     * Fallback when retries are exhausted or the circuit breaker is open.
     */
    @SuppressWarnings("unused")
    private Optional<Product> getProductFallback(long productId, Throwable throwable) {
        log.error("Catalog lookup failed for product {}: {}", productId, throwable.getMessage());
        throw unavailable(throwable);
    }

    @SuppressWarnings("unused")
    private List<BundleComponent> getComponentsFallback(long bundleId, Throwable throwable) {
        log.error("Catalog lookup failed for components of {}: {}", bundleId, throwable.getMessage());
        throw unavailable(throwable);
    }

    private RuntimeException unavailable(Throwable throwable) {
        // Re-throw non-retryable exceptions without wrapping
        if (throwable instanceof NonRetryableServiceException nonRetryable) {
            return nonRetryable;
        }
        return new ServiceUnavailableException(
                SERVICE_NAME,
                "Reference catalog temporarily unavailable, please retry later",
                throwable);
    }
}
