package com.example.inventory.domain.exception;

/**
 * The Reference Catalog has no product with the given id.
 */
public class UnknownProductException extends DomainException {

    private final long productId;

    public UnknownProductException(long productId) {
        super("UNKNOWN_PRODUCT", "Product not found in catalog: " + productId,
                details("productId", productId));
        this.productId = productId;
    }

    public long getProductId() {
        return productId;
    }
}
