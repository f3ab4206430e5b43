package com.example.inventory.domain.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Read-only view of a Reference Catalog product.
 * Bundle composition is looked up separately through the catalog.
 */
public final class Product {

    private final long productId;
    private final String sku;
    private final String name;
    private final boolean bundle;
    private final ProductStatus status;
    private final Integer lowStockThreshold;
    private final SupplierInfo supplier;

    private Product(long productId, String sku, String name, boolean bundle, ProductStatus status,
                    Integer lowStockThreshold, SupplierInfo supplier) {
        if (productId <= 0) {
            throw new IllegalArgumentException("ProductId must be positive: " + productId);
        }
        this.productId = productId;
        this.sku = Objects.requireNonNull(sku, "Sku cannot be null");
        this.name = name;
        this.bundle = bundle;
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.lowStockThreshold = lowStockThreshold;
        this.supplier = supplier;
    }

    /**
     * Creates an active product with no threshold and no supplier.
     */
    public static Product of(long productId, String sku, boolean bundle) {
        return new Product(productId, sku, sku, bundle, ProductStatus.ACTIVE, null, null);
    }

    /**
     * Reconstitutes a product from the catalog.
     *
     * @param lowStockThreshold quantity under which the product raises a low-stock alert, may be null
     * @param supplier          preferred supplier, may be null
     */
    public static Product reconstitute(long productId, String sku, String name, boolean bundle,
                                       ProductStatus status, Integer lowStockThreshold, SupplierInfo supplier) {
        return new Product(productId, sku, name, bundle, status, lowStockThreshold, supplier);
    }

    public boolean isRetired() {
        return status == ProductStatus.RETIRED;
    }

    public long getProductId() {
        return productId;
    }

    public String getSku() {
        return sku;
    }

    public String getName() {
        return name;
    }

    public boolean isBundle() {
        return bundle;
    }

    public ProductStatus getStatus() {
        return status;
    }

    public Optional<Integer> getLowStockThreshold() {
        return Optional.ofNullable(lowStockThreshold);
    }

    public Optional<SupplierInfo> getSupplier() {
        return Optional.ofNullable(supplier);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Product product = (Product) o;
        return productId == product.productId;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(productId);
    }

    @Override
    public String toString() {
        return "Product{" +
                "productId=" + productId +
                ", sku='" + sku + '\'' +
                ", bundle=" + bundle +
                ", status=" + status +
                '}';
    }

    /**
     * Supplier reference data attached to a product.
     */
    public record SupplierInfo(long supplierId, String name, String contactEmail) {
    }
}
