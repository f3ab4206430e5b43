package com.example.inventory.application.port.out;

import com.example.inventory.domain.model.BundleComponent;
import com.example.inventory.domain.model.Product;

import java.util.List;
import java.util.Optional;

/**
 * Outbound port for the Reference Catalog. Read-only; reflects the catalog at query time.
 */
public interface ReferenceCatalogPort {

    /**
     * @return the product, empty if the catalog does not know it
     */
    Optional<Product> getProduct(long productId);

    /**
     * @return the component lines of a bundle in catalog order, empty for a non-bundle or unknown product
     */
    List<BundleComponent> getComponents(long bundleId);
}
