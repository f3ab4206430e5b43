package com.example.inventory.infrastructure.adapter.out.catalog.mapper;

import com.example.inventory.domain.model.BundleComponent;
import com.example.inventory.domain.model.Product;
import com.example.inventory.domain.model.Product.SupplierInfo;
import com.example.inventory.domain.model.ProductStatus;
import com.example.inventory.infrastructure.adapter.out.catalog.dto.CatalogComponentResponse;
import com.example.inventory.infrastructure.adapter.out.catalog.dto.CatalogProductResponse;
import org.springframework.stereotype.Component;

/**
 * Mapper between remote catalog DTOs and catalog domain objects.
 */
@Component
public class CatalogMapper {

    public Product toDomain(CatalogProductResponse response) {
        SupplierInfo supplier = response.supplier() == null ? null
                : new SupplierInfo(
                        response.supplier().id(),
                        response.supplier().name(),
                        response.supplier().contactEmail());

        return Product.reconstitute(
                response.id(),
                response.sku(),
                response.name(),
                response.bundle(),
                "RETIRED".equalsIgnoreCase(response.status()) ? ProductStatus.RETIRED : ProductStatus.ACTIVE,
                response.lowStockThreshold(),
                supplier
        );
    }

    public BundleComponent toDomain(CatalogComponentResponse response) {
        return new BundleComponent(response.componentProductId(), response.quantityPerBundle());
    }
}
