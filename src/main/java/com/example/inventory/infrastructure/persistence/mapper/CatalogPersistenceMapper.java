package com.example.inventory.infrastructure.persistence.mapper;

import com.example.inventory.domain.model.BundleComponent;
import com.example.inventory.domain.model.Product;
import com.example.inventory.domain.model.Product.SupplierInfo;
import com.example.inventory.domain.model.ProductStatus;
import com.example.inventory.infrastructure.persistence.entity.BundleComponentEntity;
import com.example.inventory.infrastructure.persistence.entity.ProductEntity;
import com.example.inventory.infrastructure.persistence.entity.SupplierEntity;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Mapper between catalog tables and catalog domain objects.
 */
@Component
public class CatalogPersistenceMapper {

    public Product toDomain(ProductEntity entity, SupplierEntity supplier) {
        return Product.reconstitute(
                entity.getId(),
                entity.getSku(),
                entity.getName(),
                entity.isBundle(),
                toStatus(entity.getStatus()),
                entity.getLowStockThreshold(),
                supplier == null ? null
                        : new SupplierInfo(supplier.getId(), supplier.getName(), supplier.getContactEmail())
        );
    }

    public BundleComponent toDomain(BundleComponentEntity entity) {
        return new BundleComponent(entity.getComponentProductId(), entity.getQuantityPerBundle());
    }

    /**
     * Unrecognised status values count as active; only an explicit retirement closes a product.
     */
    public ProductStatus toStatus(String status) {
        if (status != null && "RETIRED".equals(status.trim().toUpperCase(Locale.ROOT))) {
            return ProductStatus.RETIRED;
        }
        return ProductStatus.ACTIVE;
    }
}
