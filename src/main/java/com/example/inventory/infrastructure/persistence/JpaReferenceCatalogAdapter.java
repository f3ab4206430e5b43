package com.example.inventory.infrastructure.persistence;

import com.example.inventory.application.port.out.ReferenceCatalogPort;
import com.example.inventory.domain.model.BundleComponent;
import com.example.inventory.domain.model.Product;
import com.example.inventory.infrastructure.persistence.entity.SupplierEntity;
import com.example.inventory.infrastructure.persistence.mapper.CatalogPersistenceMapper;
import com.example.inventory.infrastructure.persistence.repository.BundleComponentJpaRepository;
import com.example.inventory.infrastructure.persistence.repository.ProductJpaRepository;
import com.example.inventory.infrastructure.persistence.repository.SupplierJpaRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Reference Catalog read from the local {@code products}, {@code product_bundles} and {@code suppliers} tables.
 */
@Component
@ConditionalOnProperty(name = "catalog.mode", havingValue = "local", matchIfMissing = true)
public class JpaReferenceCatalogAdapter implements ReferenceCatalogPort {

    private final ProductJpaRepository productRepository;
    private final BundleComponentJpaRepository componentRepository;
    private final SupplierJpaRepository supplierRepository;
    private final CatalogPersistenceMapper mapper;

    public JpaReferenceCatalogAdapter(
            ProductJpaRepository productRepository,
            BundleComponentJpaRepository componentRepository,
            SupplierJpaRepository supplierRepository,
            CatalogPersistenceMapper mapper) {
        this.productRepository = productRepository;
        this.componentRepository = componentRepository;
        this.supplierRepository = supplierRepository;
        this.mapper = mapper;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Product> getProduct(long productId) {
        return productRepository.findById(productId)
                .map(entity -> {
                    SupplierEntity supplier = entity.getSupplierId() == null ? null
                            : supplierRepository.findById(entity.getSupplierId()).orElse(null);
                    return mapper.toDomain(entity, supplier);
                });
    }

    @Override
    @Transactional(readOnly = true)
    public List<BundleComponent> getComponents(long bundleId) {
        return componentRepository.findByBundleIdOrderByPositionAscIdAsc(bundleId).stream()
                .map(mapper::toDomain)
                .toList();
    }
}
