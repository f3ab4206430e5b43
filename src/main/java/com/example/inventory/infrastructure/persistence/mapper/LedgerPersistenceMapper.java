package com.example.inventory.infrastructure.persistence.mapper;

import com.example.inventory.domain.model.ChangeType;
import com.example.inventory.domain.model.InventoryChangeEvent;
import com.example.inventory.domain.model.InventoryKey;
import com.example.inventory.domain.model.InventoryProjection;
import com.example.inventory.domain.model.ProjectionStatus;
import com.example.inventory.domain.model.ProposedChange;
import com.example.inventory.infrastructure.persistence.entity.ChangeTypeEnum;
import com.example.inventory.infrastructure.persistence.entity.InventoryChangeEventEntity;
import com.example.inventory.infrastructure.persistence.entity.InventoryKeyId;
import com.example.inventory.infrastructure.persistence.entity.InventoryProjectionEntity;
import com.example.inventory.infrastructure.persistence.entity.ProjectionStatusEnum;
import org.springframework.stereotype.Component;

/**
 * Mapper between ledger/projection domain objects and their persistence entities.
 */
@Component
public class LedgerPersistenceMapper {

    public InventoryChangeEventEntity toEntity(ProposedChange change, long quantityBefore, long quantityAfter) {
        InventoryChangeEventEntity entity = new InventoryChangeEventEntity();
        entity.setWarehouseId(change.getKey().getWarehouseId());
        entity.setProductId(change.getKey().getProductId());
        entity.setChangeType(toChangeTypeEnum(change.getChangeType()));
        entity.setQuantityDelta(change.getQuantityDelta());
        entity.setOccurredAt(change.getOccurredAt());
        entity.setReference(change.getReference());
        entity.setQuantityBefore(quantityBefore);
        entity.setQuantityAfter(quantityAfter);
        return entity;
    }

    public InventoryChangeEvent toDomain(InventoryChangeEventEntity entity) {
        return InventoryChangeEvent.reconstitute(
                entity.getId(),
                InventoryKey.of(entity.getWarehouseId(), entity.getProductId()),
                toDomainChangeType(entity.getChangeType()),
                entity.getQuantityDelta(),
                entity.getOccurredAt(),
                entity.getReference(),
                entity.getQuantityBefore(),
                entity.getQuantityAfter()
        );
    }

    public InventoryProjection toDomain(InventoryProjectionEntity entity) {
        return InventoryProjection.reconstitute(
                toKey(entity.getId()),
                entity.getCurrentQuantity(),
                entity.getReservedQuantity(),
                entity.getLastAppliedEventId(),
                toDomainStatus(entity.getStatus())
        );
    }

    /**
     * Copies the state of a projection onto its row, creating the row when {@code entity} is null.
     */
    public InventoryProjectionEntity copyOnto(InventoryProjection projection, InventoryProjectionEntity entity) {
        InventoryProjectionEntity target = entity;
        if (target == null) {
            target = new InventoryProjectionEntity();
            target.setId(toId(projection.getKey()));
        }
        target.setCurrentQuantity(projection.getCurrentQuantity());
        target.setReservedQuantity(projection.getReservedQuantity());
        target.setLastAppliedEventId(projection.getLastAppliedEventId());
        target.setStatus(toStatusEnum(projection.getStatus()));
        return target;
    }

    public InventoryKeyId toId(InventoryKey key) {
        return new InventoryKeyId(key.getWarehouseId(), key.getProductId());
    }

    public InventoryKey toKey(InventoryKeyId id) {
        return InventoryKey.of(id.getWarehouseId(), id.getProductId());
    }

    public ChangeTypeEnum toChangeTypeEnum(ChangeType type) {
        return switch (type) {
            case RECEIVED -> ChangeTypeEnum.RECEIVED;
            case SOLD -> ChangeTypeEnum.SOLD;
            case ADJUSTMENT -> ChangeTypeEnum.ADJUSTMENT;
            case RESERVED -> ChangeTypeEnum.RESERVED;
            case RELEASED -> ChangeTypeEnum.RELEASED;
        };
    }

    public ChangeType toDomainChangeType(ChangeTypeEnum type) {
        return switch (type) {
            case RECEIVED -> ChangeType.RECEIVED;
            case SOLD -> ChangeType.SOLD;
            case ADJUSTMENT -> ChangeType.ADJUSTMENT;
            case RESERVED -> ChangeType.RESERVED;
            case RELEASED -> ChangeType.RELEASED;
        };
    }

    public ProjectionStatusEnum toStatusEnum(ProjectionStatus status) {
        return switch (status) {
            case ACTIVE -> ProjectionStatusEnum.ACTIVE;
            case DIVERGED -> ProjectionStatusEnum.DIVERGED;
        };
    }

    public ProjectionStatus toDomainStatus(ProjectionStatusEnum status) {
        return switch (status) {
            case ACTIVE -> ProjectionStatus.ACTIVE;
            case DIVERGED -> ProjectionStatus.DIVERGED;
        };
    }
}
