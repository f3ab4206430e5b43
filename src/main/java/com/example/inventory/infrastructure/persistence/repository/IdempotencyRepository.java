package com.example.inventory.infrastructure.persistence.repository;

import com.example.inventory.infrastructure.persistence.entity.IdempotencyRecord;
import com.example.inventory.infrastructure.persistence.entity.IdempotencyStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
public interface IdempotencyRepository extends JpaRepository<IdempotencyRecord, String> {

    @Modifying
    @Query("DELETE FROM IdempotencyRecord i WHERE i.idempotencyKey = :key AND i.status = :status")
    int deleteByKeyAndStatus(@Param("key") String idempotencyKey, @Param("status") IdempotencyStatus status);

    @Modifying
    @Query("DELETE FROM IdempotencyRecord i WHERE i.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);
}
