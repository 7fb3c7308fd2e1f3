package com.restaurant.costkeeper.repository;

import com.restaurant.costkeeper.model.BatchStatus;
import com.restaurant.costkeeper.model.InventoryBatch;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface InventoryBatchRepository extends JpaRepository<InventoryBatch, Long> {

    Optional<InventoryBatch> findByIdAndTenantId(Long id, Long tenantId);

    List<InventoryBatch> findByTenantIdOrderByReceivedAtDesc(Long tenantId);

    List<InventoryBatch> findByTenantIdAndIngredientIdOrderByReceivedAtDesc(Long tenantId, Long ingredientId);

    List<InventoryBatch> findByTenantIdAndStatus(Long tenantId, BatchStatus status);

    // FIFO order: oldest receipt first, id breaks ties between receipts at the same instant
    @Query("SELECT b FROM InventoryBatch b WHERE b.tenantId = :tenantId AND b.ingredient.id = :ingredientId "
            + "AND b.status = com.restaurant.costkeeper.model.BatchStatus.ACTIVE ORDER BY b.receivedAt ASC, b.id ASC")
    List<InventoryBatch> findActiveFifo(@Param("tenantId") Long tenantId, @Param("ingredientId") Long ingredientId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM InventoryBatch b WHERE b.tenantId = :tenantId AND b.ingredient.id = :ingredientId "
            + "AND b.status = com.restaurant.costkeeper.model.BatchStatus.ACTIVE ORDER BY b.receivedAt ASC, b.id ASC")
    List<InventoryBatch> findActiveFifoForUpdate(@Param("tenantId") Long tenantId,
            @Param("ingredientId") Long ingredientId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM InventoryBatch b WHERE b.id = :id AND b.tenantId = :tenantId")
    Optional<InventoryBatch> findByIdForUpdate(@Param("id") Long id, @Param("tenantId") Long tenantId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM InventoryBatch b WHERE b.tenantId = :tenantId "
            + "AND b.status = com.restaurant.costkeeper.model.BatchStatus.ACTIVE "
            + "AND b.remainingQuantity > 0 AND b.expiresAt < :now ORDER BY b.id ASC")
    List<InventoryBatch> findExpiredActiveForUpdate(@Param("tenantId") Long tenantId, @Param("now") LocalDateTime now);

    @Query("SELECT b FROM InventoryBatch b WHERE b.tenantId = :tenantId "
            + "AND b.status = com.restaurant.costkeeper.model.BatchStatus.ACTIVE "
            + "AND b.remainingQuantity > 0 AND b.expiresAt <= :limit ORDER BY b.expiresAt ASC")
    List<InventoryBatch> findActiveExpiringBefore(@Param("tenantId") Long tenantId,
            @Param("limit") LocalDateTime limit);

    // Returns [ingredientId, remainingQuantity, stockValueCents (unrounded), batchCount] over active batches with stock
    @Query("SELECT b.ingredient.id, SUM(b.remainingQuantity), SUM(b.remainingQuantity * b.unitCostCents), COUNT(b) "
            + "FROM InventoryBatch b WHERE b.tenantId = :tenantId "
            + "AND b.status = com.restaurant.costkeeper.model.BatchStatus.ACTIVE AND b.remainingQuantity > 0 "
            + "GROUP BY b.ingredient.id")
    List<Object[]> summarizeActiveStock(@Param("tenantId") Long tenantId);

    @Query("SELECT DISTINCT b.ingredient.id FROM InventoryBatch b WHERE b.tenantId = :tenantId")
    List<Long> findStockedIngredientIds(@Param("tenantId") Long tenantId);
}
