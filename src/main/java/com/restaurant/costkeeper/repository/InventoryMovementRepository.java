package com.restaurant.costkeeper.repository;

import com.restaurant.costkeeper.model.InventoryMovement;
import com.restaurant.costkeeper.model.MovementType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

public interface InventoryMovementRepository extends JpaRepository<InventoryMovement, Long> {

    List<InventoryMovement> findByTenantIdAndBatchIdOrderByIdAsc(Long tenantId, Long batchId);

    @Query("SELECT COALESCE(SUM(m.quantity), 0) FROM InventoryMovement m WHERE m.batch.id = :batchId "
            + "AND m.type <> com.restaurant.costkeeper.model.MovementType.IN")
    BigDecimal sumOutboundQuantityByBatch(@Param("batchId") Long batchId);

    // Returns [ingredientId, ingredientName, quantity, totalCostCents]
    @Query("SELECT m.batch.ingredient.id, m.batch.ingredient.name, SUM(m.quantity), SUM(m.totalCostCents) "
            + "FROM InventoryMovement m WHERE m.tenantId = :tenantId AND m.type = :type AND m.createdAt >= :since "
            + "GROUP BY m.batch.ingredient.id, m.batch.ingredient.name ORDER BY SUM(m.totalCostCents) DESC")
    List<Object[]> summarizeByIngredient(@Param("tenantId") Long tenantId, @Param("type") MovementType type,
            @Param("since") LocalDateTime since);

    // Returns [ingredientId, quantity]
    @Query("SELECT m.batch.ingredient.id, SUM(m.quantity) FROM InventoryMovement m "
            + "WHERE m.tenantId = :tenantId AND m.type = :type AND m.createdAt >= :since "
            + "GROUP BY m.batch.ingredient.id")
    List<Object[]> sumQuantityByIngredient(@Param("tenantId") Long tenantId, @Param("type") MovementType type,
            @Param("since") LocalDateTime since);

    @Query("SELECT COALESCE(SUM(m.totalCostCents), 0) FROM InventoryMovement m "
            + "WHERE m.tenantId = :tenantId AND m.type = :type AND m.createdAt >= :since")
    Long sumTotalCostByType(@Param("tenantId") Long tenantId, @Param("type") MovementType type,
            @Param("since") LocalDateTime since);
}
