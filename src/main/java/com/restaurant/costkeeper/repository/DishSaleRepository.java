package com.restaurant.costkeeper.repository;

import com.restaurant.costkeeper.model.DishSale;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;

public interface DishSaleRepository extends JpaRepository<DishSale, Long> {

    List<DishSale> findByTenantIdAndDishIdOrderBySaleDateDesc(Long tenantId, Long dishId);

    // Returns [dishId, totalQuantity, revenueCents, snapshotCostCents] for active dishes sold in [from, to]
    @Query("SELECT s.dish.id, SUM(s.quantity), SUM(s.quantity * s.unitSellingPriceCents), "
            + "SUM(s.quantity * s.unitRecipeCostCents) FROM DishSale s "
            + "WHERE s.tenantId = :tenantId AND s.dish.active = true AND s.saleDate BETWEEN :from AND :to "
            + "GROUP BY s.dish.id")
    List<Object[]> aggregateByDish(@Param("tenantId") Long tenantId, @Param("from") LocalDate from,
            @Param("to") LocalDate to);
}
