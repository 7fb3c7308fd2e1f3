package com.restaurant.costkeeper.model;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A recorded sale. The recipe cost is snapshotted so historical margins do not move
 * when ingredient prices change later.
 */
@Entity
@Table(name = "dish_sales", indexes = {
        @Index(name = "idx_sale_tenant_date", columnList = "tenant_id, sale_date")
})
@Data
public class DishSale {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private Long tenantId;

    @ManyToOne(optional = false)
    @JoinColumn(name = "dish_id", nullable = false, updatable = false)
    private Dish dish;

    @Column(nullable = false, updatable = false)
    private Integer quantity;

    @Column(nullable = false, updatable = false)
    private Long unitSellingPriceCents;

    @Column(nullable = false, updatable = false)
    private Long unitRecipeCostCents;

    @Column(name = "sale_date", nullable = false, updatable = false)
    private LocalDate saleDate;

    private String referenceId;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        if (saleDate == null)
            saleDate = LocalDate.now();
    }
}
