package com.restaurant.costkeeper.model;

import jakarta.persistence.*;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One physical receipt of an ingredient. Only the remaining quantity and status change
 * after creation; batches are never deleted.
 */
@Entity
@Table(name = "inventory_batches", indexes = {
        @Index(name = "idx_batch_tenant_ingredient", columnList = "tenant_id, ingredient_id, status")
})
@Data
public class InventoryBatch {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private Long tenantId;

    @ManyToOne(optional = false)
    @JoinColumn(name = "ingredient_id", nullable = false, updatable = false)
    private Ingredient ingredient;

    // Minor currency units per ingredient unit, fixed at receipt
    @Column(nullable = false, updatable = false)
    private Long unitCostCents;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal initialQuantity;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal remainingQuantity;

    @Column(nullable = false, updatable = false)
    private LocalDateTime receivedAt;

    @Column(nullable = false)
    private LocalDateTime expiresAt;

    private String supplier;

    private String invoiceNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private BatchStatus status;

    @Version
    private Long version;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public boolean isActive() {
        return status == BatchStatus.ACTIVE;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
        if (status == null)
            status = BatchStatus.ACTIVE;
        if (remainingQuantity == null)
            remainingQuantity = initialQuantity;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
