package com.restaurant.costkeeper.model;

import jakarta.persistence.*;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "inventory_movements", indexes = {
        @Index(name = "idx_movement_batch", columnList = "batch_id"),
        @Index(name = "idx_movement_tenant_type", columnList = "tenant_id, type, created_at")
})
@Data
@org.hibernate.annotations.Immutable
public class InventoryMovement {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private Long tenantId;

    @ManyToOne(optional = false)
    @JoinColumn(name = "batch_id", nullable = false, updatable = false)
    private InventoryBatch batch;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private MovementType type;

    // Always positive; direction comes from the type
    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal quantity;

    @Column(nullable = false, updatable = false)
    private Long unitCostCents;

    @Column(nullable = false, updatable = false)
    private Long totalCostCents;

    @Column(updatable = false)
    private String referenceId; // e.g. dish sale id

    @Column(updatable = false)
    private String referenceType; // e.g. "sale", "purchase", "expiration"

    @Column(updatable = false, length = 500)
    private String reason;

    @Column(updatable = false)
    private String createdBy;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    public BigDecimal getSignedDelta() {
        return type.signedDelta(quantity);
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null)
            createdAt = LocalDateTime.now();
    }
}
