package com.restaurant.costkeeper.dto;

import com.restaurant.costkeeper.model.InventoryMovement;
import com.restaurant.costkeeper.model.MovementType;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record MovementView(Long id, Long batchId, MovementType type, BigDecimal delta, long unitCostCents,
        long totalCostCents, String referenceType, String referenceId, String reason, String createdBy,
        LocalDateTime createdAt) {

    public static MovementView of(InventoryMovement m) {
        return new MovementView(m.getId(), m.getBatch().getId(), m.getType(), m.getSignedDelta(),
                m.getUnitCostCents(), m.getTotalCostCents(), m.getReferenceType(), m.getReferenceId(),
                m.getReason(), m.getCreatedBy(), m.getCreatedAt());
    }
}
