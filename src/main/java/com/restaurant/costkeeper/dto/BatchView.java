package com.restaurant.costkeeper.dto;

import com.restaurant.costkeeper.model.BatchStatus;
import com.restaurant.costkeeper.model.ExpirationStatus;
import com.restaurant.costkeeper.model.InventoryBatch;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record BatchView(Long id, Long ingredientId, String ingredientName, String unit, long unitCostCents,
        BigDecimal initialQuantity, BigDecimal remainingQuantity, LocalDateTime receivedAt, LocalDateTime expiresAt,
        String supplier, String invoiceNumber, BatchStatus status, ExpirationStatus expiration) {

    public static BatchView of(InventoryBatch batch, ExpirationStatus expiration) {
        return new BatchView(batch.getId(), batch.getIngredient().getId(), batch.getIngredient().getName(),
                batch.getIngredient().getUnit().name(), batch.getUnitCostCents(), batch.getInitialQuantity(),
                batch.getRemainingQuantity(), batch.getReceivedAt(), batch.getExpiresAt(), batch.getSupplier(),
                batch.getInvoiceNumber(), batch.getStatus(), expiration);
    }
}
