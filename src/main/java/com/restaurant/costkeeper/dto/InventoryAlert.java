package com.restaurant.costkeeper.dto;

import com.restaurant.costkeeper.model.AlertSeverity;
import com.restaurant.costkeeper.model.AlertType;

import java.math.BigDecimal;

/**
 * One alert per ingredient and type. Expiry alerts take the severity of the worst batch.
 */
public record InventoryAlert(AlertType type, AlertSeverity severity, Long ingredientId, String ingredientName,
        String message, BigDecimal currentQuantity, BigDecimal threshold) {
}
