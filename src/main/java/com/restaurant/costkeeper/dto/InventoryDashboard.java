package com.restaurant.costkeeper.dto;

import java.math.BigDecimal;
import java.util.List;

/**
 * Owner overview: stock value, recent waste, health and the most pressing stockout and expiry risks.
 */
public record InventoryDashboard(long stockValueCents, long wasteCents, BigDecimal wastePercent, int healthScore,
        String healthStatus, List<StockoutPrediction> stockoutRisks, List<BatchView> expiryRisks) {
}
