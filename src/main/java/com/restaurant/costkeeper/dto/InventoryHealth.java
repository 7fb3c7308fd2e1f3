package com.restaurant.costkeeper.dto;

/**
 * @param badgeCount alerts needing immediate attention (expired plus critical)
 */
public record InventoryHealth(int healthScore, String status, int critical, int warning, int expired, int lowStock,
        int badgeCount) {
}
