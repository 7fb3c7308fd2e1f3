package com.restaurant.costkeeper.service;

import com.restaurant.costkeeper.dto.InventoryAlert;
import com.restaurant.costkeeper.dto.InventoryHealth;
import com.restaurant.costkeeper.model.AlertSeverity;
import com.restaurant.costkeeper.model.AlertType;
import com.restaurant.costkeeper.model.BatchStatus;
import com.restaurant.costkeeper.model.ExpirationStatus;
import com.restaurant.costkeeper.model.Ingredient;
import com.restaurant.costkeeper.model.InventoryBatch;
import com.restaurant.costkeeper.repository.IngredientRepository;
import com.restaurant.costkeeper.repository.InventoryBatchRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Expiry and low-stock alerts, and the inventory health score derived from them.
 * <p>
 * Low-stock alerts only cover ingredients the tenant has stocked at least once.
 */
@Slf4j
@Service
@Transactional(readOnly = true)
public class InventoryAlertService {

    private final InventoryBatchRepository batchRepository;
    private final IngredientRepository ingredientRepository;
    private final ExpirationClassifier expirationClassifier;

    public InventoryAlertService(InventoryBatchRepository batchRepository, IngredientRepository ingredientRepository,
            ExpirationClassifier expirationClassifier) {
        this.batchRepository = batchRepository;
        this.ingredientRepository = ingredientRepository;
        this.expirationClassifier = expirationClassifier;
    }

    public List<InventoryAlert> alerts(Long tenantId) {
        List<InventoryAlert> alerts = new ArrayList<>();
        alerts.addAll(expirationAlerts(tenantId));
        alerts.addAll(lowStockAlerts(tenantId));
        alerts.sort(Comparator.comparing(InventoryAlert::severity));
        return alerts;
    }

    public InventoryHealth status(Long tenantId) {
        List<InventoryAlert> alerts = alerts(tenantId);

        boolean hasExpired = false;
        boolean hasExpiringToday = false;
        boolean hasExpiringSoon = false;
        boolean hasLowStock = false;
        boolean hasZeroStock = false;
        int expired = 0;
        int critical = 0;
        int warning = 0;
        int lowStock = 0;

        for (InventoryAlert alert : alerts) {
            if (alert.type() == AlertType.LOW_STOCK) {
                if (alert.severity() == AlertSeverity.CRITICAL) {
                    hasZeroStock = true;
                    critical++;
                } else {
                    hasLowStock = true;
                    warning++;
                    lowStock++;
                }
                continue;
            }
            switch (alert.severity()) {
                case EXPIRED:
                    hasExpired = true;
                    expired++;
                    break;
                case CRITICAL:
                    hasExpiringToday = true;
                    critical++;
                    break;
                case WARNING:
                    hasExpiringSoon = true;
                    warning++;
                    break;
                default:
                    break;
            }
        }

        // Each kind of problem costs its points once, however many ingredients show it
        int score = 100;
        if (hasExpired)
            score -= 40;
        if (hasExpiringToday)
            score -= 20;
        if (hasExpiringSoon)
            score -= 10;
        if (hasLowStock)
            score -= 15;
        if (hasZeroStock)
            score -= 25;
        score = Math.max(score, 0);

        return new InventoryHealth(score, label(score), critical, warning, expired, lowStock, expired + critical);
    }

    static String label(int score) {
        if (score >= 90)
            return "Excellent";
        if (score >= 70)
            return "Good";
        if (score >= 40)
            return "Warning";
        return "Critical";
    }

    private List<InventoryAlert> expirationAlerts(Long tenantId) {
        // Worst severity per ingredient, with the total quantity of its affected batches
        Map<Long, AlertSeverity> worst = new LinkedHashMap<>();
        Map<Long, BigDecimal> quantities = new HashMap<>();
        Map<Long, String> names = new HashMap<>();

        for (InventoryBatch batch : batchRepository.findByTenantIdAndStatus(tenantId, BatchStatus.ACTIVE)) {
            if (batch.getRemainingQuantity().signum() <= 0) {
                continue;
            }
            AlertSeverity severity = severityOf(expirationClassifier.classify(batch));
            if (severity == null) {
                continue;
            }
            Long ingredientId = batch.getIngredient().getId();
            worst.merge(ingredientId, severity, (a, b) -> a.compareTo(b) <= 0 ? a : b);
            quantities.merge(ingredientId, batch.getRemainingQuantity(), BigDecimal::add);
            names.putIfAbsent(ingredientId, batch.getIngredient().getName());
        }

        List<InventoryAlert> alerts = new ArrayList<>();
        worst.forEach((ingredientId, severity) -> {
            String name = names.get(ingredientId);
            String message;
            switch (severity) {
                case EXPIRED:
                    message = name + " has expired batches";
                    break;
                case CRITICAL:
                    message = name + " has batches expiring today";
                    break;
                default:
                    message = name + " has batches approaching expiry";
                    break;
            }
            alerts.add(new InventoryAlert(AlertType.EXPIRING_BATCH, severity, ingredientId, name, message,
                    quantities.get(ingredientId), null));
        });
        return alerts;
    }

    private List<InventoryAlert> lowStockAlerts(Long tenantId) {
        Map<Long, BigDecimal> remaining = new HashMap<>();
        for (Object[] row : batchRepository.summarizeActiveStock(tenantId)) {
            remaining.put((Long) row[0], StockReportService.decimal(row[1]));
        }

        List<InventoryAlert> alerts = new ArrayList<>();
        for (Long ingredientId : batchRepository.findStockedIngredientIds(tenantId)) {
            Ingredient ingredient = ingredientRepository.findById(ingredientId).orElse(null);
            if (ingredient == null) {
                continue;
            }
            BigDecimal total = remaining.getOrDefault(ingredientId, BigDecimal.ZERO);
            BigDecimal threshold = ingredient.getMinStockThreshold() != null
                    ? ingredient.getMinStockThreshold()
                    : BigDecimal.ZERO;

            if (total.signum() == 0) {
                alerts.add(new InventoryAlert(AlertType.LOW_STOCK, AlertSeverity.CRITICAL, ingredientId,
                        ingredient.getName(), ingredient.getName() + " is out of stock", total, threshold));
            } else if (total.compareTo(threshold) <= 0) {
                alerts.add(new InventoryAlert(AlertType.LOW_STOCK, AlertSeverity.WARNING, ingredientId,
                        ingredient.getName(), ingredient.getName() + " is below its minimum stock ("
                                + total.stripTrailingZeros().toPlainString() + " left)", total, threshold));
            }
        }
        log.debug("Tenant {} has {} low-stock alert(s)", tenantId, alerts.size());
        return alerts;
    }

    private static AlertSeverity severityOf(ExpirationStatus status) {
        switch (status) {
            case EXPIRED:
                return AlertSeverity.EXPIRED;
            case EXPIRES_TODAY:
                return AlertSeverity.CRITICAL;
            case EXPIRING_SOON:
                return AlertSeverity.WARNING;
            default:
                return null;
        }
    }
}
