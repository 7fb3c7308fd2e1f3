package com.restaurant.costkeeper.service;

import com.restaurant.costkeeper.dto.BatchView;
import com.restaurant.costkeeper.dto.IngredientLoss;
import com.restaurant.costkeeper.dto.IngredientStock;
import com.restaurant.costkeeper.dto.InventoryDashboard;
import com.restaurant.costkeeper.dto.InventoryHealth;
import com.restaurant.costkeeper.dto.LossReport;
import com.restaurant.costkeeper.dto.StockSummary;
import com.restaurant.costkeeper.dto.StockoutPrediction;
import com.restaurant.costkeeper.exception.InvalidOperationException;
import com.restaurant.costkeeper.model.Ingredient;
import com.restaurant.costkeeper.model.MovementType;
import com.restaurant.costkeeper.repository.IngredientRepository;
import com.restaurant.costkeeper.repository.InventoryBatchRepository;
import com.restaurant.costkeeper.repository.InventoryMovementRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@Transactional(readOnly = true)
public class StockReportService {

    static final int WASTE_WINDOW_DAYS = 30;
    static final int USAGE_WINDOW_DAYS = 14;
    static final int EXPIRY_RISK_DAYS = 3;
    static final int STOCKOUT_RISK_LIMIT = 5;
    static final int EXPIRY_RISK_LIMIT = 10;

    private final InventoryBatchRepository batchRepository;
    private final InventoryMovementRepository movementRepository;
    private final IngredientRepository ingredientRepository;
    private final ExpirationClassifier expirationClassifier;
    private final InventoryAlertService alertService;
    private final Clock clock;

    public StockReportService(InventoryBatchRepository batchRepository,
            InventoryMovementRepository movementRepository, IngredientRepository ingredientRepository,
            ExpirationClassifier expirationClassifier, InventoryAlertService alertService, Clock clock) {
        this.batchRepository = batchRepository;
        this.movementRepository = movementRepository;
        this.ingredientRepository = ingredientRepository;
        this.expirationClassifier = expirationClassifier;
        this.alertService = alertService;
        this.clock = clock;
    }

    public StockSummary stockSummary(Long tenantId) {
        Map<Long, Ingredient> catalog = ingredientRepository.findAll().stream()
                .collect(Collectors.toMap(Ingredient::getId, Function.identity()));

        List<IngredientStock> items = new ArrayList<>();
        long totalValue = 0;
        for (Object[] row : batchRepository.summarizeActiveStock(tenantId)) {
            Long ingredientId = (Long) row[0];
            BigDecimal remaining = decimal(row[1]);
            BigDecimal exactValue = decimal(row[2]);
            long batches = ((Number) row[3]).longValue();

            long value = exactValue.setScale(0, RoundingMode.HALF_UP).longValueExact();
            BigDecimal average = remaining.signum() == 0
                    ? BigDecimal.ZERO
                    : exactValue.divide(remaining, 2, RoundingMode.HALF_UP);
            Ingredient ingredient = catalog.get(ingredientId);
            String name = ingredient != null ? ingredient.getName() : "ingredient " + ingredientId;
            String unit = ingredient != null ? ingredient.getUnit().name() : null;

            items.add(new IngredientStock(ingredientId, name, unit, remaining, average, value, batches));
            totalValue += value;
        }
        items.sort(Comparator.comparing(IngredientStock::ingredientName));
        return new StockSummary(items, totalValue);
    }

    public LossReport lossReport(Long tenantId, int days) {
        if (days <= 0) {
            throw new InvalidOperationException("Report window must be at least one day, got " + days);
        }
        LocalDateTime since = LocalDateTime.now(clock).minusDays(days);

        List<IngredientLoss> items = new ArrayList<>();
        long totalLoss = 0;
        for (Object[] row : movementRepository.summarizeByIngredient(tenantId, MovementType.OUT_EXPIRE, since)) {
            long cents = ((Number) row[3]).longValue();
            items.add(new IngredientLoss((Long) row[0], (String) row[1], decimal(row[2]), cents));
            totalLoss += cents;
        }
        Long purchased = movementRepository.sumTotalCostByType(tenantId, MovementType.IN, since);
        long totalPurchased = purchased != null ? purchased : 0L;

        BigDecimal wastePercent = totalPurchased > 0
                ? BigDecimal.valueOf(totalLoss).multiply(BigDecimal.valueOf(100))
                        .divide(BigDecimal.valueOf(totalPurchased), 2, RoundingMode.HALF_UP)
                : BigDecimal.ZERO;
        return new LossReport(days, since, items, totalLoss, totalPurchased, wastePercent);
    }

    /**
     * Active batches with stock whose expiry date falls on or before today plus {@code daysAhead},
     * soonest first. Already expired batches are included.
     */
    public List<BatchView> expiringBatches(Long tenantId, int daysAhead) {
        if (daysAhead < 0) {
            throw new InvalidOperationException("Days ahead cannot be negative, got " + daysAhead);
        }
        LocalDateTime limit = LocalDate.now(clock).plusDays(daysAhead + 1L).atStartOfDay().minusNanos(1);
        return batchRepository.findActiveExpiringBefore(tenantId, limit).stream()
                .map(b -> BatchView.of(b, expirationClassifier.classify(b)))
                .collect(Collectors.toList());
    }

    public InventoryDashboard dashboard(Long tenantId) {
        StockSummary stock = stockSummary(tenantId);
        LossReport waste = lossReport(tenantId, WASTE_WINDOW_DAYS);
        InventoryHealth health = alertService.status(tenantId);

        List<BatchView> expiryRisks = expiringBatches(tenantId, EXPIRY_RISK_DAYS);
        if (expiryRisks.size() > EXPIRY_RISK_LIMIT) {
            expiryRisks = new ArrayList<>(expiryRisks.subList(0, EXPIRY_RISK_LIMIT));
        }
        return new InventoryDashboard(stock.totalValueCents(), waste.totalLossCents(), waste.wastePercent(),
                health.healthScore(), health.status(), stockoutPredictions(tenantId, stock), expiryRisks);
    }

    /**
     * Days of stock left per ingredient at the average daily sales usage of the last two weeks.
     * Soonest stockout first; ingredients without recent sales come last.
     */
    List<StockoutPrediction> stockoutPredictions(Long tenantId, StockSummary stock) {
        LocalDateTime since = LocalDateTime.now(clock).minusDays(USAGE_WINDOW_DAYS);
        Map<Long, BigDecimal> sold = new HashMap<>();
        for (Object[] row : movementRepository.sumQuantityByIngredient(tenantId, MovementType.OUT_SALE, since)) {
            sold.put((Long) row[0], decimal(row[1]));
        }

        List<StockoutPrediction> predictions = new ArrayList<>();
        for (IngredientStock item : stock.ingredients()) {
            if (item.remainingQuantity().signum() <= 0) {
                continue;
            }
            BigDecimal dailyUsage = sold.getOrDefault(item.ingredientId(), BigDecimal.ZERO)
                    .divide(BigDecimal.valueOf(USAGE_WINDOW_DAYS), 4, RoundingMode.HALF_UP);
            BigDecimal daysLeft = dailyUsage.signum() > 0
                    ? item.remainingQuantity().divide(dailyUsage, 1, RoundingMode.HALF_UP)
                    : null;
            predictions.add(new StockoutPrediction(item.ingredientId(), item.ingredientName(),
                    item.remainingQuantity(), dailyUsage, daysLeft));
        }
        predictions.sort(Comparator.comparing(StockoutPrediction::daysUntilStockout,
                Comparator.nullsLast(Comparator.naturalOrder())));
        return predictions.size() > STOCKOUT_RISK_LIMIT
                ? new ArrayList<>(predictions.subList(0, STOCKOUT_RISK_LIMIT))
                : predictions;
    }

    static BigDecimal decimal(Object value) {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        return new BigDecimal(value.toString());
    }
}
