package com.restaurant.costkeeper.service;

import com.restaurant.costkeeper.dto.DishFinancials;
import com.restaurant.costkeeper.dto.DishPerformance;
import com.restaurant.costkeeper.dto.DishSalesFigures;
import com.restaurant.costkeeper.dto.DishView;
import com.restaurant.costkeeper.dto.MenuEngineeringReport;
import com.restaurant.costkeeper.exception.CostingException;
import com.restaurant.costkeeper.exception.InvalidOperationException;
import com.restaurant.costkeeper.model.MenuCategory;
import com.restaurant.costkeeper.repository.DishSaleRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the menu engineering report for a period from recorded sales.
 * <p>
 * Not transactional itself: each dish is costed in its own read-only transaction so that a dish
 * whose cost cannot be resolved does not affect the others.
 */
@Slf4j
@Service
public class MenuEngineeringService {

    private final DishSaleRepository saleRepository;
    private final DishService dishService;
    private final DishProfitabilityCalculator calculator;
    private final MenuEngineeringClassifier classifier;

    public MenuEngineeringService(DishSaleRepository saleRepository, DishService dishService,
            DishProfitabilityCalculator calculator, MenuEngineeringClassifier classifier) {
        this.saleRepository = saleRepository;
        this.dishService = dishService;
        this.calculator = calculator;
        this.classifier = classifier;
    }

    public MenuEngineeringReport classify(Long tenantId, LocalDate from, LocalDate to) {
        if (from == null || to == null || from.isAfter(to)) {
            throw new InvalidOperationException("Invalid period: " + from + " to " + to);
        }

        List<DishSalesFigures> figures = new ArrayList<>();
        for (Object[] row : saleRepository.aggregateByDish(tenantId, from, to)) {
            Long dishId = (Long) row[0];
            long volume = ((Number) row[1]).longValue();
            long revenue = ((Number) row[2]).longValue();
            long snapshotCost = ((Number) row[3]).longValue();
            if (volume <= 0) {
                continue;
            }

            DishView dish = dishService.get(tenantId, dishId);
            BigDecimal margin = currentMargin(tenantId, dish, snapshotCost, volume);
            figures.add(new DishSalesFigures(dishId, dish.name(), margin, volume, revenue, revenue - snapshotCost));
        }

        List<DishPerformance> dishes = classifier.classify(figures);
        log.info("Menu engineering for tenant {} over {}..{}: {} dish(es) classified", tenantId, from, to,
                dishes.size());
        return summarize(from, to, dishes);
    }

    private BigDecimal currentMargin(Long tenantId, DishView dish, long snapshotCost, long volume) {
        try {
            return dishService.financials(tenantId, dish.id()).financials().profitMarginPercent();
        } catch (CostingException e) {
            long averageCost = BigDecimal.valueOf(snapshotCost)
                    .divide(BigDecimal.valueOf(volume), 0, RoundingMode.HALF_UP)
                    .longValueExact();
            log.warn("Current cost of dish {} unavailable ({}), using average sold cost {} cents", dish.name(),
                    e.getMessage(), averageCost);
            DishFinancials fallback = calculator.analyze(dish.sellingPriceCents(), averageCost);
            return fallback.profitMarginPercent();
        }
    }

    private MenuEngineeringReport summarize(LocalDate from, LocalDate to, List<DishPerformance> dishes) {
        int stars = count(dishes, MenuCategory.STAR);
        int plowhorses = count(dishes, MenuCategory.PLOWHORSE);
        int puzzles = count(dishes, MenuCategory.PUZZLE);
        int dogs = count(dishes, MenuCategory.DOG);

        BigDecimal avgMargin = BigDecimal.ZERO;
        BigDecimal avgVolume = BigDecimal.ZERO;
        if (!dishes.isEmpty()) {
            BigDecimal n = BigDecimal.valueOf(dishes.size());
            avgMargin = dishes.stream().map(DishPerformance::profitMarginPercent)
                    .reduce(BigDecimal.ZERO, BigDecimal::add)
                    .divide(n, 2, RoundingMode.HALF_UP);
            avgVolume = BigDecimal.valueOf(dishes.stream().mapToLong(DishPerformance::salesVolume).sum())
                    .divide(n, 2, RoundingMode.HALF_UP);
        }
        long revenue = dishes.stream().mapToLong(DishPerformance::revenueCents).sum();
        long profit = dishes.stream().mapToLong(DishPerformance::profitCents).sum();

        return new MenuEngineeringReport(from, to, dishes.size(), stars, plowhorses, puzzles, dogs, avgMargin,
                avgVolume, revenue, profit, dishes);
    }

    private static int count(List<DishPerformance> dishes, MenuCategory category) {
        return (int) dishes.stream().filter(d -> d.category() == category).count();
    }
}
