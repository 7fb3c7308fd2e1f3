package com.restaurant.costkeeper.service;

import com.restaurant.costkeeper.dto.DishFinancials;
import com.restaurant.costkeeper.model.ProfitabilityWarning;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

@Component
public class DishProfitabilityCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final BigDecimal minMarginPercent;
    private final BigDecimal maxFoodCostPercent;

    public DishProfitabilityCalculator(
            @Value("${costkeeper.profitability.min-margin-percent:60}") BigDecimal minMarginPercent,
            @Value("${costkeeper.profitability.max-food-cost-percent:35}") BigDecimal maxFoodCostPercent) {
        this.minMarginPercent = minMarginPercent;
        this.maxFoodCostPercent = maxFoodCostPercent;
    }

    /**
     * Food cost is rounded to two decimals half-up and the margin is taken as its complement, so
     * the two percentages always add up to 100.
     */
    public DishFinancials analyze(long sellingPriceCents, long recipeCostCents) {
        QuantityRules.requirePositivePrice(sellingPriceCents, "Selling price");
        QuantityRules.requireNonNegativePrice(recipeCostCents, "Recipe cost");

        long profit = sellingPriceCents - recipeCostCents;
        BigDecimal foodCost = BigDecimal.valueOf(recipeCostCents).multiply(HUNDRED)
                .divide(BigDecimal.valueOf(sellingPriceCents), 2, RoundingMode.HALF_UP);
        BigDecimal margin = HUNDRED.setScale(2).subtract(foodCost);

        List<ProfitabilityWarning> warnings = new ArrayList<>();
        if (margin.compareTo(minMarginPercent) < 0) {
            warnings.add(ProfitabilityWarning.LOW_MARGIN);
        }
        if (foodCost.compareTo(maxFoodCostPercent) > 0) {
            warnings.add(ProfitabilityWarning.HIGH_FOOD_COST);
        }
        return new DishFinancials(sellingPriceCents, recipeCostCents, profit, margin, foodCost,
                List.copyOf(warnings));
    }
}
