package com.restaurant.costkeeper.service;

import com.restaurant.costkeeper.dto.DishPerformance;
import com.restaurant.costkeeper.dto.DishSalesFigures;
import com.restaurant.costkeeper.model.AbcClass;
import com.restaurant.costkeeper.model.MenuCategory;
import com.restaurant.costkeeper.model.QuadrantBoundary;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Places dishes in the menu engineering matrix and ranks them by revenue contribution.
 * <p>
 * A dish is profitable when its margin is at or above the mean margin of the dishes analysed,
 * and popular when its sales volume is at or above the mean volume. The comparison is done
 * against the exact mean ({@code value * n} against {@code sum}) so ties are detected without
 * rounding. With {@link QuadrantBoundary#EXCLUSIVE} a tie counts as low instead.
 */
@Component
public class MenuEngineeringClassifier {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final QuadrantBoundary boundary;

    public MenuEngineeringClassifier(@Value("${costkeeper.menu.boundary:INCLUSIVE}") QuadrantBoundary boundary) {
        this.boundary = boundary;
    }

    /**
     * Returns one row per input, ordered by revenue descending (dish id breaks ties).
     */
    public List<DishPerformance> classify(List<DishSalesFigures> figures) {
        if (figures.isEmpty()) {
            return List.of();
        }
        BigDecimal count = BigDecimal.valueOf(figures.size());
        BigDecimal marginSum = figures.stream()
                .map(DishSalesFigures::profitMarginPercent)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        long volumeSum = figures.stream().mapToLong(DishSalesFigures::salesVolume).sum();
        long revenueSum = figures.stream().mapToLong(DishSalesFigures::revenueCents).sum();

        List<DishSalesFigures> ranked = new ArrayList<>(figures);
        ranked.sort(Comparator.comparingLong(DishSalesFigures::revenueCents).reversed()
                .thenComparing(DishSalesFigures::dishId, Comparator.nullsLast(Comparator.naturalOrder())));

        List<DishPerformance> result = new ArrayList<>(ranked.size());
        long cumulativeRevenue = 0;
        for (DishSalesFigures dish : ranked) {
            boolean profitable = boundary.isHigh(dish.profitMarginPercent().multiply(count).compareTo(marginSum));
            boolean popular = boundary.isHigh(
                    BigDecimal.valueOf(dish.salesVolume()).multiply(count).compareTo(BigDecimal.valueOf(volumeSum)));
            MenuCategory category = MenuCategory.of(profitable, popular);

            cumulativeRevenue += dish.revenueCents();
            BigDecimal share = percentOf(dish.revenueCents(), revenueSum);
            BigDecimal cumulativeShare = percentOf(cumulativeRevenue, revenueSum);
            AbcClass abc = revenueSum == 0 ? AbcClass.C : AbcClass.ofCumulativeSharePercent(cumulativeShare);

            result.add(new DishPerformance(dish.dishId(), dish.dishName(), category, abc, dish.profitMarginPercent(),
                    dish.salesVolume(), dish.revenueCents(), dish.profitCents(), share.setScale(2, RoundingMode.HALF_UP),
                    cumulativeShare.setScale(2, RoundingMode.HALF_UP), category.getRecommendation(),
                    category.strategyFor(abc)));
        }
        return result;
    }

    // Unrounded where the division terminates, otherwise kept to 10 decimals
    private static BigDecimal percentOf(long part, long whole) {
        if (whole == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(part).multiply(HUNDRED).divide(BigDecimal.valueOf(whole), 10, RoundingMode.HALF_UP);
    }
}
