package com.restaurant.costkeeper.service;

import com.restaurant.costkeeper.dto.DishPerformance;
import com.restaurant.costkeeper.dto.DishSalesFigures;
import com.restaurant.costkeeper.model.AbcClass;
import com.restaurant.costkeeper.model.MenuCategory;
import com.restaurant.costkeeper.model.QuadrantBoundary;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class MenuEngineeringClassifierTest {

    private final MenuEngineeringClassifier classifier = new MenuEngineeringClassifier(QuadrantBoundary.INCLUSIVE);

    private static DishSalesFigures dish(long id, String name, String margin, long volume, long revenue) {
        return new DishSalesFigures(id, name, new BigDecimal(margin), volume, revenue, revenue / 2);
    }

    private static Map<String, DishPerformance> byName(List<DishPerformance> rows) {
        return rows.stream().collect(Collectors.toMap(DishPerformance::dishName, r -> r));
    }

    @Test
    void classify_ShouldPlaceFourDishMenuInEachQuadrant() {
        // mean margin 60, mean volume 50
        List<DishPerformance> rows = classifier.classify(List.of(
                dish(1, "Steak", "70", 80, 400_000),
                dish(2, "Pasta", "65", 60, 150_000),
                dish(3, "Salad", "40", 20, 20_000),
                dish(4, "Risotto", "65", 40, 100_000)));

        Map<String, DishPerformance> byName = byName(rows);
        assertEquals(MenuCategory.STAR, byName.get("Steak").category());
        assertEquals(MenuCategory.STAR, byName.get("Pasta").category());
        assertEquals(MenuCategory.DOG, byName.get("Salad").category());
        assertEquals(MenuCategory.PUZZLE, byName.get("Risotto").category());
        assertTrue(byName.get("Salad").needsAttention());
    }

    @Test
    void classify_ShouldMarkPopularLowMarginDishPlowhorse() {
        List<DishPerformance> rows = classifier.classify(List.of(
                dish(1, "Fries", "30", 100, 50_000),
                dish(2, "Lobster", "70", 10, 50_000)));

        assertEquals(MenuCategory.PLOWHORSE, byName(rows).get("Fries").category());
        assertEquals(MenuCategory.PUZZLE, byName(rows).get("Lobster").category());
    }

    @Test
    void classify_ShouldResolveTiesByBoundaryRule() {
        List<DishSalesFigures> equal = List.of(dish(1, "Soup", "50", 10, 1000), dish(2, "Stew", "50", 10, 1000));

        assertTrue(classifier.classify(equal).stream().allMatch(r -> r.category() == MenuCategory.STAR));
        assertTrue(new MenuEngineeringClassifier(QuadrantBoundary.EXCLUSIVE).classify(equal).stream()
                .allMatch(r -> r.category() == MenuCategory.DOG));
    }

    @Test
    void classify_ShouldDeriveAbcFromCumulativeRevenueShare() {
        List<DishPerformance> rows = classifier.classify(List.of(
                dish(1, "A1", "60", 10, 50),
                dish(2, "A2", "60", 10, 30),
                dish(3, "B1", "60", 10, 15),
                dish(4, "C1", "60", 10, 5)));

        // ordered by revenue; cumulative shares 50, 80, 95, 100
        assertEquals(List.of("A1", "A2", "B1", "C1"),
                rows.stream().map(DishPerformance::dishName).collect(Collectors.toList()));
        assertEquals(AbcClass.A, rows.get(0).abcClass());
        assertEquals(AbcClass.A, rows.get(1).abcClass());
        assertEquals(AbcClass.B, rows.get(2).abcClass());
        assertEquals(AbcClass.C, rows.get(3).abcClass());
        assertEquals(0, new BigDecimal("95").compareTo(rows.get(2).cumulativeSharePercent()));
    }

    @Test
    void classify_ShouldPickStrategyByCategoryAndAbcClass() {
        List<DishPerformance> rows = classifier.classify(List.of(
                dish(1, "Steak", "70", 80, 800),
                dish(2, "Salad", "40", 20, 200)));

        DishPerformance steak = byName(rows).get("Steak");
        assertEquals(MenuCategory.STAR.strategyFor(AbcClass.A), steak.strategy());
        assertEquals(MenuCategory.STAR.getRecommendation(), steak.recommendation());
        DishPerformance salad = byName(rows).get("Salad");
        assertEquals(AbcClass.C, salad.abcClass());
        assertEquals(MenuCategory.DOG.strategyFor(AbcClass.C), salad.strategy());
    }

    @Test
    void classify_ShouldReturnEmptyForEmptyInput() {
        assertTrue(classifier.classify(List.of()).isEmpty());
    }
}
