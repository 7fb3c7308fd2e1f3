package com.restaurant.costkeeper.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record MenuEngineeringReport(LocalDate from, LocalDate to, int totalDishes, int stars, int plowhorses,
        int puzzles, int dogs, BigDecimal averageMarginPercent, BigDecimal averageSalesVolume,
        long totalRevenueCents, long totalProfitCents, List<DishPerformance> dishes) {
}
