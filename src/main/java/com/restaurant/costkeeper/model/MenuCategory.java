package com.restaurant.costkeeper.model;

/**
 * Menu engineering quadrant: profitability crossed with popularity.
 */
public enum MenuCategory {
    STAR("Excellent! Keep this dish, promote it, and maintain quality."),
    PLOWHORSE("Popular but low profit. Consider increasing price or reducing costs."),
    PUZZLE("High margin but low sales. Improve marketing or reposition this dish."),
    DOG("Low profit and low sales. Consider removing from menu or complete redesign.");

    private final String recommendation;

    MenuCategory(String recommendation) {
        this.recommendation = recommendation;
    }

    public String getRecommendation() {
        return recommendation;
    }

    public static MenuCategory of(boolean profitable, boolean popular) {
        if (profitable) {
            return popular ? STAR : PUZZLE;
        }
        return popular ? PLOWHORSE : DOG;
    }

    /**
     * Action plan for a dish given both its quadrant and its revenue class.
     */
    public String strategyFor(AbcClass abc) {
        switch (this) {
            case STAR:
                switch (abc) {
                    case A: return "Core menu item. Protect quality, keep the price, ensure consistent availability.";
                    case B: return "Strong performer. Consider a slight price increase (+5-10%) to maximize profit.";
                    default: return "Anomaly: high sales but low revenue. Check portion size or pricing.";
                }
            case PLOWHORSE:
                switch (abc) {
                    case A: return "High volume, low margin. Reduce portion size by 10-15% or raise the price by 15-20%.";
                    case B: return "Popular but unprofitable. Optimize ingredient costs or find cheaper suppliers.";
                    default: return "Low margin, low revenue. Strong candidate for removal from the menu.";
                }
            case PUZZLE:
                switch (abc) {
                    case A: return "High margin, needs visibility. Move it up the menu, add a photo, build combo deals.";
                    case B: return "Profitable but underselling. Improve presentation, staff training and menu placement.";
                    default: return "High margin but very low sales. Run a two-week promotion, then remove if nothing improves.";
                }
            default:
                switch (abc) {
                    case A: return "Data anomaly: low profit and low sales cannot produce high revenue.";
                    case B: return "Unprofitable and unpopular. Remove from the menu this week.";
                    default: return "Consider removing from the menu now and review why it failed.";
                }
        }
    }
}
