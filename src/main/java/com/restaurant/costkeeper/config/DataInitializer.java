package com.restaurant.costkeeper.config;

import com.restaurant.costkeeper.model.Ingredient;
import com.restaurant.costkeeper.model.UnitOfMeasure;
import com.restaurant.costkeeper.repository.IngredientRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;

/**
 * Seeds a starter ingredient catalog into an empty database.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "costkeeper.seed.enabled", havingValue = "true")
public class DataInitializer {

    @Bean
    CommandLineRunner seedCatalog(IngredientRepository ingredientRepo) {
        return args -> {
            if (ingredientRepo.count() > 0) {
                return;
            }
            ingredientRepo.save(ingredient("Wheat Flour", UnitOfMeasure.KILOGRAM, "Grains", 180, "gluten", "5"));
            ingredientRepo.save(ingredient("Butter", UnitOfMeasure.KILOGRAM, "Dairy", 30, "milk", "2"));
            ingredientRepo.save(ingredient("Whole Milk", UnitOfMeasure.LITER, "Dairy", 7, "milk", "4"));
            ingredientRepo.save(ingredient("Eggs", UnitOfMeasure.PIECE, "Eggs", 21, "egg", "30"));
            ingredientRepo.save(ingredient("Potato", UnitOfMeasure.KILOGRAM, "Vegetables", 30, null, "10"));
            ingredientRepo.save(ingredient("Onion", UnitOfMeasure.KILOGRAM, "Vegetables", 30, null, "3"));
            ingredientRepo.save(ingredient("Tomato", UnitOfMeasure.KILOGRAM, "Vegetables", 7, null, "3"));
            ingredientRepo.save(ingredient("Chicken Breast", UnitOfMeasure.KILOGRAM, "Meat", 3, null, "4"));
            ingredientRepo.save(ingredient("Olive Oil", UnitOfMeasure.LITER, "Oils", 365, null, "1"));
            ingredientRepo.save(ingredient("Salt", UnitOfMeasure.KILOGRAM, "Spices", 1000, null, "0.5"));
            log.info("Seeded ingredient catalog with {} entries", ingredientRepo.count());
        };
    }

    private static Ingredient ingredient(String name, UnitOfMeasure unit, String category, int shelfLifeDays,
            String allergens, String minStock) {
        Ingredient i = new Ingredient();
        i.setName(name);
        i.setUnit(unit);
        i.setCategory(category);
        i.setShelfLifeDays(shelfLifeDays);
        i.setAllergens(allergens);
        i.setMinStockThreshold(new BigDecimal(minStock));
        return i;
    }
}
