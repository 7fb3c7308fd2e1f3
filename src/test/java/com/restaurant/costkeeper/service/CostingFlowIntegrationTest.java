package com.restaurant.costkeeper.service;

import com.restaurant.costkeeper.dto.CreateDishRequest;
import com.restaurant.costkeeper.dto.CreateRecipeRequest;
import com.restaurant.costkeeper.dto.DishAnalysis;
import com.restaurant.costkeeper.dto.DishView;
import com.restaurant.costkeeper.dto.MenuEngineeringReport;
import com.restaurant.costkeeper.dto.RecipeCost;
import com.restaurant.costkeeper.dto.RecipeIngredientRequest;
import com.restaurant.costkeeper.dto.RecipeView;
import com.restaurant.costkeeper.model.BatchStatus;
import com.restaurant.costkeeper.model.DishSale;
import com.restaurant.costkeeper.model.Ingredient;
import com.restaurant.costkeeper.model.InventoryBatch;
import com.restaurant.costkeeper.model.MenuCategory;
import com.restaurant.costkeeper.model.MovementType;
import com.restaurant.costkeeper.model.RecipeType;
import com.restaurant.costkeeper.model.UnitOfMeasure;
import com.restaurant.costkeeper.repository.IngredientRepository;
import com.restaurant.costkeeper.repository.InventoryBatchRepository;
import com.restaurant.costkeeper.repository.InventoryMovementRepository;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

@SpringBootTest
@Transactional
public class CostingFlowIntegrationTest {

    private static final Long TENANT = 11L;

    @Autowired
    private BatchLedgerService ledger;

    @Autowired
    private RecipeService recipeService;

    @Autowired
    private RecipeCostEngine costEngine;

    @Autowired
    private DishService dishService;

    @Autowired
    private SalesRecordingService salesService;

    @Autowired
    private MenuEngineeringService menuService;

    @Autowired
    private IngredientRepository ingredientRepository;

    @Autowired
    private InventoryBatchRepository batchRepository;

    @Autowired
    private InventoryMovementRepository movementRepository;

    @MockBean
    private AuditService auditService;

    private Ingredient flour;
    private Ingredient butter;

    @BeforeEach
    void setUp() {
        flour = ingredient("Flour (flow test)");
        butter = ingredient("Butter (flow test)");
        LocalDateTime now = LocalDateTime.now();
        ledger.receive(TENANT, flour.getId(), new BigDecimal("10"), 100L, now.minusDays(2), now.plusDays(60),
                "Mill", "INV-1");
        ledger.receive(TENANT, flour.getId(), new BigDecimal("10"), 300L, now.minusDays(1), now.plusDays(60),
                "Mill", "INV-2");
        ledger.receive(TENANT, butter.getId(), new BigDecimal("5"), 1000L, now.minusDays(1), now.plusDays(20),
                "Dairy", "INV-3");
    }

    private Ingredient ingredient(String name) {
        Ingredient i = new Ingredient();
        i.setName(name);
        i.setUnit(UnitOfMeasure.KILOGRAM);
        return ingredientRepository.save(i);
    }

    private static RecipeIngredientRequest line(Ingredient ingredient, String quantity) {
        RecipeIngredientRequest line = new RecipeIngredientRequest();
        line.setIngredientId(ingredient.getId());
        line.setQuantity(new BigDecimal(quantity));
        return line;
    }

    private RecipeView recipe(String name, int servings, RecipeType type, RecipeIngredientRequest... lines) {
        CreateRecipeRequest request = new CreateRecipeRequest();
        request.setName(name);
        request.setServings(servings);
        request.setType(type);
        request.setIngredients(List.of(lines));
        return recipeService.create(TENANT, request);
    }

    private DishView pieDish() {
        RecipeView dough = recipe("Dough", 1, RecipeType.PREPARATION, line(flour, "2"), line(butter, "0.5"));
        RecipeView pie = recipe("Pie", 4, RecipeType.FINAL, line(flour, "2"));
        recipeService.addComponent(TENANT, pie.id(), dough.id(), BigDecimal.ONE);

        CreateDishRequest request = new CreateDishRequest();
        request.setRecipeId(pie.id());
        request.setName("Apple Pie");
        request.setSellingPriceCents(1000L);
        return dishService.create(TENANT, request);
    }

    @Test
    public void calculateCost_ShouldFollowOldestBatches() {
        DishView dish = pieDish();

        RecipeCost cost = costEngine.calculateCost(TENANT, dish.recipeId());

        // dough: 2 kg flour at 100 + 0.5 kg butter at 1000, pie: 2 kg flour at 100
        Assertions.assertEquals(900L, cost.totalCostCents());
        Assertions.assertEquals(225L, cost.costPerServingCents());
        Assertions.assertTrue(cost.complete());

        DishAnalysis analysis = dishService.financials(TENANT, dish.id());
        Assertions.assertEquals(0, new BigDecimal("22.50").compareTo(analysis.financials().foodCostPercent()));
        Assertions.assertEquals(0, new BigDecimal("77.50").compareTo(analysis.financials().profitMarginPercent()));
        Assertions.assertTrue(analysis.financials().warnings().isEmpty());
    }

    @Test
    public void recordSale_ShouldDrawStockAndKeepLedgerBalanced() {
        DishView dish = pieDish();

        DishSale sale = salesService.recordSale(TENANT, dish.id(), 4, LocalDate.now(), "T-1");

        Assertions.assertNotNull(sale.getId());
        Assertions.assertEquals(225L, sale.getUnitRecipeCostCents());

        List<InventoryBatch> flourBatches = batchRepository.findActiveFifo(TENANT, flour.getId());
        Assertions.assertEquals(0, new BigDecimal("6").compareTo(flourBatches.get(0).getRemainingQuantity()));
        Assertions.assertEquals(0, new BigDecimal("10").compareTo(flourBatches.get(1).getRemainingQuantity()));

        for (InventoryBatch batch : batchRepository.findByTenantIdOrderByReceivedAtDesc(TENANT)) {
            BigDecimal outbound = movementRepository.sumOutboundQuantityByBatch(batch.getId());
            Assertions.assertEquals(0, batch.getInitialQuantity().compareTo(batch.getRemainingQuantity().add(outbound)),
                    "ledger out of balance for batch " + batch.getId());
        }
    }

    @Test
    public void consume_ShouldExhaustDrainedBatchAndSkipIt() {
        ledger.consume(TENANT, flour.getId(), new BigDecimal("10"), MovementType.OUT_SALE, "manual", null, "Counter sale");

        InventoryBatch first = batchRepository.findByTenantIdAndIngredientIdOrderByReceivedAtDesc(TENANT, flour.getId())
                .get(1);
        Assertions.assertEquals(BatchStatus.EXHAUSTED, first.getStatus());

        // with the cheap batch gone the same recipe now costs 2 kg at 300
        RecipeView bread = recipe("Bread", 2, RecipeType.FINAL, line(flour, "2"));
        Assertions.assertEquals(600L, costEngine.calculateCost(TENANT, bread.id()).totalCostCents());
    }

    @Test
    public void classify_ShouldUseRecordedSales() {
        DishView pie = pieDish();
        RecipeView bread = recipe("Bread", 2, RecipeType.FINAL, line(flour, "1"));
        CreateDishRequest request = new CreateDishRequest();
        request.setRecipeId(bread.id());
        request.setName("Bread Basket");
        request.setSellingPriceCents(150L);
        DishView basket = dishService.create(TENANT, request);

        LocalDate today = LocalDate.now();
        salesService.recordSale(TENANT, pie.id(), 4, today, null);
        salesService.recordSale(TENANT, basket.id(), 2, today, null);

        MenuEngineeringReport report = menuService.classify(TENANT, today.minusDays(1), today);

        Assertions.assertEquals(2, report.totalDishes());
        // pie margin 77.50 and 4 sold, basket margin 66.67 and 2 sold
        Assertions.assertEquals(4000L + 300L, report.totalRevenueCents());
        Assertions.assertEquals("Apple Pie", report.dishes().get(0).dishName());
        Assertions.assertEquals(MenuCategory.STAR, report.dishes().get(0).category());
    }
}
