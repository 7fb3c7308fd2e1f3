package com.restaurant.costkeeper.service;

import com.restaurant.costkeeper.dto.RecipeCost;
import com.restaurant.costkeeper.exception.InsufficientStockException;
import com.restaurant.costkeeper.exception.InvalidOperationException;
import com.restaurant.costkeeper.model.Dish;
import com.restaurant.costkeeper.model.DishSale;
import com.restaurant.costkeeper.model.Ingredient;
import com.restaurant.costkeeper.model.MovementType;
import com.restaurant.costkeeper.model.Recipe;
import com.restaurant.costkeeper.model.RecipeComponent;
import com.restaurant.costkeeper.model.RecipeIngredient;
import com.restaurant.costkeeper.repository.DishSaleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.SortedMap;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SalesRecordingServiceTest {

    private static final Long TENANT = 2L;

    @Mock
    private DishService dishService;

    @Mock
    private RecipeCostEngine costEngine;

    @Mock
    private BatchLedgerService ledger;

    @Mock
    private DishSaleRepository saleRepository;

    @Mock
    private AuditService auditService;

    private SalesRecordingService salesService;
    private Dish soup;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        Clock clock = Clock.fixed(Instant.parse("2024-05-02T18:00:00Z"), ZoneOffset.UTC);
        salesService = new SalesRecordingService(dishService, costEngine, ledger, saleRepository, auditService, clock);

        // Soup: 4 servings from 2 kg potato (id 20) plus half a batch of stock
        // Stock: 10 servings from 3 kg bones (id 10) and 1 kg potato
        Recipe stock = recipe(1L, "Stock", 10);
        line(stock, 10L, "Bones", "3");
        line(stock, 20L, "Potato", "1");
        Recipe soupRecipe = recipe(2L, "Soup", 4);
        line(soupRecipe, 20L, "Potato", "2");
        RecipeComponent half = new RecipeComponent();
        half.setRecipe(soupRecipe);
        half.setComponentRecipe(stock);
        half.setQuantity(new BigDecimal("0.5"));
        soupRecipe.getComponents().add(half);

        soup = new Dish();
        soup.setId(7L);
        soup.setTenantId(TENANT);
        soup.setName("Soup");
        soup.setRecipe(soupRecipe);
        soup.setSellingPriceCents(1000L);
        when(dishService.load(TENANT, 7L)).thenReturn(soup);
        when(costEngine.calculateCost(soupRecipe, UnknownCostPolicy.FAIL)).thenReturn(
                new RecipeCost(2L, "Soup", 4, new BigDecimal("1400"), 1400, 350, List.of(), true, false));
        when(saleRepository.save(any(DishSale.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    private static Recipe recipe(Long id, String name, int servings) {
        Recipe r = new Recipe();
        r.setId(id);
        r.setTenantId(TENANT);
        r.setName(name);
        r.setServings(servings);
        return r;
    }

    private static void line(Recipe recipe, Long ingredientId, String name, String quantity) {
        Ingredient i = new Ingredient();
        i.setId(ingredientId);
        i.setName(name);
        RecipeIngredient line = new RecipeIngredient();
        line.setRecipe(recipe);
        line.setIngredient(i);
        line.setQuantity(new BigDecimal(quantity));
        recipe.getIngredients().add(line);
    }

    @Test
    void expandDemand_ShouldScaleByServingsAndComponentFraction() {
        SortedMap<Long, BigDecimal> demand = salesService.expandDemand(soup.getRecipe(), new BigDecimal("2"));

        // half a soup batch: 1 kg potato, plus a quarter of the stock batch: 0.75 kg bones, 0.25 kg potato
        assertEquals(List.of(10L, 20L), List.copyOf(demand.keySet()));
        assertEquals(0, new BigDecimal("0.75").compareTo(demand.get(10L)));
        assertEquals(0, new BigDecimal("1.25").compareTo(demand.get(20L)));
    }

    @Test
    void recordSale_ShouldConsumeInIngredientOrderAndSnapshotCost() {
        DishSale sale = salesService.recordSale(TENANT, 7L, 2, null, "T-12");

        InOrder order = inOrder(ledger);
        order.verify(ledger).consume(eq(TENANT), eq(10L), any(BigDecimal.class), eq(MovementType.OUT_SALE),
                eq("dish_sale"), eq("T-12"), anyString());
        order.verify(ledger).consume(eq(TENANT), eq(20L), any(BigDecimal.class), eq(MovementType.OUT_SALE),
                eq("dish_sale"), eq("T-12"), anyString());
        assertEquals(350L, sale.getUnitRecipeCostCents());
        assertEquals(1000L, sale.getUnitSellingPriceCents());
        assertEquals(LocalDate.of(2024, 5, 2), sale.getSaleDate());
    }

    @Test
    void recordSale_ShouldAbortBeforeSaleIsWrittenWhenShort() {
        when(ledger.consume(eq(TENANT), eq(20L), any(BigDecimal.class), any(), any(), any(), any()))
                .thenThrow(new InsufficientStockException(20L, "Potato", new BigDecimal("1.25"), BigDecimal.ONE));

        assertThrows(InsufficientStockException.class, () -> salesService.recordSale(TENANT, 7L, 2, null, null));
        verify(saleRepository, never()).save(any(DishSale.class));
    }

    @Test
    void recordSale_ShouldRejectInactiveDish() {
        soup.setActive(false);

        assertThrows(InvalidOperationException.class, () -> salesService.recordSale(TENANT, 7L, 1, null, null));
        verifyNoInteractions(ledger);
    }
}
