package com.restaurant.costkeeper.controller;

import com.restaurant.costkeeper.dto.BatchDraw;
import com.restaurant.costkeeper.dto.ConsumptionResult;
import com.restaurant.costkeeper.dto.InventoryDashboard;
import com.restaurant.costkeeper.dto.StockoutPrediction;
import com.restaurant.costkeeper.exception.InsufficientStockException;
import com.restaurant.costkeeper.exception.NoStockAvailableException;
import com.restaurant.costkeeper.model.MovementType;
import com.restaurant.costkeeper.service.AuditService;
import com.restaurant.costkeeper.service.BatchLedgerService;
import com.restaurant.costkeeper.service.IngredientCostResolver;
import com.restaurant.costkeeper.service.InventoryAlertService;
import com.restaurant.costkeeper.service.StockReportService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class InventoryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BatchLedgerService ledger;
    @MockBean
    private IngredientCostResolver costResolver;
    @MockBean
    private StockReportService reportService;
    @MockBean
    private InventoryAlertService alertService;
    @MockBean
    private AuditService auditService;

    private static final String CONSUME_BODY =
            "{\"ingredientId\": 3, \"quantity\": 4, \"movementType\": \"OUT_SALE\", \"reason\": \"Walk-in sale\"}";

    @Test
    @WithMockUser(roles = "MANAGER")
    void consume_ShouldReturnCostOfDraws() throws Exception {
        ConsumptionResult result = new ConsumptionResult(3L, new BigDecimal("4"), 500L, List.of(
                new BatchDraw(1L, new BigDecimal("2"), 100L), new BatchDraw(2L, new BigDecimal("2"), 150L)));
        when(ledger.consume(eq(7L), eq(3L), any(BigDecimal.class), eq(MovementType.OUT_SALE), any(), any(),
                eq("Walk-in sale"))).thenReturn(result);

        mockMvc.perform(post("/api/inventory/consume")
                .header("X-Tenant-Id", "7")
                .contentType(MediaType.APPLICATION_JSON)
                .content(CONSUME_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalCostCents").value(500))
                .andExpect(jsonPath("$.weightedUnitCostCents").value(125.0))
                .andExpect(jsonPath("$.draws.length()").value(2));
    }

    @Test
    @WithMockUser(roles = "MANAGER")
    void consume_ShouldReturnConflictWhenStockIsShort() throws Exception {
        when(ledger.consume(anyLong(), anyLong(), any(BigDecimal.class), any(), any(), any(), any()))
                .thenThrow(new InsufficientStockException(3L, "Flour", new BigDecimal("4"), new BigDecimal("1.5")));

        mockMvc.perform(post("/api/inventory/consume")
                .header("X-Tenant-Id", "7")
                .contentType(MediaType.APPLICATION_JSON)
                .content(CONSUME_BODY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value(org.hamcrest.Matchers.containsString("short by 2.5")));
    }

    @Test
    @WithMockUser(roles = "MANAGER")
    void consume_ShouldRejectMissingTenantHeader() throws Exception {
        mockMvc.perform(post("/api/inventory/consume")
                .contentType(MediaType.APPLICATION_JSON)
                .content(CONSUME_BODY))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(ledger);
    }

    @Test
    @WithMockUser(roles = "MANAGER")
    void consume_ShouldRejectMissingQuantity() throws Exception {
        mockMvc.perform(post("/api/inventory/consume")
                .header("X-Tenant-Id", "7")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"ingredientId\": 3}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation"));
    }

    @Test
    @WithMockUser(roles = "MANAGER")
    void consume_ShouldRejectQuantityBeyondFourDecimals() throws Exception {
        mockMvc.perform(post("/api/inventory/consume")
                .header("X-Tenant-Id", "7")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"ingredientId\": 3, \"quantity\": 9.99999, \"movementType\": \"OUT_SALE\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation"));
        verifyNoInteractions(ledger);
    }

    @Test
    @WithMockUser(roles = "MANAGER")
    void dashboard_ShouldReturnOwnerOverview() throws Exception {
        StockoutPrediction sugar = new StockoutPrediction(2L, "Sugar", new BigDecimal("3"), BigDecimal.ONE,
                new BigDecimal("3.0"));
        when(reportService.dashboard(7L)).thenReturn(new InventoryDashboard(2300L, 400L, new BigDecimal("10.00"),
                80, "Good", List.of(sugar), List.of()));

        mockMvc.perform(get("/api/inventory/dashboard")
                .header("X-Tenant-Id", "7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stockValueCents").value(2300))
                .andExpect(jsonPath("$.healthScore").value(80))
                .andExpect(jsonPath("$.stockoutRisks[0].ingredientName").value("Sugar"))
                .andExpect(jsonPath("$.expiryRisks.length()").value(0));
    }

    @Test
    @WithMockUser(roles = "MANAGER")
    void cost_ShouldReturnConflictWithoutStock() throws Exception {
        when(costResolver.resolveCost(7L, 3L, new BigDecimal("2")))
                .thenThrow(new NoStockAvailableException(3L, "Saffron"));

        mockMvc.perform(get("/api/inventory/cost")
                .header("X-Tenant-Id", "7")
                .param("ingredientId", "3")
                .param("quantity", "2"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value(org.hamcrest.Matchers.containsString("Saffron")));
    }

    @Test
    @WithMockUser(roles = "MANAGER")
    void archive_ShouldRequireAdmin() throws Exception {
        mockMvc.perform(post("/api/inventory/batches/5/archive")
                .header("X-Tenant-Id", "7"))
                .andExpect(status().isForbidden());

        verify(ledger, never()).archive(anyLong(), anyLong());
    }

    @Test
    void anonymousRequest_ShouldBeUnauthorized() throws Exception {
        mockMvc.perform(get("/api/inventory/summary")
                .header("X-Tenant-Id", "7"))
                .andExpect(status().isUnauthorized());
    }
}
