package com.restaurant.costkeeper.controller;

import com.restaurant.costkeeper.dto.RecipeCost;
import com.restaurant.costkeeper.exception.CircularRecipeReferenceException;
import com.restaurant.costkeeper.service.AuditService;
import com.restaurant.costkeeper.service.RecipeCostEngine;
import com.restaurant.costkeeper.service.RecipeService;
import com.restaurant.costkeeper.service.UnknownCostPolicy;
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
class RecipeControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RecipeService recipeService;
    @MockBean
    private RecipeCostEngine costEngine;
    @MockBean
    private AuditService auditService;

    @Test
    @WithMockUser(roles = "MANAGER")
    void addComponent_ShouldReportCycle() throws Exception {
        when(recipeService.addComponent(eq(1L), eq(10L), eq(20L), any(BigDecimal.class)))
                .thenThrow(new CircularRecipeReferenceException(List.of("Sauce", "Base", "Sauce")));

        mockMvc.perform(post("/api/recipes/10/components")
                .header("X-Tenant-Id", "1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"componentRecipeId\": 20, \"quantity\": 0.5}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.message").value("Circular recipe reference: Sauce -> Base -> Sauce"));
    }

    @Test
    @WithMockUser(roles = "MANAGER")
    void cost_ShouldDegradeWhenUnknownCostsAllowed() throws Exception {
        RecipeCost cost = new RecipeCost(10L, "Sauce", 4, new BigDecimal("400"), 400L, 100L, List.of(), false, false);
        when(costEngine.calculateCost(1L, 10L, UnknownCostPolicy.DEGRADE)).thenReturn(cost);

        mockMvc.perform(get("/api/recipes/10/cost")
                .header("X-Tenant-Id", "1")
                .param("allowUnknown", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.costPerServingCents").value(100))
                .andExpect(jsonPath("$.complete").value(false));

        verify(costEngine, never()).calculateCost(anyLong(), anyLong(), eq(UnknownCostPolicy.FAIL));
    }
}
