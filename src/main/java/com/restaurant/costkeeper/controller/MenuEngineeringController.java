package com.restaurant.costkeeper.controller;

import com.restaurant.costkeeper.dto.MenuEngineeringReport;
import com.restaurant.costkeeper.service.MenuEngineeringService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;

import static com.restaurant.costkeeper.controller.InventoryController.TENANT_HEADER;

@RestController
@RequestMapping("/api/menu-engineering")
public class MenuEngineeringController {

    private final MenuEngineeringService menuEngineeringService;
    private final Clock clock;

    public MenuEngineeringController(MenuEngineeringService menuEngineeringService, Clock clock) {
        this.menuEngineeringService = menuEngineeringService;
        this.clock = clock;
    }

    // Defaults to the last 30 days, today included
    @GetMapping
    public ResponseEntity<MenuEngineeringReport> analyze(
            @RequestHeader(TENANT_HEADER) Long tenantId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        LocalDate end = to != null ? to : LocalDate.now(clock);
        LocalDate start = from != null ? from : end.minusDays(29);
        return ResponseEntity.ok(menuEngineeringService.classify(tenantId, start, end));
    }
}
