package com.restaurant.costkeeper.dto;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
public class ReceiveBatchRequest {
    @NotNull
    private Long ingredientId;

    @NotNull
    @Digits(integer = 15, fraction = 4)
    private BigDecimal quantity;

    @NotNull
    private Long unitCostCents;

    private LocalDateTime receivedAt; // defaults to now

    @NotNull
    private LocalDateTime expiresAt;

    private String supplier;
    private String invoiceNumber;
}
