package com.restaurant.costkeeper.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class AdjustBatchRequest {
    @NotNull
    @Digits(integer = 15, fraction = 4)
    private BigDecimal remainingQuantity;

    @NotBlank
    private String reason;
}
