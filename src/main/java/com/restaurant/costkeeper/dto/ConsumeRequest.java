package com.restaurant.costkeeper.dto;

import com.restaurant.costkeeper.model.MovementType;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class ConsumeRequest {
    @NotNull
    private Long ingredientId;

    @NotNull
    @Digits(integer = 15, fraction = 4)
    private BigDecimal quantity;

    private MovementType movementType = MovementType.OUT_SALE;

    private String referenceType;
    private String referenceId;
    private String reason;
}
