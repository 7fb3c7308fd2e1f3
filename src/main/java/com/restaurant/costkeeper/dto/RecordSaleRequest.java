package com.restaurant.costkeeper.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.time.LocalDate;

@Data
public class RecordSaleRequest {
    @NotNull
    @Positive
    private Integer quantity;

    private LocalDate saleDate; // defaults to today

    private String referenceId;
}
