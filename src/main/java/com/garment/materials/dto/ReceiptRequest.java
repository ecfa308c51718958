package com.garment.materials.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class ReceiptRequest {
    @NotNull
    @Positive
    private BigDecimal quantity;

    @NotNull
    @PositiveOrZero
    private BigDecimal unitCost;

    private String reference;

    // quantity and unitCost are in the material's purchase unit
    private boolean purchaseUnits;
}
