package com.garment.materials.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class MaterialRequest {
    @NotBlank
    private String code;

    @NotBlank
    private String name;

    @NotBlank
    private String baseUnit;

    private String purchaseUnit;

    @Positive
    private BigDecimal conversionFactor;

    @PositiveOrZero
    private BigDecimal costPerUnit;
}
