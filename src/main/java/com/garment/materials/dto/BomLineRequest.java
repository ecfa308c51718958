package com.garment.materials.dto;

import com.garment.materials.model.ConsumptionKind;
import com.garment.materials.model.FabricUsage;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class BomLineRequest {
    @NotNull
    private Long materialId;

    @NotNull
    @Positive
    private BigDecimal quantity;

    @NotBlank
    private String unit;

    private BigDecimal wastePercentage;

    private ConsumptionKind consumptionKind;

    // size, color or category id, depending on consumptionKind
    private String consumptionValue;

    private FabricUsage fabricUsage;

    private String notes;

    private Integer sortOrder;
}
