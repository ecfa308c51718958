package com.garment.materials.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigDecimal;

/**
 * Total need for one material, summed over every BOM line that references it.
 */
@Data
@AllArgsConstructor
public class MaterialRequirement {
    private Long materialId;
    private String materialName;
    private String unit;
    private BigDecimal requiredQuantity;
    private BigDecimal costPerUnit; // null when the material is unpriced
    private BigDecimal totalCost;

    public void accumulate(BigDecimal quantity, BigDecimal cost) {
        this.requiredQuantity = this.requiredQuantity.add(quantity);
        this.totalCost = this.totalCost.add(cost);
    }
}
