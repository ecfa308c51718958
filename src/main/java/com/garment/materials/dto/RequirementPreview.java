package com.garment.materials.dto;

import java.math.BigDecimal;

public record RequirementPreview(
        Long materialId,
        String materialName,
        String unit,
        BigDecimal requiredQuantity,
        BigDecimal availableQuantity,
        boolean sufficient) {
}
