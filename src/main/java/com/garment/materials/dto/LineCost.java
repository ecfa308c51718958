package com.garment.materials.dto;

import java.math.BigDecimal;

public record LineCost(
        Long lineId,
        Long materialId,
        String materialName,
        BigDecimal effectiveQuantity,
        BigDecimal lineCost) {
}
