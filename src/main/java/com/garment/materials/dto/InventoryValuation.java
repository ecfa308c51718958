package com.garment.materials.dto;

import java.math.BigDecimal;

public record InventoryValuation(
        Long materialId,
        BigDecimal totalQuantity,
        BigDecimal totalValue,
        BigDecimal averageCost) {
}
