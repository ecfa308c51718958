package com.garment.materials.dto;

import java.math.BigDecimal;
import java.util.List;

public record BomCostBreakdown(
        Long bomId,
        List<LineCost> lines,
        BigDecimal totalCost,
        BigDecimal costPerOutputUnit) {
}
