package com.garment.materials.dto;

import com.garment.materials.model.LayerDraw;

import java.math.BigDecimal;
import java.util.List;

public record ConsumptionResult(
        Long materialId,
        BigDecimal quantity,
        BigDecimal averageUnitCost,
        List<LayerDraw> layersConsumed) {
}
