package com.garment.materials.service;

import com.garment.materials.config.MaterialsProperties;
import com.garment.materials.dto.MaterialRequirement;
import com.garment.materials.dto.ProductSelection;
import com.garment.materials.model.BomHeader;
import com.garment.materials.model.BomLine;
import com.garment.materials.model.Material;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Scales a BOM to a production quantity. Lines that share a material collapse
 * into a single requirement so an issue never asks for the same material twice.
 */
@Component
public class MaterialRequirementCalculator {

    private final MaterialsProperties properties;

    public MaterialRequirementCalculator(MaterialsProperties properties) {
        this.properties = properties;
    }

    public List<MaterialRequirement> calculateRequirements(BomHeader bom, Map<Long, Material> materials,
            BigDecimal targetQuantity) {
        if (targetQuantity == null || targetQuantity.signum() < 0) {
            throw new IllegalArgumentException("Target quantity must be zero or more, got " + targetQuantity);
        }
        return aggregate(bom, materials, line -> targetQuantity);
    }

    /**
     * Variant-wise production: each line counts only the selections its {@link com.garment.materials.model.ConsumptionSpec} applies to.
     */
    public List<MaterialRequirement> calculateRequirements(BomHeader bom, Map<Long, Material> materials,
            List<ProductSelection> selections) {
        for (ProductSelection selection : selections) {
            if (selection.quantity() == null || selection.quantity().signum() < 0) {
                throw new IllegalArgumentException(
                        "Selection quantity must be zero or more for product " + selection.productId());
            }
        }
        return aggregate(bom, materials, line -> selections.stream()
                .filter(line.getConsumption()::appliesTo)
                .map(ProductSelection::quantity)
                .reduce(BigDecimal.ZERO, BigDecimal::add));
    }

    private List<MaterialRequirement> aggregate(BomHeader bom, Map<Long, Material> materials,
            Function<BomLine, BigDecimal> outputQuantity) {
        BomExpander.checkOutputQuantity(bom);
        BomExpander.checkResolved(bom, materials);
        BomExpander.checkUnits(bom, materials);

        int quantityScale = properties.getCosting().getQuantityScale();
        Map<Long, MaterialRequirement> totals = new LinkedHashMap<>();

        for (BomLine line : bom.getLines()) {
            Material material = materials.get(line.getMaterialId());
            BigDecimal required = line.effectiveQuantity()
                    .multiply(outputQuantity.apply(line))
                    .divide(bom.getQuantity(), quantityScale, RoundingMode.HALF_UP);
            BigDecimal cost = required.multiply(BomExpander.costOf(material));

            totals.computeIfAbsent(material.getId(), id -> new MaterialRequirement(id, material.getName(),
                    material.getBaseUnit(), BigDecimal.ZERO, material.getCostPerUnit(), BigDecimal.ZERO))
                    .accumulate(required, cost);
        }

        int scale = properties.getCosting().getScale();
        totals.values().forEach(r -> r.setTotalCost(r.getTotalCost().setScale(scale, RoundingMode.HALF_UP)));
        return new ArrayList<>(totals.values());
    }
}
