package com.garment.materials.service;

import com.garment.materials.config.MaterialsProperties;
import com.garment.materials.dto.BomCostBreakdown;
import com.garment.materials.dto.LineCost;
import com.garment.materials.exception.InvalidBomException;
import com.garment.materials.exception.UnresolvedMaterialException;
import com.garment.materials.model.BomHeader;
import com.garment.materials.model.BomLine;
import com.garment.materials.model.Material;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Costs a BOM line by line. Works only on the snapshot it is given; callers
 * resolve the materials beforehand.
 */
@Component
public class BomExpander {

    private final MaterialsProperties properties;

    public BomExpander(MaterialsProperties properties) {
        this.properties = properties;
    }

    public BomCostBreakdown expand(BomHeader bom, Map<Long, Material> materials) {
        checkOutputQuantity(bom);
        checkResolved(bom, materials);
        checkUnits(bom, materials);

        int scale = properties.getCosting().getScale();
        List<LineCost> lines = new ArrayList<>();
        BigDecimal totalCost = BigDecimal.ZERO;

        for (BomLine line : bom.getLines()) {
            Material material = materials.get(line.getMaterialId());
            BigDecimal effectiveQuantity = line.effectiveQuantity();
            BigDecimal lineCost = effectiveQuantity.multiply(costOf(material)).setScale(scale, RoundingMode.HALF_UP);

            lines.add(new LineCost(line.getId(), material.getId(), material.getName(), effectiveQuantity, lineCost));
            totalCost = totalCost.add(lineCost);
        }

        BigDecimal costPerOutputUnit = totalCost.divide(bom.getQuantity(), scale, RoundingMode.HALF_UP);
        return new BomCostBreakdown(bom.getId(), lines, totalCost, costPerOutputUnit);
    }

    static BigDecimal costOf(Material material) {
        return material.getCostPerUnit() != null ? material.getCostPerUnit() : BigDecimal.ZERO;
    }

    static void checkOutputQuantity(BomHeader bom) {
        if (bom.getQuantity() == null || bom.getQuantity().signum() <= 0) {
            throw new InvalidBomException("BOM " + bom.getName() + " has output quantity " + bom.getQuantity()
                    + "; it must be greater than zero.");
        }
    }

    static void checkResolved(BomHeader bom, Map<Long, Material> materials) {
        List<Long> unresolved = bom.getLines().stream()
                .map(BomLine::getMaterialId)
                .filter(id -> !materials.containsKey(id))
                .distinct()
                .toList();
        if (!unresolved.isEmpty()) {
            throw new UnresolvedMaterialException(bom.getId(), unresolved);
        }
    }

    /**
     * Line quantities must already be in the material's base unit.
     */
    static void checkUnits(BomHeader bom, Map<Long, Material> materials) {
        for (BomLine line : bom.getLines()) {
            Material material = materials.get(line.getMaterialId());
            if (line.getUnit() != null && !line.getUnit().equalsIgnoreCase(material.getBaseUnit())) {
                throw new InvalidBomException("BOM " + bom.getName() + " line for " + material.getName() + " is in "
                        + line.getUnit() + " but the material is kept in " + material.getBaseUnit() + ".");
            }
        }
    }
}
