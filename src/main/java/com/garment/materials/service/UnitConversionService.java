package com.garment.materials.service;

import com.garment.materials.config.MaterialsProperties;
import com.garment.materials.model.Material;
import com.garment.materials.model.UnitOfMeasure;
import com.garment.materials.repository.UnitOfMeasureRepository;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Purchase unit / base unit arithmetic. Stock and BOM quantities are always held in
 * the material's base unit.
 */
@Service
public class UnitConversionService {

    static final BigDecimal MAX_CONVERSION_FACTOR = new BigDecimal("10000");

    private final UnitOfMeasureRepository uomRepository;
    private final MaterialsProperties properties;

    public UnitConversionService(UnitOfMeasureRepository uomRepository, MaterialsProperties properties) {
        this.uomRepository = uomRepository;
        this.properties = properties;
    }

    public BigDecimal toBaseUnits(BigDecimal purchaseQuantity, Material material) {
        return purchaseQuantity.multiply(factorOf(material));
    }

    public BigDecimal toPurchaseUnits(BigDecimal baseQuantity, Material material) {
        return baseQuantity.divide(factorOf(material), quantityScale(), RoundingMode.HALF_UP);
    }

    public BigDecimal costPerBaseUnit(BigDecimal costPerPurchaseUnit, Material material) {
        return costPerPurchaseUnit.divide(factorOf(material), quantityScale(), RoundingMode.HALF_UP);
    }

    /**
     * Converts between two units of the same category, e.g. yd to m.
     */
    public BigDecimal convert(BigDecimal quantity, String fromCode, String toCode) {
        UnitOfMeasure from = unit(fromCode);
        UnitOfMeasure to = unit(toCode);
        if (from.getCategory() != to.getCategory()) {
            throw new IllegalArgumentException(
                    "Cannot convert " + from.getCode() + " (" + from.getCategory() + ") to " + to.getCode() + " ("
                            + to.getCategory() + ")");
        }
        return quantity.multiply(from.getToBaseFactor())
                .divide(to.getToBaseFactor(), quantityScale(), RoundingMode.HALF_UP);
    }

    public void validateConversionFactor(String baseUnit, String purchaseUnit, BigDecimal factor) {
        if (factor == null || factor.signum() <= 0) {
            throw new IllegalArgumentException("Conversion factor must be positive");
        }
        if (purchaseUnit != null && purchaseUnit.equalsIgnoreCase(baseUnit) && factor.compareTo(BigDecimal.ONE) != 0) {
            throw new IllegalArgumentException("Same units should have conversion factor of 1");
        }
        if (factor.compareTo(MAX_CONVERSION_FACTOR) > 0) {
            throw new IllegalArgumentException("Conversion factor " + factor + " seems unusually high");
        }
    }

    private UnitOfMeasure unit(String code) {
        return uomRepository.findByCodeIgnoreCase(code)
                .orElseThrow(() -> new IllegalArgumentException("Unknown unit of measure: " + code));
    }

    private BigDecimal factorOf(Material material) {
        BigDecimal factor = material.getConversionFactor();
        return factor != null && factor.signum() > 0 ? factor : BigDecimal.ONE;
    }

    private int quantityScale() {
        return properties.getCosting().getQuantityScale();
    }
}
