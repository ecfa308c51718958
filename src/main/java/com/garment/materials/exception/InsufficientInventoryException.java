package com.garment.materials.exception;

import lombok.Getter;

import java.math.BigDecimal;

@Getter
public class InsufficientInventoryException extends MaterialsException {
    private final Long materialId;
    private final String materialName;
    private final BigDecimal available;
    private final BigDecimal required;

    public InsufficientInventoryException(Long materialId, String materialName, BigDecimal available,
            BigDecimal required) {
        super("INSUFFICIENT_INVENTORY", "Insufficient inventory for " + materialName + ". Available: "
                + available.stripTrailingZeros().toPlainString() + ", Required: "
                + required.stripTrailingZeros().toPlainString());
        this.materialId = materialId;
        this.materialName = materialName;
        this.available = available;
        this.required = required;
    }
}
