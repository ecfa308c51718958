package com.garment.materials.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Quantity taken from one inventory layer by an issue line.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LayerDraw {
    @Column(nullable = false)
    private Long layerId;

    @Column(nullable = false, precision = 19, scale = 6)
    private BigDecimal quantityTaken;

    @Column(nullable = false, precision = 19, scale = 6)
    private BigDecimal unitCost;
}
