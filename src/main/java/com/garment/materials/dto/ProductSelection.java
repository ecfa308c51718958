package com.garment.materials.dto;

import java.math.BigDecimal;

/**
 * An output product variant chosen for production, with the quantity to make.
 */
public record ProductSelection(
        Long productId,
        String size,
        String color,
        Long categoryId,
        BigDecimal quantity) {
}
