package com.garment.materials.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Header changes for an active BOM. Null fields are left as they are.
 */
@Data
public class BomUpdateRequest {
    private String name;

    private String version;

    private BigDecimal quantity;

    private String unit;

    private String description;

    private Set<Long> productIds;
}
