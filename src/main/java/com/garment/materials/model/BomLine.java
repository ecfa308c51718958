package com.garment.materials.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.math.BigDecimal;

@Entity
@Table(name = "bom_lines")
@Data
public class BomLine {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "bom_header_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @JsonIgnore
    private BomHeader bomHeader;

    // Resolved through MaterialService; a soft-deleted material no longer resolves
    @Column(nullable = false)
    private Long materialId;

    // Per header quantity, in the material's base unit
    @Column(nullable = false, precision = 19, scale = 6)
    private BigDecimal quantity;

    @Column(nullable = false)
    private String unit;

    // As typed by the planner, before conversion
    @Column(precision = 19, scale = 6)
    private BigDecimal enteredQuantity;

    private String enteredUnit;

    @Column(nullable = false, precision = 9, scale = 4)
    private BigDecimal wastePercentage = BigDecimal.ZERO;

    @Embedded
    private ConsumptionSpec consumption = ConsumptionSpec.general();

    @Enumerated(EnumType.STRING)
    private FabricUsage fabricUsage;

    @Column(length = 1000)
    private String notes;

    private Integer sortOrder;

    /**
     * quantity * (1 + waste / 100)
     */
    public BigDecimal effectiveQuantity() {
        BigDecimal waste = wastePercentage != null ? wastePercentage : BigDecimal.ZERO;
        return quantity.add(quantity.multiply(waste).movePointLeft(2));
    }
}
