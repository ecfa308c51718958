package com.garment.materials.model;

import jakarta.persistence.*;
import lombok.Data;

import java.math.BigDecimal;

@Entity
@Table(name = "units_of_measure")
@Data
public class UnitOfMeasure {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private String code; // e.g. kg, m, pcs

    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private UnitCategory category;

    // Multiplier into the category base unit (kg, m, m², l, pcs)
    @Column(nullable = false, precision = 19, scale = 7)
    private BigDecimal toBaseFactor = BigDecimal.ONE;
}
