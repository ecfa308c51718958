package com.garment.materials.model;

import jakarta.persistence.*;
import lombok.Data;

import java.math.BigDecimal;

@Entity
@Table(name = "materials")
@Data
@org.hibernate.annotations.SQLDelete(sql = "UPDATE materials SET deleted = true WHERE id = ?")
@org.hibernate.annotations.SQLRestriction("deleted = false")
public class Material {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private String code;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private String baseUnit;

    private String purchaseUnit;

    // Base units per purchase unit, e.g. 50 (m) per roll
    @Column(nullable = false, precision = 19, scale = 6)
    private BigDecimal conversionFactor = BigDecimal.ONE;

    // Per base unit. Unpriced materials cost nothing in BOM costing.
    @Column(precision = 19, scale = 6)
    private BigDecimal costPerUnit;

    private boolean deleted = false;
}
