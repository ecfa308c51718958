package com.garment.materials.model;

import jakarta.persistence.*;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One received batch of a material at a single unit cost. Issues draw layers down
 * oldest first; a layer never goes back up.
 */
@Entity
@Table(name = "inventory_layers", indexes = @Index(columnList = "materialId,createdAt"))
@Data
public class InventoryLayer {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long materialId;

    @Column(nullable = false, precision = 19, scale = 6)
    private BigDecimal quantityOnHand;

    @Column(nullable = false, precision = 19, scale = 6)
    private BigDecimal quantityAvailable;

    @Column(nullable = false, precision = 19, scale = 6)
    private BigDecimal unitCost;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    private String transactionRef; // e.g. GRN number

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null)
            createdAt = LocalDateTime.now();
        if (quantityAvailable == null)
            quantityAvailable = quantityOnHand;
    }
}
