package com.garment.materials.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Entity
@Table(name = "bom_headers")
@Data
public class BomHeader {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private String version = "1.0";

    // Output quantity the line quantities are written against
    @Column(nullable = false, precision = 19, scale = 6)
    private BigDecimal quantity = BigDecimal.ONE;

    @Column(nullable = false)
    private String unit = "pcs";

    private boolean active = true;

    @Column(length = 1000)
    private String description;

    @OneToMany(mappedBy = "bomHeader", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("sortOrder ASC, id ASC")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<BomLine> lines = new ArrayList<>();

    // Products this BOM is used for
    @ElementCollection
    @CollectionTable(name = "bom_products", joinColumns = @JoinColumn(name = "bom_header_id"))
    @Column(name = "product_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Set<Long> productIds = new HashSet<>();

    @Column(updatable = false)
    private LocalDateTime createdAt;

    public void addLine(BomLine line) {
        line.setBomHeader(this);
        if (line.getSortOrder() == null)
            line.setSortOrder(lines.size());
        lines.add(line);
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
