package com.garment.materials.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "goods_issue_lines")
@Data
public class GoodsIssueLine {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "goods_issue_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @JsonIgnore
    private GoodsIssue goodsIssue;

    @Column(nullable = false)
    private Long materialId;

    @Column(nullable = false, precision = 19, scale = 6)
    private BigDecimal requestedQuantity;

    // FIFO weighted average, fixed when the issue is posted
    @Column(precision = 19, scale = 6)
    private BigDecimal unitCost;

    private String batchNumber;

    @Column(length = 1000)
    private String notes;

    @ElementCollection
    @CollectionTable(name = "goods_issue_line_layers", joinColumns = @JoinColumn(name = "goods_issue_line_id"))
    private List<LayerDraw> consumedLayers = new ArrayList<>();
}
