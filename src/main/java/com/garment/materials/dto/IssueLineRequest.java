package com.garment.materials.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IssueLineRequest {
    @NotNull
    private Long materialId;

    @NotNull
    @Positive
    private BigDecimal quantity;

    private String batchNumber;

    private String notes;

    public IssueLineRequest(Long materialId, BigDecimal quantity) {
        this(materialId, quantity, null, null);
    }
}
