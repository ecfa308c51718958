package com.garment.materials.dto;

import com.garment.materials.model.IssueType;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Issue the materials a BOM needs. Either quantityToProduce or selections
 * (variant-wise production) must be given.
 */
@Data
public class BomIssueRequest {
    @NotNull
    private Long bomId;

    private BigDecimal quantityToProduce;

    private List<ProductSelection> selections = new ArrayList<>();

    private LocalDate issueDate;

    private IssueType issueType = IssueType.PRODUCTION;

    private String referenceNumber;

    private String notes;
}
