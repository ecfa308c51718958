package com.garment.materials.dto;

import com.garment.materials.model.IssueType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
public class GoodsIssueRequest {
    private LocalDate issueDate;

    private IssueType issueType = IssueType.PRODUCTION;

    private String referenceNumber;

    private String notes;

    @Valid
    @NotEmpty
    private List<IssueLineRequest> lines = new ArrayList<>();
}
