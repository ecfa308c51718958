package com.garment.materials.dto;

import com.garment.materials.model.IssueType;
import lombok.Data;

import java.time.LocalDate;

/**
 * Header changes for a pending goods issue. Null fields are left as they are.
 */
@Data
public class GoodsIssueUpdateRequest {
    private LocalDate issueDate;

    private IssueType issueType;

    private String referenceNumber;

    private String notes;
}
