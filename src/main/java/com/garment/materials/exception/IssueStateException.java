package com.garment.materials.exception;

import com.garment.materials.model.IssueStatus;
import lombok.Getter;

@Getter
public class IssueStateException extends MaterialsException {
    private final String issueNumber;
    private final IssueStatus status;

    public IssueStateException(String issueNumber, IssueStatus status, String action) {
        super("ISSUE_STATE", "Cannot " + action + " goods issue " + issueNumber + " (Status: " + status + ")");
        this.issueNumber = issueNumber;
        this.status = status;
    }
}
