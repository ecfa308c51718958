package com.garment.materials.model;

public enum IssueStatus {
    PENDING,
    ISSUED,
    CANCELLED
}
