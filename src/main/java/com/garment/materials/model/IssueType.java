package com.garment.materials.model;

public enum IssueType {
    PRODUCTION,
    MAINTENANCE,
    SAMPLE,
    WASTE,
    ADJUSTMENT
}
