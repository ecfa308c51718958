package com.garment.materials.model;

public enum ConsumptionKind {
    GENERAL,
    BY_SIZE,
    BY_COLOR,
    BY_CATEGORY
}
