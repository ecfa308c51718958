package com.garment.materials.model;

public enum UnitCategory {
    WEIGHT,
    LENGTH,
    AREA,
    VOLUME,
    COUNT
}
