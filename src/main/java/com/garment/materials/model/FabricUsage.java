package com.garment.materials.model;

public enum FabricUsage {
    BODY,
    GUSSET_1,
    GUSSET_2
}
