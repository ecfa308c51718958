package com.garment.materials.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class UnresolvedMaterialException extends MaterialsException {
    private final Long bomId;
    private final List<Long> materialIds;

    public UnresolvedMaterialException(Long bomId, List<Long> materialIds) {
        super("UNRESOLVED_MATERIAL", "BOM " + bomId + " references unknown materials: " + materialIds);
        this.bomId = bomId;
        this.materialIds = List.copyOf(materialIds);
    }
}
