package com.garment.materials.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Data
public class BomRequest {
    @NotBlank
    private String name;

    private String version;

    @NotNull
    private BigDecimal quantity;

    private String unit;

    private String description;

    private Set<Long> productIds = new HashSet<>();

    @Valid
    private List<BomLineRequest> lines = new ArrayList<>();
}
