package com.garment.materials.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class CopyBomRequest {
    @NotBlank
    private String newName;

    // Keeps the source's products when null
    private Long targetProductId;
}
