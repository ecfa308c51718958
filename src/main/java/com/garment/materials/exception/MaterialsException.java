package com.garment.materials.exception;

import lombok.Getter;

@Getter
public abstract class MaterialsException extends RuntimeException {
    private final String errorCode;

    protected MaterialsException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
