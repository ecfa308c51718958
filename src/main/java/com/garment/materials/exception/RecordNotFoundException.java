package com.garment.materials.exception;

public class RecordNotFoundException extends MaterialsException {
    public RecordNotFoundException(String kind, Object id) {
        super("NOT_FOUND", kind + " not found: " + id);
    }
}
