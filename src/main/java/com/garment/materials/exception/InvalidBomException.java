package com.garment.materials.exception;

/**
 * The BOM cannot be costed or scaled, e.g. its output quantity is not positive.
 */
public class InvalidBomException extends MaterialsException {
    public InvalidBomException(String message) {
        super("INVALID_BOM", message);
    }
}
