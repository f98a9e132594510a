package com.phillippitts.heynova.exception;

/**
 * Base exception for all HeyNova application-specific errors.
 * All domain exceptions extend this class so a dispatch cycle can absorb them in one place.
 */
public class HeyNovaException extends RuntimeException {

    public HeyNovaException(String message) {
        super(message);
    }

    public HeyNovaException(String message, Throwable cause) {
        super(message, cause);
    }
}
