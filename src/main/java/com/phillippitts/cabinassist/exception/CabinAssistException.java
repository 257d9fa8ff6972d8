package com.phillippitts.cabinassist.exception;

/**
 * Base exception for all cabin-assist application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class CabinAssistException extends RuntimeException {

    public CabinAssistException(String message) {
        super(message);
    }

    public CabinAssistException(String message, Throwable cause) {
        super(message, cause);
    }

    public CabinAssistException(Throwable cause) {
        super(cause);
    }
}
