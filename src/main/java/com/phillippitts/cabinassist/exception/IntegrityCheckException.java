package com.phillippitts.cabinassist.exception;

/**
 * Thrown when system integrity verification fails at startup.
 * This is a fatal error: startup is aborted and never retried.
 */
public class IntegrityCheckException extends CabinAssistException {

    public IntegrityCheckException(String message) {
        super(message);
    }

    public IntegrityCheckException(String message, Throwable cause) {
        super(message, cause);
    }
}
