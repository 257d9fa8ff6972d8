package com.phillippitts.cabinassist.exception;

/**
 * Thrown when a context update carries a value whose shape does not match the
 * context schema (for example a scalar merged into a map field, or an unknown field).
 * The context store guarantees the prior state is left untouched when this is thrown.
 */
public class SchemaMismatchException extends CabinAssistException {

    private final String field;

    public SchemaMismatchException(String field, String reason) {
        super("Schema mismatch on field '" + field + "': " + reason);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
