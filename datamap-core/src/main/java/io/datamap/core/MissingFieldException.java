package io.datamap.core;

/**
 * Raised when a row is built from fields that lack a required entry.
 */
public class MissingFieldException extends DataMapException {

    private final String field;

    public MissingFieldException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
