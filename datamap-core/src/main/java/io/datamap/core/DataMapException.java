package io.datamap.core;

/**
 * Root of the unchecked exceptions raised by data map operations.
 */
public class DataMapException extends RuntimeException {

    public DataMapException(Throwable cause) {
        super(cause);
    }

    public DataMapException(String message, Throwable cause) {
        super(message, cause);
    }

    public DataMapException(String message) {
        super(message);
    }

}
