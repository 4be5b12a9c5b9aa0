package io.datamap.core;

/**
 * Raised when an id, field or language is looked up but not present.
 * <p>
 * {@link #key()} is the missing key.
 */
public class KeyNotFoundException extends DataMapException {

    private final Object key;

    public KeyNotFoundException(Object key, String message) {
        super(message);
        this.key = key;
    }

    public Object key() {
        return key;
    }
}
