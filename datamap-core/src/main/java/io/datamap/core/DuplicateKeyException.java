package io.datamap.core;

/**
 * Raised when an id, or a (language, name) pair, is already claimed.
 * <p>
 * {@link #key()} is the conflicting key: an {@code Integer} for ids and a
 * name key for translations.
 */
public class DuplicateKeyException extends DataMapException {

    private final Object key;

    public DuplicateKeyException(Object key, String message) {
        super(message);
        this.key = key;
    }

    public Object key() {
        return key;
    }
}
