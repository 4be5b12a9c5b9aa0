package io.datamap.index;

/**
 * Alternate key of a row: one translation of its name.
 */
public record NameKey(String language, String name) {
    public NameKey {
        if (language == null) {
            throw new IllegalArgumentException("language required");
        }
        if (name == null) {
            throw new IllegalArgumentException("name required");
        }
    }

    public static NameKey of(String language, String name) {
        return new NameKey(language, name);
    }

    @Override
    public String toString() {
        return language + ":" + name;
    }
}
