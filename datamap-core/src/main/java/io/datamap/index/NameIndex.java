package io.datamap.index;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Reverse index from {@link NameKey} to row id.
 * <p>
 * Holds at most one id per key. The owner decides how collisions are
 * resolved; {@link #put(NameKey, int)} always replaces.
 * <p>
 * <b>Thread-safety:</b> none. The owning map serializes access.
 */
public final class NameIndex {
    private static final int NO_ID = -1;

    private final HashMap<NameKey, Integer> index;

    public NameIndex() {
        this(16);
    }

    public NameIndex(int initialCapacity) {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("initialCapacity must be positive: " + initialCapacity);
        }
        this.index = new HashMap<>(initialCapacity);
    }

    /**
     * Map {@code key} to {@code id}.
     *
     * @return the id previously mapped to the key, or -1
     */
    public int put(NameKey key, int id) {
        if (key == null) {
            throw new IllegalArgumentException("key required");
        }
        Integer previous = index.put(key, id);
        return previous == null ? NO_ID : previous;
    }

    public OptionalInt lookup(NameKey key) {
        if (key == null) {
            return OptionalInt.empty();
        }
        Integer id = index.get(key);
        return id == null ? OptionalInt.empty() : OptionalInt.of(id);
    }

    /**
     * Remove the key only while it still points at {@code id}.
     *
     * @return true if the mapping was removed
     */
    public boolean remove(NameKey key, int id) {
        if (key == null) {
            return false;
        }
        return index.remove(key, id);
    }

    /**
     * True if the key is mapped to an id other than {@code id}.
     */
    public boolean claimedByOther(NameKey key, int id) {
        Integer owner = index.get(key);
        return owner != null && owner != id;
    }

    boolean hasKey(NameKey key) {
        return index.containsKey(key);
    }

    public void clear() {
        index.clear();
    }

    public int size() {
        return index.size();
    }

    Map<NameKey, Integer> entries() {
        return Collections.unmodifiableMap(index);
    }
}
