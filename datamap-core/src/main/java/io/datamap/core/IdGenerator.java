package io.datamap.core;

/**
 * Source of identifiers for rows added without an explicit id.
 * <p>
 * Implementations must never hand out an id at or below one they have
 * already been told about through {@link #advancePast(int)}.
 */
public interface IdGenerator {

    /**
     * Consume and return the next identifier.
     */
    int generate();

    /**
     * Peek at the identifier the next {@link #generate()} call returns.
     */
    int peek();

    /**
     * Record that {@code id} is now in use so later ids are strictly greater.
     */
    void advancePast(int id);
}
