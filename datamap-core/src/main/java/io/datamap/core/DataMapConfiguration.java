package io.datamap.core;

/**
 * Immutable configuration for a data map.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * DataMapConfiguration config = DataMapConfiguration.builder()
 *     .duplicateNamePolicy(DuplicateNamePolicy.OVERWRITE)
 *     .firstGeneratedId(100)
 *     .build();
 * </pre>
 * <p>
 * All configuration is immutable once built.
 *
 * @see io.datamap.storage.DataMap
 */
public final class DataMapConfiguration {

    private static final DataMapConfiguration DEFAULTS = builder().build();

    // Reverse index collisions
    private final DuplicateNamePolicy duplicateNamePolicy;

    // Id generation
    private final int firstGeneratedId;

    // Sizing
    private final int initialCapacity;

    private DataMapConfiguration(Builder builder) {
        this.duplicateNamePolicy = builder.duplicateNamePolicy;
        this.firstGeneratedId = builder.firstGeneratedId;
        this.initialCapacity = builder.initialCapacity;
    }

    /**
     * Create a new builder for DataMapConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * The configuration used when none is supplied.
     */
    public static DataMapConfiguration defaults() {
        return DEFAULTS;
    }

    /**
     * Get the policy applied when a (language, name) pair is already owned by another row.
     *
     * @return the duplicate name policy (REJECT or OVERWRITE)
     */
    public DuplicateNamePolicy duplicateNamePolicy() {
        return duplicateNamePolicy;
    }

    /**
     * Get the id handed out by the first {@code insert} on an empty map.
     *
     * @return first generated id
     */
    public int firstGeneratedId() {
        return firstGeneratedId;
    }

    /**
     * Get the sizing hint for the row table and the name index.
     *
     * @return initial capacity
     */
    public int initialCapacity() {
        return initialCapacity;
    }

    public Builder toBuilder() {
        return new Builder()
                .duplicateNamePolicy(duplicateNamePolicy)
                .firstGeneratedId(firstGeneratedId)
                .initialCapacity(initialCapacity);
    }

    /**
     * What to do when a new or renamed row claims a (language, name) pair owned by another row.
     */
    public enum DuplicateNamePolicy {
        /**
         * Fail with {@link DuplicateKeyException} and leave the map unchanged.
         */
        REJECT,

        /**
         * The most recent claim wins; the earlier row keeps its name field but
         * is no longer reachable through that pair.
         */
        OVERWRITE
    }

    /**
     * Builder for DataMapConfiguration.
     */
    public static class Builder {
        private DuplicateNamePolicy duplicateNamePolicy = DuplicateNamePolicy.REJECT;
        private int firstGeneratedId = 1;
        private int initialCapacity = 16;

        private Builder() {
        }

        /**
         * Set the policy for (language, name) collisions.
         *
         * @param duplicateNamePolicy the policy
         * @return this builder for method chaining
         */
        public Builder duplicateNamePolicy(DuplicateNamePolicy duplicateNamePolicy) {
            if (duplicateNamePolicy == null) {
                throw new IllegalArgumentException("duplicateNamePolicy required");
            }
            this.duplicateNamePolicy = duplicateNamePolicy;
            return this;
        }

        /**
         * Set the first generated id.
         *
         * @param firstGeneratedId a non-negative id
         * @return this builder for method chaining
         */
        public Builder firstGeneratedId(int firstGeneratedId) {
            if (firstGeneratedId < 0) {
                throw new IllegalArgumentException("firstGeneratedId must be non-negative: " + firstGeneratedId);
            }
            this.firstGeneratedId = firstGeneratedId;
            return this;
        }

        /**
         * Set the initial capacity of the row table and name index.
         *
         * @param initialCapacity a positive capacity
         * @return this builder for method chaining
         */
        public Builder initialCapacity(int initialCapacity) {
            if (initialCapacity <= 0) {
                throw new IllegalArgumentException("initialCapacity must be positive: " + initialCapacity);
            }
            this.initialCapacity = initialCapacity;
            return this;
        }

        /**
         * Build the immutable configuration.
         *
         * @return the configuration instance
         */
        public DataMapConfiguration build() {
            return new DataMapConfiguration(this);
        }
    }
}
