package io.datamap.storage;

import io.datamap.core.IdGenerator;

/**
 * Per-map id counter.
 * <p>
 * Keeps {@code next > highest}: explicit ids above the highest one seen push
 * the counter past them, so generated ids never collide with explicit ones.
 * Generated ids count as seen even when the row they were drawn for is rejected.
 */
final class IdSequence implements IdGenerator {
    private static final int NONE = -1;

    private long next;
    private int highest = NONE;

    IdSequence(int first) {
        if (first < 0) {
            throw new IllegalArgumentException("first id must be non-negative: " + first);
        }
        this.next = first;
    }

    @Override
    public int generate() {
        int id = peek();
        highest = Math.max(highest, id);
        next = id + 1L;
        return id;
    }

    @Override
    public int peek() {
        if (next > Integer.MAX_VALUE) {
            throw new IllegalStateException("id space exhausted");
        }
        return (int) next;
    }

    @Override
    public void advancePast(int id) {
        if (id > highest) {
            highest = id;
            next = Math.max(next, id + 1L);
        }
    }

    int highest() {
        return highest;
    }
}
