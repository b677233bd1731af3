package com.cppbonsai.parser;

/**
 * Monotonic node id source owned by a single build session.
 */
final class IdGenerator {

    private int next;

    IdGenerator(int first) {
        if (first < 0) {
            throw new IllegalArgumentException("First id must be non-negative: " + first);
        }
        this.next = first;
    }

    int next() {
        if (next == Integer.MAX_VALUE) {
            throw new IllegalStateException("Node id space exhausted");
        }
        return next++;
    }
}
