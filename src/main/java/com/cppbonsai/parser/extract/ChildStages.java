package com.cppbonsai.parser.extract;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

import com.cppbonsai.cst.Cursor;

/**
 * Sequential reader over an immutable snapshot of a cursor's children. Each extraction stage
 * consumes the prefix it owns and leaves the rest to the next stage.
 */
public final class ChildStages {

    private final List<Cursor> children;
    private int next;

    private ChildStages(List<Cursor> children) {
        this.children = children;
    }

    public static ChildStages of(Cursor cursor) {
        return new ChildStages(List.copyOf(cursor.getChildren()));
    }

    /**
     * Consumes children while the predicate holds and returns them.
     */
    public List<Cursor> takeWhile(Predicate<Cursor> predicate) {
        int start = next;
        while (next < children.size() && predicate.test(children.get(next))) {
            next++;
        }
        return children.subList(start, next);
    }

    public Optional<Cursor> peek() {
        return hasNext() ? Optional.of(children.get(next)) : Optional.empty();
    }

    public Optional<Cursor> next() {
        return hasNext() ? Optional.of(children.get(next++)) : Optional.empty();
    }

    public boolean hasNext() {
        return next < children.size();
    }

    /**
     * Consumes everything left.
     */
    public List<Cursor> rest() {
        List<Cursor> remaining = children.subList(next, children.size());
        next = children.size();
        return remaining;
    }

    public int consumed() {
        return next;
    }

    public int size() {
        return children.size();
    }
}
