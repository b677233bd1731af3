package com.cppbonsai.parser;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

import com.cppbonsai.cst.CursorKind;
import com.cppbonsai.parser.extract.Extractor;

import lombok.NonNull;
import lombok.Value;

/**
 * One row of the {@link DispatchTable}: native kinds met in the given positions either map to an
 * extractor or are dropped on purpose ({@code extractor == null}).
 */
@Value
public class DispatchRule {

    @NonNull
    Set<CursorKind> kinds;

    @NonNull
    Set<Position> positions;

    /** Target strategy; null for an explicit drop. */
    Extractor extractor;

    public boolean isDrop() {
        return extractor == null;
    }

    public boolean matches(CursorKind kind, Position position) {
        return kinds.contains(kind) && positions.contains(position);
    }

    /**
     * Maps every kind the extractor accepts.
     */
    public static DispatchRule map(Extractor extractor, Position... positions) {
        return new DispatchRule(Set.copyOf(extractor.acceptedKinds()), positionSet(positions), extractor);
    }

    /**
     * Maps only the given kinds, which must all be accepted by the extractor.
     */
    public static DispatchRule map(Set<CursorKind> kinds, Extractor extractor, Position... positions) {
        if (!extractor.acceptedKinds().containsAll(kinds)) {
            throw new IllegalArgumentException(extractor.getClass().getSimpleName()
                    + " does not accept all of " + kinds);
        }
        return new DispatchRule(Set.copyOf(kinds), positionSet(positions), extractor);
    }

    public static DispatchRule drop(Set<CursorKind> kinds, Position... positions) {
        return new DispatchRule(Set.copyOf(kinds), positionSet(positions), null);
    }

    public static DispatchRule drop(CursorKind kind, Position... positions) {
        return drop(EnumSet.of(kind), positions);
    }

    private static Set<Position> positionSet(Position... positions) {
        if (positions.length == 0) {
            return EnumSet.allOf(Position.class);
        }
        return EnumSet.copyOf(Arrays.asList(positions));
    }
}
