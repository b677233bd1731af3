package com.cppbonsai.cst;

import java.util.List;
import java.util.Optional;

/**
 * A node of the front end's concrete syntax tree.
 *
 * Cursors are compared by identity ({@link Object#equals(Object)}); two cursors that denote the
 * same construct must be equal. Implementations are expected to be cheap, read-only handles.
 */
public interface Cursor {

    CursorKind getKind();

    /**
     * Front-end specific kind name. Equals {@code getKind().name()} unless the kind is
     * {@link CursorKind#UNRECOGNIZED}.
     */
    default String getKindName() {
        return getKind().name();
    }

    String getSpelling();

    String getDisplayName();

    /** Canonical spelling of the cursor's type, empty when it has none. */
    String getTypeSpelling();

    /** Result type spelling of function-like cursors, empty otherwise. */
    String getResultTypeSpelling();

    boolean isDefinition();

    List<Cursor> getChildren();

    List<Token> getTokens();

    /** Unified symbol reference; empty when the front end has none for this cursor. */
    String getUsr();

    CxxAccessSpecifier getAccessSpecifier();

    /** The declaration a reference cursor points to. */
    Optional<Cursor> getReferenced();

    /** Definition lookup through the front end's symbol resolution. */
    Optional<Cursor> getDefinition();

    /** Argument expressions of call-like cursors, in source order. */
    List<Cursor> getArguments();

    /**
     * Location of the cursor.
     *
     * @throws CursorAccessException if the front end cannot compute one
     */
    Optional<CursorLocation> getLocation();

    Optional<BinaryOperatorKind> getBinaryOperator();

    Optional<UnaryOperatorKind> getUnaryOperator();
}
