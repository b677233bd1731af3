package com.cppbonsai.cst.fixture;

import java.util.List;
import java.util.Optional;

import com.cppbonsai.cst.BinaryOperatorKind;
import com.cppbonsai.cst.Cursor;
import com.cppbonsai.cst.CursorAccessException;
import com.cppbonsai.cst.CursorKind;
import com.cppbonsai.cst.CursorLocation;
import com.cppbonsai.cst.CxxAccessSpecifier;
import com.cppbonsai.cst.Token;
import com.cppbonsai.cst.UnaryOperatorKind;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

/**
 * In-memory {@link Cursor} used to replay a CST without a live front end.
 *
 * Equality is object identity, as for live cursors. Links to other cursors (referenced
 * declaration, definition, call arguments) may be given to the builder or attached later by
 * {@link FixtureLoader} once the whole tree exists.
 */
public final class FixtureCursor implements Cursor {

    @Getter
    private final CursorKind kind;
    private final String kindName;
    @Getter
    private final String spelling;
    private final String displayName;
    @Getter
    private final String typeSpelling;
    @Getter
    private final String resultTypeSpelling;
    private final boolean definition;
    @Getter
    private final List<Cursor> children;
    @Getter
    private final List<Token> tokens;
    @Getter
    private final String usr;
    @Getter
    private final CxxAccessSpecifier accessSpecifier;
    private final CursorLocation location;
    private final String locationError;
    private final BinaryOperatorKind binaryOperator;
    private final UnaryOperatorKind unaryOperator;

    private Cursor referenced;
    private Cursor definitionCursor;
    private List<Cursor> arguments;

    @Builder
    private FixtureCursor(CursorKind kind, String kindName, String spelling, String displayName,
                          String typeSpelling, String resultTypeSpelling, boolean definition,
                          @Singular("child") List<Cursor> children, @Singular("token") List<Token> tokens,
                          String usr, CxxAccessSpecifier accessSpecifier, CursorLocation location,
                          String locationError, BinaryOperatorKind binaryOperator,
                          UnaryOperatorKind unaryOperator, Cursor referenced, Cursor definitionCursor,
                          List<Cursor> arguments) {
        this.kind = kind != null ? kind : CursorKind.UNRECOGNIZED;
        this.kindName = kindName != null ? kindName : this.kind.name();
        this.spelling = spelling != null ? spelling : "";
        this.displayName = displayName;
        this.typeSpelling = typeSpelling != null ? typeSpelling : "";
        this.resultTypeSpelling = resultTypeSpelling != null ? resultTypeSpelling : "";
        this.definition = definition;
        this.children = List.copyOf(children);
        this.tokens = List.copyOf(tokens);
        this.usr = usr != null ? usr : "";
        this.accessSpecifier = accessSpecifier != null ? accessSpecifier : CxxAccessSpecifier.INVALID;
        this.location = location;
        this.locationError = locationError;
        this.binaryOperator = binaryOperator;
        this.unaryOperator = unaryOperator;
        this.referenced = referenced;
        this.definitionCursor = definitionCursor;
        this.arguments = arguments != null ? List.copyOf(arguments) : null;
    }

    /**
     * Shorthand for {@code builder().kind(kind)}.
     */
    public static FixtureCursorBuilder of(CursorKind kind) {
        return builder().kind(kind);
    }

    /**
     * Builder step for a location with a file; lines and columns are 1-based as in the front end.
     */
    public static CursorLocation at(String file, int line, int column) {
        return new CursorLocation(file, line, column);
    }

    @Override
    public String getKindName() {
        return kindName;
    }

    @Override
    public String getDisplayName() {
        return displayName != null ? displayName : spelling;
    }

    @Override
    public boolean isDefinition() {
        return definition;
    }

    @Override
    public Optional<Cursor> getReferenced() {
        return Optional.ofNullable(referenced);
    }

    @Override
    public Optional<Cursor> getDefinition() {
        return Optional.ofNullable(definitionCursor);
    }

    /**
     * Arguments given explicitly, or for a call expression every child after the callee.
     */
    @Override
    public List<Cursor> getArguments() {
        if (arguments != null) {
            return arguments;
        }
        if (kind == CursorKind.CALL_EXPR && children.size() > 1) {
            return children.subList(1, children.size());
        }
        return List.of();
    }

    @Override
    public Optional<CursorLocation> getLocation() {
        if (locationError != null) {
            throw new CursorAccessException(locationError);
        }
        return Optional.ofNullable(location);
    }

    @Override
    public Optional<BinaryOperatorKind> getBinaryOperator() {
        return Optional.ofNullable(binaryOperator);
    }

    @Override
    public Optional<UnaryOperatorKind> getUnaryOperator() {
        return Optional.ofNullable(unaryOperator);
    }

    void linkReferenced(Cursor target) {
        this.referenced = target;
    }

    void linkDefinition(Cursor target) {
        this.definitionCursor = target;
    }

    void linkArguments(List<Cursor> targets) {
        this.arguments = List.copyOf(targets);
    }

    @Override
    public String toString() {
        return kindName + "(" + spelling + ")";
    }
}
