package com.cppbonsai.parser.extract;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.cppbonsai.ast.AccessSpecifier;
import com.cppbonsai.ast.AttributeKey;
import com.cppbonsai.ast.AttributeMap;
import com.cppbonsai.ast.NodeKind;
import com.cppbonsai.cst.Cursor;
import com.cppbonsai.cst.CursorKind;
import com.cppbonsai.parser.Position;

/**
 * Base for the built-in strategies: checks the kind precondition, writes the argument index
 * handed down by the parent and collects the children in order.
 */
public abstract class AbstractExtractor implements Extractor {

    private final Set<CursorKind> acceptedKinds;

    protected AbstractExtractor(Set<CursorKind> acceptedKinds) {
        if (acceptedKinds.isEmpty()) {
            throw new IllegalArgumentException("An extractor must accept at least one kind");
        }
        this.acceptedKinds = Set.copyOf(EnumSet.copyOf(acceptedKinds));
    }

    protected AbstractExtractor(CursorKind first, CursorKind... rest) {
        this(EnumSet.of(first, rest));
    }

    @Override
    public final Set<CursorKind> acceptedKinds() {
        return acceptedKinds;
    }

    @Override
    public final NodeKind nodeKind(Cursor cursor) {
        requireAccepted(cursor);
        return kindOf(cursor);
    }

    @Override
    public final List<Dependency> extract(Cursor cursor, ExtractionContext context, AttributeMap attributes) {
        requireAccepted(cursor);
        if (context.hasIndex()) {
            attributes.put(AttributeKey.PARAMETER_INDEX, context.getIndex());
        }
        List<Dependency> children = new ArrayList<>();
        extractInto(cursor, context, attributes, children);
        return List.copyOf(children);
    }

    protected abstract NodeKind kindOf(Cursor cursor);

    protected abstract void extractInto(Cursor cursor, ExtractionContext context, AttributeMap attributes,
                                        List<Dependency> children);

    protected static void writeAccess(Cursor cursor, AttributeMap attributes) {
        accessOf(cursor).ifPresent(access -> attributes.put(AttributeKey.ACCESS, access.label()));
    }

    protected static void writeScope(ExtractionContext context, AttributeMap attributes) {
        context.findScope().ifPresent(scope -> attributes.put(AttributeKey.SCOPE, scope));
    }

    protected static Optional<AccessSpecifier> accessOf(Cursor cursor) {
        if (cursor.getAccessSpecifier() == null) {
            return Optional.empty();
        }
        return switch (cursor.getAccessSpecifier()) {
            case PUBLIC -> Optional.of(AccessSpecifier.PUBLIC);
            case PROTECTED -> Optional.of(AccessSpecifier.PROTECTED);
            case PRIVATE -> Optional.of(AccessSpecifier.PRIVATE);
            case INVALID, NONE -> Optional.empty();
        };
    }

    /**
     * Dispatches every expression child in expression position.
     */
    protected static void addExpressionChildren(List<Cursor> cursors, ExtractionContext context,
                                                List<Dependency> children) {
        for (Cursor child : cursors) {
            if (child.getKind().isExpression()) {
                context.child(child, Position.EXPRESSION).ifPresent(children::add);
            }
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }
}
