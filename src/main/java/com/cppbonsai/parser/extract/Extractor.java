package com.cppbonsai.parser.extract;

import java.util.List;
import java.util.Set;

import com.cppbonsai.ast.AttributeMap;
import com.cppbonsai.ast.NodeKind;
import com.cppbonsai.ast.SourceLocation;
import com.cppbonsai.cst.Cursor;
import com.cppbonsai.cst.CursorKind;

/**
 * Strategy that turns one CST cursor into the attributes of one AST node plus the ordered list of
 * children still to be built.
 *
 * Implementations are stateless and never see node ids or the tree under construction.
 */
public interface Extractor {

    Set<CursorKind> acceptedKinds();

    /**
     * Node kind produced for the cursor.
     *
     * @throws InvalidCursorKindException if the cursor kind is not accepted
     */
    NodeKind nodeKind(Cursor cursor);

    /**
     * Writes the node's attributes into {@code attributes} and returns its children in order.
     *
     * @throws InvalidCursorKindException if the cursor kind is not accepted
     */
    List<Dependency> extract(Cursor cursor, ExtractionContext context, AttributeMap attributes);

    default SourceLocation location(Cursor cursor) {
        return Locations.fromCursor(cursor);
    }

    default void requireAccepted(Cursor cursor) {
        if (!acceptedKinds().contains(cursor.getKind())) {
            throw new InvalidCursorKindException(getClass().getSimpleName(), cursor.getKindName(), acceptedKinds());
        }
    }
}
