package com.cppbonsai.parser.extract;

import java.util.List;

import com.cppbonsai.ast.AttributeKey;
import com.cppbonsai.ast.AttributeMap;
import com.cppbonsai.ast.NodeKind;
import com.cppbonsai.cst.Cursor;
import com.cppbonsai.cst.CursorKind;

/**
 * Non-static data members; a default member initializer becomes the only child.
 */
public final class FieldExtractor extends AbstractExtractor {

    public static final FieldExtractor INSTANCE = new FieldExtractor();

    private FieldExtractor() {
        super(CursorKind.FIELD_DECL);
    }

    @Override
    protected NodeKind kindOf(Cursor cursor) {
        return NodeKind.FIELD_DECL;
    }

    @Override
    protected void extractInto(Cursor cursor, ExtractionContext context, AttributeMap attributes,
                               List<Dependency> children) {
        attributes.putIfPresent(AttributeKey.NAME, cursor.getSpelling());
        attributes.putIfPresent(AttributeKey.USR, cursor.getUsr());
        attributes.putIfPresent(AttributeKey.DATA_TYPE, cursor.getTypeSpelling());
        writeScope(context, attributes);
        writeAccess(cursor, attributes);
        addExpressionChildren(ChildStages.of(cursor).rest(), context, children);
    }
}
