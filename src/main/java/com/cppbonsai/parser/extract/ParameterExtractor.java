package com.cppbonsai.parser.extract;

import java.util.List;

import com.cppbonsai.ast.AttributeKey;
import com.cppbonsai.ast.AttributeMap;
import com.cppbonsai.ast.NodeKind;
import com.cppbonsai.cst.Cursor;
import com.cppbonsai.cst.CursorKind;

/**
 * Function parameters. The position comes from the enclosing function's context; a default
 * argument becomes the only child.
 */
public final class ParameterExtractor extends AbstractExtractor {

    public static final ParameterExtractor INSTANCE = new ParameterExtractor();

    private ParameterExtractor() {
        super(CursorKind.PARM_DECL);
    }

    @Override
    protected NodeKind kindOf(Cursor cursor) {
        return NodeKind.PARAMETER_DECL;
    }

    @Override
    protected void extractInto(Cursor cursor, ExtractionContext context, AttributeMap attributes,
                               List<Dependency> children) {
        attributes.putIfPresent(AttributeKey.NAME, cursor.getSpelling());
        attributes.putIfPresent(AttributeKey.USR, cursor.getUsr());
        attributes.putIfPresent(AttributeKey.DATA_TYPE, cursor.getTypeSpelling());
        writeScope(context, attributes);
        addExpressionChildren(ChildStages.of(cursor).rest(), context, children);
    }
}
