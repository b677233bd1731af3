package com.cppbonsai.parser.extract;

import java.util.EnumSet;
import java.util.List;

import com.cppbonsai.ast.AttributeKey;
import com.cppbonsai.ast.AttributeMap;
import com.cppbonsai.ast.NodeKind;
import com.cppbonsai.cst.Cursor;
import com.cppbonsai.cst.CursorKind;

/**
 * Expressions without attributes of their own beyond the type: every expression child is an
 * operand.
 */
public final class ExpressionExtractor extends AbstractExtractor {

    public static final ExpressionExtractor CONDITIONAL =
            new ExpressionExtractor(NodeKind.CONDITIONAL_EXPR, EnumSet.of(CursorKind.CONDITIONAL_OPERATOR));
    public static final ExpressionExtractor CAST = new ExpressionExtractor(NodeKind.CAST_EXPR,
            EnumSet.of(CursorKind.CSTYLE_CAST_EXPR, CursorKind.CXX_STATIC_CAST_EXPR, CursorKind.CXX_DYNAMIC_CAST_EXPR,
                    CursorKind.CXX_REINTERPRET_CAST_EXPR, CursorKind.CXX_CONST_CAST_EXPR,
                    CursorKind.CXX_FUNCTIONAL_CAST_EXPR));
    public static final ExpressionExtractor ITEM_ACCESS =
            new ExpressionExtractor(NodeKind.ITEM_ACCESS, EnumSet.of(CursorKind.ARRAY_SUBSCRIPT_EXPR));
    public static final ExpressionExtractor THIS =
            new ExpressionExtractor(NodeKind.THIS_EXPR, EnumSet.of(CursorKind.CXX_THIS_EXPR));
    public static final ExpressionExtractor NEW =
            new ExpressionExtractor(NodeKind.NEW_EXPR, EnumSet.of(CursorKind.CXX_NEW_EXPR));
    public static final ExpressionExtractor DELETE =
            new ExpressionExtractor(NodeKind.DELETE_EXPR, EnumSet.of(CursorKind.CXX_DELETE_EXPR));
    public static final ExpressionExtractor THROW =
            new ExpressionExtractor(NodeKind.THROW_EXPR, EnumSet.of(CursorKind.CXX_THROW_EXPR));

    public static final List<ExpressionExtractor> ALL = List.of(CONDITIONAL, CAST, ITEM_ACCESS, THIS, NEW, DELETE, THROW);

    private final NodeKind nodeKind;

    private ExpressionExtractor(NodeKind nodeKind, EnumSet<CursorKind> kinds) {
        super(kinds);
        this.nodeKind = nodeKind;
    }

    @Override
    protected NodeKind kindOf(Cursor cursor) {
        return nodeKind;
    }

    @Override
    protected void extractInto(Cursor cursor, ExtractionContext context, AttributeMap attributes,
                               List<Dependency> children) {
        attributes.putIfPresent(AttributeKey.DATA_TYPE, cursor.getTypeSpelling());
        addExpressionChildren(ChildStages.of(cursor).rest(), context, children);
    }

    @Override
    public String toString() {
        return "ExpressionExtractor[" + nodeKind + "]";
    }
}
