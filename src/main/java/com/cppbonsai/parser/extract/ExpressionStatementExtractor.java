package com.cppbonsai.parser.extract;

import java.util.EnumSet;
import java.util.List;

import com.cppbonsai.ast.AttributeMap;
import com.cppbonsai.ast.NodeKind;
import com.cppbonsai.cst.Cursor;
import com.cppbonsai.cst.CursorKind;
import com.cppbonsai.parser.Position;

/**
 * An expression used as a statement. The node wraps the same cursor, re-dispatched in expression
 * position.
 */
public final class ExpressionStatementExtractor extends AbstractExtractor {

    public static final ExpressionStatementExtractor INSTANCE = new ExpressionStatementExtractor();

    private ExpressionStatementExtractor() {
        super(expressionKinds());
    }

    private static EnumSet<CursorKind> expressionKinds() {
        EnumSet<CursorKind> kinds = EnumSet.noneOf(CursorKind.class);
        for (CursorKind kind : CursorKind.values()) {
            if (kind.isExpression()) {
                kinds.add(kind);
            }
        }
        return kinds;
    }

    @Override
    protected NodeKind kindOf(Cursor cursor) {
        return NodeKind.EXPRESSION_STMT;
    }

    @Override
    protected void extractInto(Cursor cursor, ExtractionContext context, AttributeMap attributes,
                               List<Dependency> children) {
        context.child(cursor, Position.EXPRESSION).ifPresent(children::add);
    }
}
