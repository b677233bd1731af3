package com.cppbonsai.parser.extract;

import java.util.List;

import com.cppbonsai.ast.AttributeMap;
import com.cppbonsai.ast.NodeKind;
import com.cppbonsai.cst.Cursor;
import com.cppbonsai.cst.CursorKind;
import com.cppbonsai.parser.Position;

/**
 * Control-flow and block statements. Each instance maps one native statement kind and decides,
 * per child slot, whether the child is read as a statement or an expression.
 */
public final class StatementExtractor extends AbstractExtractor {

    /**
     * Position of the child at {@code index} among {@code count} children.
     */
    @FunctionalInterface
    interface ChildLayout {
        Position positionOf(Cursor child, int index, int count);
    }

    private static final ChildLayout ALL_STATEMENTS = (child, index, count) -> Position.STATEMENT;
    private static final ChildLayout ALL_EXPRESSIONS = (child, index, count) -> Position.EXPRESSION;
    private static final ChildLayout CONDITION_FIRST =
            (child, index, count) -> index == 0 ? Position.EXPRESSION : Position.STATEMENT;
    private static final ChildLayout CONDITION_LAST =
            (child, index, count) -> index == count - 1 ? Position.EXPRESSION : Position.STATEMENT;
    private static final ChildLayout LOOP_HEADER = (child, index, count) -> {
        if (index == count - 1) {
            return Position.STATEMENT;
        }
        return child.getKind().isExpression() ? Position.EXPRESSION : Position.STATEMENT;
    };

    public static final StatementExtractor COMPOUND =
            new StatementExtractor(CursorKind.COMPOUND_STMT, NodeKind.COMPOUND_STMT, ALL_STATEMENTS);
    public static final StatementExtractor DECLARATION =
            new StatementExtractor(CursorKind.DECL_STMT, NodeKind.DECLARATION_STMT, ALL_STATEMENTS);
    public static final StatementExtractor RETURN =
            new StatementExtractor(CursorKind.RETURN_STMT, NodeKind.RETURN_STMT, ALL_EXPRESSIONS);
    public static final StatementExtractor IF =
            new StatementExtractor(CursorKind.IF_STMT, NodeKind.IF_STMT, CONDITION_FIRST);
    public static final StatementExtractor WHILE =
            new StatementExtractor(CursorKind.WHILE_STMT, NodeKind.WHILE_STMT, CONDITION_FIRST);
    public static final StatementExtractor DO =
            new StatementExtractor(CursorKind.DO_STMT, NodeKind.DO_STMT, CONDITION_LAST);
    public static final StatementExtractor FOR =
            new StatementExtractor(CursorKind.FOR_STMT, NodeKind.FOR_STMT, LOOP_HEADER);
    public static final StatementExtractor FOR_RANGE =
            new StatementExtractor(CursorKind.CXX_FOR_RANGE_STMT, NodeKind.FOR_RANGE_STMT, LOOP_HEADER);
    public static final StatementExtractor SWITCH =
            new StatementExtractor(CursorKind.SWITCH_STMT, NodeKind.SWITCH_STMT, CONDITION_FIRST);
    public static final StatementExtractor CASE =
            new StatementExtractor(CursorKind.CASE_STMT, NodeKind.SWITCH_CASE, CONDITION_FIRST);
    public static final StatementExtractor DEFAULT =
            new StatementExtractor(CursorKind.DEFAULT_STMT, NodeKind.SWITCH_DEFAULT, ALL_STATEMENTS);
    public static final StatementExtractor BREAK =
            new StatementExtractor(CursorKind.BREAK_STMT, NodeKind.BREAK_STMT, ALL_STATEMENTS);
    public static final StatementExtractor CONTINUE =
            new StatementExtractor(CursorKind.CONTINUE_STMT, NodeKind.CONTINUE_STMT, ALL_STATEMENTS);
    public static final StatementExtractor NULL =
            new StatementExtractor(CursorKind.NULL_STMT, NodeKind.NULL_STMT, ALL_STATEMENTS);
    public static final StatementExtractor TRY =
            new StatementExtractor(CursorKind.CXX_TRY_STMT, NodeKind.TRY_STMT, ALL_STATEMENTS);
    public static final StatementExtractor CATCH =
            new StatementExtractor(CursorKind.CXX_CATCH_STMT, NodeKind.CATCH_CLAUSE, ALL_STATEMENTS);

    public static final List<StatementExtractor> ALL = List.of(COMPOUND, DECLARATION, RETURN, IF, WHILE, DO,
            FOR, FOR_RANGE, SWITCH, CASE, DEFAULT, BREAK, CONTINUE, NULL, TRY, CATCH);

    private final NodeKind nodeKind;
    private final ChildLayout layout;

    private StatementExtractor(CursorKind cursorKind, NodeKind nodeKind, ChildLayout layout) {
        super(cursorKind);
        this.nodeKind = nodeKind;
        this.layout = layout;
    }

    @Override
    protected NodeKind kindOf(Cursor cursor) {
        return nodeKind;
    }

    @Override
    protected void extractInto(Cursor cursor, ExtractionContext context, AttributeMap attributes,
                               List<Dependency> children) {
        List<Cursor> statementChildren = ChildStages.of(cursor).rest();
        int count = statementChildren.size();
        for (int i = 0; i < count; i++) {
            Cursor child = statementChildren.get(i);
            context.child(child, layout.positionOf(child, i, count)).ifPresent(children::add);
        }
    }

    @Override
    public String toString() {
        return "StatementExtractor[" + nodeKind + "]";
    }
}
