package com.cppbonsai.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.cppbonsai.cst.CursorKind;
import com.cppbonsai.parser.DispatchTable.Outcome;
import com.cppbonsai.parser.extract.CallExtractor;
import com.cppbonsai.parser.extract.ClassExtractor;
import com.cppbonsai.parser.extract.ExpressionStatementExtractor;
import com.cppbonsai.parser.extract.Extractors;
import com.cppbonsai.parser.extract.FunctionExtractor;
import com.cppbonsai.parser.extract.OperatorExtractor;
import com.cppbonsai.parser.extract.StatementExtractor;
import com.cppbonsai.parser.extract.VariableExtractor;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DispatchTable and the built-in table.
 */
class DispatchTableTest {

    private final DispatchTable table = Extractors.standardTable();

    @ParameterizedTest
    @EnumSource(value = CursorKind.class, mode = EnumSource.Mode.EXCLUDE, names = "UNRECOGNIZED")
    void testEveryKnownKindIsDecidedSomewhere(CursorKind kind) {
        boolean decided = false;
        for (Position position : Position.values()) {
            decided |= table.decide(kind, position).getOutcome() != Outcome.UNDECIDED;
        }
        assertThat(decided).as("%s has no rule in any position", kind).isTrue();
    }

    @ParameterizedTest
    @EnumSource(Position.class)
    void testUnrecognizedIsUndecided(Position position) {
        assertThat(table.decide(CursorKind.UNRECOGNIZED, position)).isSameAs(DispatchTable.Decision.UNDECIDED);
    }

    @Test
    void testDeclarationPositions() {
        assertThat(table.decide(CursorKind.FUNCTION_DECL, Position.TOP_LEVEL).getExtractor())
                .isSameAs(FunctionExtractor.FUNCTION);
        assertThat(table.decide(CursorKind.FUNCTION_DECL, Position.STATEMENT).getOutcome())
                .isEqualTo(Outcome.UNDECIDED);
        assertThat(table.decide(CursorKind.CXX_METHOD, Position.CLASS_MEMBER).getExtractor())
                .isSameAs(FunctionExtractor.METHOD);
        assertThat(table.decide(CursorKind.CONSTRUCTOR, Position.TOP_LEVEL).getExtractor())
                .isSameAs(FunctionExtractor.CONSTRUCTOR);
        assertThat(table.decide(CursorKind.CONSTRUCTOR, Position.CLASS_MEMBER).getOutcome())
                .isEqualTo(Outcome.DROP);
        assertThat(table.decide(CursorKind.STRUCT_DECL, Position.STATEMENT).getExtractor())
                .isSameAs(ClassExtractor.INSTANCE);
        assertThat(table.decide(CursorKind.VAR_DECL, Position.EXPRESSION).getExtractor())
                .isSameAs(VariableExtractor.INSTANCE);
        assertThat(table.decide(CursorKind.DESTRUCTOR, Position.CLASS_MEMBER).getOutcome())
                .isEqualTo(Outcome.DROP);
        assertThat(table.decide(CursorKind.PARM_DECL, Position.TOP_LEVEL).getOutcome())
                .isEqualTo(Outcome.DROP);
    }

    @Test
    void testExpressionDependsOnPosition() {
        assertThat(table.decide(CursorKind.CALL_EXPR, Position.EXPRESSION).getExtractor())
                .isSameAs(CallExtractor.INSTANCE);
        assertThat(table.decide(CursorKind.CALL_EXPR, Position.STATEMENT).getExtractor())
                .isSameAs(ExpressionStatementExtractor.INSTANCE);
        assertThat(table.decide(CursorKind.BINARY_OPERATOR, Position.STATEMENT).getExtractor())
                .isSameAs(ExpressionStatementExtractor.INSTANCE);
        assertThat(table.decide(CursorKind.COMPOUND_ASSIGNMENT_OPERATOR, Position.EXPRESSION).getExtractor())
                .isSameAs(OperatorExtractor.INSTANCE);
    }

    @Test
    void testWrappersAndReferencesAreDropped() {
        for (Position position : Position.values()) {
            assertThat(table.decide(CursorKind.UNEXPOSED_EXPR, position).getOutcome()).isEqualTo(Outcome.DROP);
            assertThat(table.decide(CursorKind.TYPE_REF, position).getOutcome()).isEqualTo(Outcome.DROP);
            assertThat(table.decide(CursorKind.CXX_OVERRIDE_ATTR, position).getOutcome()).isEqualTo(Outcome.DROP);
        }
    }

    @Test
    void testFirstMatchingRuleWins() {
        DispatchTable custom = DispatchTable.builder()
                .drop(CursorKind.RETURN_STMT, Position.STATEMENT)
                .map(StatementExtractor.RETURN, Position.STATEMENT)
                .map(StatementExtractor.IF)
                .build();

        assertThat(custom.decide(CursorKind.RETURN_STMT, Position.STATEMENT).getOutcome()).isEqualTo(Outcome.DROP);
        assertThat(custom.decide(CursorKind.IF_STMT, Position.EXPRESSION).getExtractor())
                .isSameAs(StatementExtractor.IF);
        assertThat(custom.decide(CursorKind.WHILE_STMT, Position.STATEMENT).getOutcome())
                .isEqualTo(Outcome.UNDECIDED);
        assertThat(custom.getRules()).hasSize(3);
    }

    @Test
    void testMapRejectsKindsTheExtractorDoesNotAccept() {
        assertThatThrownBy(() -> DispatchRule.map(java.util.Set.of(CursorKind.WHILE_STMT), StatementExtractor.IF))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
