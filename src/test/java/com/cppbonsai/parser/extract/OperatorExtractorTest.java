package com.cppbonsai.parser.extract;

import org.junit.jupiter.api.Test;

import java.util.List;

import com.cppbonsai.ast.AttributeKey;
import com.cppbonsai.ast.AttributeMap;
import com.cppbonsai.ast.NodeKind;
import com.cppbonsai.cst.BinaryOperatorKind;
import com.cppbonsai.cst.CursorKind;
import com.cppbonsai.cst.Token;
import com.cppbonsai.cst.UnaryOperatorKind;
import com.cppbonsai.cst.fixture.FixtureCursor;
import com.cppbonsai.parser.BuildDiagnostics;
import com.cppbonsai.parser.Dispatcher;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for OperatorExtractor.
 */
class OperatorExtractorTest {

    private final ExtractionContext context = ExtractionContext.root(
            new Dispatcher(Extractors.standardTable()), new BuildDiagnostics(), null);

    @Test
    void testBinaryOpcodeWins() {
        FixtureCursor cursor = FixtureCursor.of(CursorKind.BINARY_OPERATOR)
                .binaryOperator(BinaryOperatorKind.LAND)
                .token(Token.identifier("a")).token(Token.punctuation("+")).token(Token.identifier("b"))
                .build();

        assertThat(OperatorExtractor.binaryOperator(cursor)).contains("&&");
    }

    @Test
    void testBinaryOperatorFromTokensSkipsLeftOperand() {
        FixtureCursor left = FixtureCursor.of(CursorKind.CALL_EXPR).spelling("g")
                .token(Token.identifier("g")).token(Token.punctuation("(")).token(Token.punctuation(")"))
                .build();
        FixtureCursor right = FixtureCursor.of(CursorKind.INTEGER_LITERAL).token(Token.literal("2")).build();
        FixtureCursor cursor = FixtureCursor.of(CursorKind.BINARY_OPERATOR)
                .child(left).child(right)
                .token(Token.identifier("g")).token(Token.punctuation("(")).token(Token.punctuation(")"))
                .token(Token.punctuation("*")).token(Token.literal("2"))
                .build();

        assertThat(OperatorExtractor.binaryOperator(cursor)).contains("*");
    }

    @Test
    void testBinaryOperatorWithoutTokens() {
        FixtureCursor cursor = FixtureCursor.of(CursorKind.BINARY_OPERATOR).build();

        assertThat(OperatorExtractor.binaryOperator(cursor)).isEmpty();
    }

    @Test
    void testUnaryPrefixAndPostfix() {
        FixtureCursor prefix = FixtureCursor.of(CursorKind.UNARY_OPERATOR)
                .token(Token.punctuation("-")).token(Token.identifier("x"))
                .build();
        FixtureCursor postfix = FixtureCursor.of(CursorKind.UNARY_OPERATOR)
                .token(Token.identifier("i")).token(Token.punctuation("++"))
                .build();
        FixtureCursor neither = FixtureCursor.of(CursorKind.UNARY_OPERATOR)
                .token(Token.keyword("sizeof")).token(Token.identifier("x"))
                .build();
        FixtureCursor opcode = FixtureCursor.of(CursorKind.UNARY_OPERATOR)
                .unaryOperator(UnaryOperatorKind.POST_DEC)
                .build();

        assertThat(OperatorExtractor.unaryOperator(prefix)).contains("-");
        assertThat(OperatorExtractor.unaryOperator(postfix)).contains("++");
        assertThat(OperatorExtractor.unaryOperator(neither)).isEmpty();
        assertThat(OperatorExtractor.unaryOperator(opcode)).contains("--");
    }

    @Test
    void testExtractWritesOperatorAndOperands() {
        FixtureCursor x = FixtureCursor.of(CursorKind.DECL_REF_EXPR).spelling("x").token(Token.identifier("x")).build();
        FixtureCursor one = FixtureCursor.of(CursorKind.INTEGER_LITERAL).token(Token.literal("1")).build();
        FixtureCursor cursor = FixtureCursor.of(CursorKind.COMPOUND_ASSIGNMENT_OPERATOR)
                .typeSpelling("int")
                .child(x).child(one)
                .token(Token.identifier("x")).token(Token.punctuation("+=")).token(Token.literal("1"))
                .build();
        AttributeMap attributes = new AttributeMap();

        List<Dependency> children = OperatorExtractor.INSTANCE.extract(cursor, context, attributes);

        assertThat(OperatorExtractor.INSTANCE.nodeKind(cursor)).isEqualTo(NodeKind.BINARY_OPERATOR);
        assertThat(attributes.getText(AttributeKey.NAME)).contains("+=");
        assertThat(attributes.getText(AttributeKey.DISPLAY_NAME)).contains("operator+=");
        assertThat(attributes.getText(AttributeKey.DATA_TYPE)).contains("int");
        assertThat(children).extracting(Dependency::getExtractor)
                .containsExactly(ReferenceExtractor.INSTANCE, LiteralExtractor.INSTANCE);
    }

    @Test
    void testUnknownOperatorLeavesNameUnset() {
        FixtureCursor cursor = FixtureCursor.of(CursorKind.UNARY_OPERATOR).build();
        AttributeMap attributes = new AttributeMap();

        OperatorExtractor.INSTANCE.extract(cursor, context, attributes);

        assertThat(OperatorExtractor.INSTANCE.nodeKind(cursor)).isEqualTo(NodeKind.UNARY_OPERATOR);
        assertThat(attributes.contains(AttributeKey.NAME)).isFalse();
    }
}
