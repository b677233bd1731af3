package com.cppbonsai.parser.extract;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cppbonsai.ast.AttributeKey;
import com.cppbonsai.ast.AttributeMap;
import com.cppbonsai.ast.NodeKind;
import com.cppbonsai.cst.BinaryOperatorKind;
import com.cppbonsai.cst.Cursor;
import com.cppbonsai.cst.CursorKind;
import com.cppbonsai.cst.Token;
import com.cppbonsai.cst.UnaryOperatorKind;

/**
 * Unary and binary operators.
 *
 * The operator comes from the structured opcode when the front end has one. Otherwise it is read
 * from the token stream: for a binary operator the first punctuation token after the left
 * operand's tokens, for a unary operator the leading or trailing operator token.
 */
public final class OperatorExtractor extends AbstractExtractor {

    private static final Logger log = LoggerFactory.getLogger(OperatorExtractor.class);

    private static final Set<String> UNARY_OPERATORS = Set.of("++", "--", "&", "*", "+", "-", "~", "!");

    public static final OperatorExtractor INSTANCE = new OperatorExtractor();

    private OperatorExtractor() {
        super(CursorKind.BINARY_OPERATOR, CursorKind.COMPOUND_ASSIGNMENT_OPERATOR, CursorKind.UNARY_OPERATOR);
    }

    @Override
    protected NodeKind kindOf(Cursor cursor) {
        return cursor.getKind() == CursorKind.UNARY_OPERATOR ? NodeKind.UNARY_OPERATOR : NodeKind.BINARY_OPERATOR;
    }

    @Override
    protected void extractInto(Cursor cursor, ExtractionContext context, AttributeMap attributes,
                               List<Dependency> children) {
        Optional<String> operator = cursor.getKind() == CursorKind.UNARY_OPERATOR
                ? unaryOperator(cursor)
                : binaryOperator(cursor);
        if (operator.isPresent()) {
            attributes.put(AttributeKey.NAME, operator.get());
            attributes.put(AttributeKey.DISPLAY_NAME, "operator" + operator.get());
        } else {
            log.debug("Could not determine operator of {} at {}", cursor.getKindName(), location(cursor));
        }
        attributes.putIfPresent(AttributeKey.DATA_TYPE, cursor.getTypeSpelling());
        addExpressionChildren(ChildStages.of(cursor).rest(), context, children);
    }

    static Optional<String> binaryOperator(Cursor cursor) {
        Optional<BinaryOperatorKind> opcode = cursor.getBinaryOperator();
        if (opcode.isPresent()) {
            return Optional.of(opcode.get().getSpelling());
        }
        List<Token> tokens = cursor.getTokens();
        int skip = cursor.getChildren().isEmpty() ? 0 : cursor.getChildren().get(0).getTokens().size();
        for (int i = skip; i < tokens.size(); i++) {
            if (tokens.get(i).isPunctuation()) {
                return Optional.of(tokens.get(i).getSpelling());
            }
        }
        return Optional.empty();
    }

    static Optional<String> unaryOperator(Cursor cursor) {
        Optional<UnaryOperatorKind> opcode = cursor.getUnaryOperator();
        if (opcode.isPresent()) {
            return Optional.of(opcode.get().getSpelling());
        }
        List<Token> tokens = cursor.getTokens();
        if (tokens.isEmpty()) {
            return Optional.empty();
        }
        Token first = tokens.get(0);
        if (isUnaryOperator(first)) {
            return Optional.of(first.getSpelling());
        }
        Token last = tokens.get(tokens.size() - 1);
        if (isUnaryOperator(last)) {
            return Optional.of(last.getSpelling());
        }
        return Optional.empty();
    }

    private static boolean isUnaryOperator(Token token) {
        return token.isPunctuation() && UNARY_OPERATORS.contains(token.getSpelling());
    }
}
