package com.cppbonsai.ast;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.EnumSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Checks every node kind against every classification predicate.
 */
class NodeKindTest {

    private static final Set<NodeKind> FUNCTIONS = EnumSet.of(
            NodeKind.FUNCTION_DECL, NodeKind.FUNCTION_DEF, NodeKind.METHOD_DECL, NodeKind.METHOD_DEF,
            NodeKind.CONSTRUCTOR_DECL, NodeKind.CONSTRUCTOR_DEF);
    private static final Set<NodeKind> CLASSES = EnumSet.of(NodeKind.CLASS_DECL, NodeKind.CLASS_DEF);
    private static final Set<NodeKind> REFERENCES = EnumSet.of(
            NodeKind.REFERENCE, NodeKind.MEMBER_REFERENCE, NodeKind.FUNCTION_CALL);
    private static final Set<NodeKind> OPERATORS = EnumSet.of(
            NodeKind.BINARY_OPERATOR, NodeKind.UNARY_OPERATOR, NodeKind.CONDITIONAL_EXPR);
    private static final Set<NodeKind> SCOPES = EnumSet.of(NodeKind.NAMESPACE, NodeKind.CLASS_DEF);
    private static final Set<NodeKind> DEFINITIONS = EnumSet.of(
            NodeKind.CLASS_DEF, NodeKind.FUNCTION_DEF, NodeKind.METHOD_DEF, NodeKind.CONSTRUCTOR_DEF);
    private static final Set<NodeKind> HELPERS = EnumSet.of(NodeKind.FILE,
            NodeKind.MEMBER_INITIALIZER, NodeKind.SWITCH_CASE, NodeKind.SWITCH_DEFAULT, NodeKind.CATCH_CLAUSE);

    @ParameterizedTest
    @EnumSource(NodeKind.class)
    void testCrossCuttingPredicates(NodeKind kind) {
        assertThat(kind.isFunction()).as("isFunction(%s)", kind).isEqualTo(FUNCTIONS.contains(kind));
        assertThat(kind.isClass()).as("isClass(%s)", kind).isEqualTo(CLASSES.contains(kind));
        assertThat(kind.isReference()).as("isReference(%s)", kind).isEqualTo(REFERENCES.contains(kind));
        assertThat(kind.isOperator()).as("isOperator(%s)", kind).isEqualTo(OPERATORS.contains(kind));
        assertThat(kind.isScope()).as("isScope(%s)", kind).isEqualTo(SCOPES.contains(kind));
        assertThat(kind.isFile()).as("isFile(%s)", kind).isEqualTo(kind == NodeKind.FILE);
    }

    @ParameterizedTest
    @EnumSource(NodeKind.class)
    void testExactlyOneCategory(NodeKind kind) {
        int matches = 0;
        matches += kind.isDeclaration() ? 1 : 0;
        matches += kind.isDefinition() ? 1 : 0;
        matches += kind.isStatement() ? 1 : 0;
        matches += kind.isExpression() ? 1 : 0;
        matches += kind.isHelper() ? 1 : 0;
        assertThat(matches).as("categories of %s", kind).isEqualTo(1);
    }

    @ParameterizedTest
    @EnumSource(NodeKind.class)
    void testCategoryAssignment(NodeKind kind) {
        assertThat(kind.isDefinition()).isEqualTo(DEFINITIONS.contains(kind));
        assertThat(kind.isHelper()).isEqualTo(HELPERS.contains(kind));
        assertThat(kind.isStatement()).isEqualTo(kind.name().endsWith("_STMT"));
    }

    @Test
    void testConstructorDefinitionIsBothDefinitionAndFunction() {
        assertThat(NodeKind.CONSTRUCTOR_DEF.isDefinition()).isTrue();
        assertThat(NodeKind.CONSTRUCTOR_DEF.isFunction()).isTrue();
        assertThat(NodeKind.CONSTRUCTOR_DEF.isDeclaration()).isFalse();
    }

    @Test
    void testNamespaceIsDeclarationAndFileIsHelper() {
        assertThat(NodeKind.NAMESPACE.getCategory()).isEqualTo(NodeCategory.DECLARATION);
        assertThat(NodeKind.FILE.getCategory()).isEqualTo(NodeCategory.HELPER);
    }
}
