package com.cppbonsai.parser;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.LongStream;

import com.cppbonsai.ast.Ast;
import com.cppbonsai.ast.AstNode;
import com.cppbonsai.ast.AstPrinter;
import com.cppbonsai.cst.Cursor;
import com.cppbonsai.cst.CursorKind;
import com.cppbonsai.cst.Token;
import com.cppbonsai.cst.fixture.FixtureCursor;
import com.cppbonsai.cst.fixture.SampleCursors;

import static org.assertj.core.api.Assertions.*;

/**
 * Structural properties of trees built from randomly generated CSTs.
 */
class AstInvariantsTest {

    private static final List<CursorKind> KINDS = List.of(
            CursorKind.NAMESPACE, CursorKind.CLASS_DECL, CursorKind.STRUCT_DECL, CursorKind.FUNCTION_DECL,
            CursorKind.CXX_METHOD, CursorKind.CONSTRUCTOR, CursorKind.DESTRUCTOR, CursorKind.FIELD_DECL,
            CursorKind.VAR_DECL, CursorKind.PARM_DECL, CursorKind.TYPEDEF_DECL, CursorKind.CXX_BASE_SPECIFIER,
            CursorKind.TYPE_REF, CursorKind.NAMESPACE_REF, CursorKind.MEMBER_REF, CursorKind.CXX_FINAL_ATTR,
            CursorKind.COMPOUND_STMT, CursorKind.DECL_STMT, CursorKind.RETURN_STMT, CursorKind.IF_STMT,
            CursorKind.FOR_STMT, CursorKind.SWITCH_STMT, CursorKind.CASE_STMT, CursorKind.LABEL_STMT,
            CursorKind.UNEXPOSED_EXPR, CursorKind.PAREN_EXPR, CursorKind.DECL_REF_EXPR, CursorKind.CALL_EXPR,
            CursorKind.INTEGER_LITERAL, CursorKind.BINARY_OPERATOR, CursorKind.UNARY_OPERATOR,
            CursorKind.CSTYLE_CAST_EXPR, CursorKind.CXX_THIS_EXPR, CursorKind.UNRECOGNIZED);

    private static final int MAX_DEPTH = 5;

    static LongStream seeds() {
        return LongStream.range(0, 40);
    }

    @ParameterizedTest
    @MethodSource("seeds")
    void testStructuralInvariants(long seed) {
        Cursor root = randomUnit(new Random(seed));

        Ast ast = new AstBuilder().build(root, Path.of("/work"));

        AstNode file = ast.getRoot();
        assertThat(file.getId()).isZero();
        assertThat(file.getParent()).isZero();
        for (AstNode node : ast.getNodes()) {
            assertThat(node.getAttributes().isSealed()).isTrue();
            assertThat(node.getLocation()).isNotNull();
            if (!node.isRoot()) {
                assertThat(ast.contains(node.getParent())).as("parent of #%d", node.getId()).isTrue();
                assertThat(ast.getNode(node.getParent()).getChildren()).contains(node.getId());
            }
            for (int child : node.getChildren()) {
                assertThat(child).isGreaterThan(node.getId());
                assertThat(ast.getNode(child).getParent()).isEqualTo(node.getId());
            }
        }

        Set<Integer> reached = new HashSet<>();
        for (AstNode node : ast.traverse()) {
            assertThat(reached.add(node.getId())).as("#%d reached twice", node.getId()).isTrue();
        }
        assertThat(reached).hasSize(ast.size());
    }

    @ParameterizedTest
    @MethodSource("seeds")
    void testBuildIsDeterministic(long seed) {
        Cursor root = randomUnit(new Random(seed));
        AstBuilder builder = new AstBuilder();

        String first = AstPrinter.render(builder.build(root, Path.of("/work")));
        String second = AstPrinter.render(builder.build(root, Path.of("/work")));

        assertThat(second).isEqualTo(first);
    }

    private static Cursor randomUnit(Random random) {
        int count = random.nextInt(4);
        Cursor[] topLevel = new Cursor[count];
        for (int i = 0; i < count; i++) {
            topLevel[i] = randomCursor(random, 1);
        }
        return SampleCursors.translationUnit(topLevel);
    }

    private static Cursor randomCursor(Random random, int depth) {
        CursorKind kind = KINDS.get(random.nextInt(KINDS.size()));
        FixtureCursor.FixtureCursorBuilder cursor = FixtureCursor.of(kind)
                .spelling("n" + random.nextInt(5))
                .typeSpelling(random.nextBoolean() ? "int" : "")
                .definition(random.nextBoolean())
                .location(FixtureCursor.at(SampleCursors.FILE, depth, random.nextInt(80) + 1));
        if (kind == CursorKind.INTEGER_LITERAL) {
            cursor.token(Token.literal(String.valueOf(random.nextInt(100))));
        }
        if (kind == CursorKind.BINARY_OPERATOR || kind == CursorKind.UNARY_OPERATOR) {
            cursor.token(Token.punctuation(random.nextBoolean() ? "+" : "-"));
        }
        if (depth < MAX_DEPTH) {
            int children = random.nextInt(4);
            for (int i = 0; i < children; i++) {
                cursor.child(randomCursor(random, depth + 1));
            }
        }
        return cursor.build();
    }
}
