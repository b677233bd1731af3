package com.cppbonsai.cst.fixture;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.cppbonsai.cst.BinaryOperatorKind;
import com.cppbonsai.cst.Cursor;
import com.cppbonsai.cst.CursorAccessException;
import com.cppbonsai.cst.CursorKind;
import com.cppbonsai.cst.CxxAccessSpecifier;
import com.cppbonsai.cst.FrontendDiagnostic;
import com.cppbonsai.cst.Token;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for FixtureLoader.
 */
class FixtureLoaderTest {

    private final FixtureLoader loader = new FixtureLoader();

    static Path resource(String name) {
        try {
            return Path.of(FixtureLoaderTest.class.getResource("/fixtures/" + name).toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    @Test
    void testLoadNamespaceFixture() {
        FixtureTranslationUnit unit = loader.load(resource("namespace_class.json"));

        assertThat(unit.getWorkspace()).isEqualTo(Path.of("/work"));
        Cursor root = unit.getCursor();
        assertThat(root.getKind()).isEqualTo(CursorKind.TRANSLATION_UNIT);
        assertThat(root.getChildren()).hasSize(2);

        Cursor printf = root.getChildren().get(0);
        assertThat(printf.getLocation()).hasValueSatisfying(l -> assertThat(l.getFile()).isEqualTo("/usr/include/stdio.h"));

        Cursor namespace = root.getChildren().get(1);
        assertThat(namespace.getLocation()).hasValueSatisfying(l -> {
            assertThat(l.getFile()).isEqualTo("/work/src/shapes.cpp");
            assertThat(l.getLine()).isEqualTo(1);
            assertThat(l.getColumn()).isEqualTo(11);
        });

        Cursor cls = namespace.getChildren().get(0);
        assertThat(cls.isDefinition()).isTrue();
        assertThat(cls.getChildren()).extracting(Cursor::getKind).containsExactly(
                CursorKind.CXX_BASE_SPECIFIER, CursorKind.FIELD_DECL, CursorKind.CXX_METHOD);
        Cursor method = cls.getChildren().get(2);
        assertThat(method.getAccessSpecifier()).isEqualTo(CxxAccessSpecifier.PRIVATE);
        assertThat(method.getDisplayName()).isEqualTo("f(int)");
        assertThat(method.getResultTypeSpelling()).isEqualTo("void");
    }

    @Test
    void testCrossLinksAndDiagnostics() {
        FixtureTranslationUnit unit = loader.load(resource("call_example.json"));

        assertThat(unit.getWorkspace()).isNull();
        assertThat(unit.getDiagnostics()).extracting(FrontendDiagnostic::getSeverity)
                .containsExactly(FrontendDiagnostic.Severity.WARNING, FrontendDiagnostic.Severity.ERROR);

        Cursor declaration = unit.getCursor().getChildren().get(0);
        Cursor definition = unit.getCursor().getChildren().get(1);
        assertThat(declaration.getDefinition()).containsSame(definition);

        Cursor call = unit.getCursor().getChildren().get(2)
                .getChildren().get(0)
                .getChildren().get(0)
                .getChildren().get(0);
        assertThat(call.getKind()).isEqualTo(CursorKind.CALL_EXPR);
        assertThat(call.getReferenced()).containsSame(declaration);
        assertThat(call.getArguments()).containsExactly(call.getChildren().get(1), call.getChildren().get(2));
        assertThatThrownBy(() -> call.getArguments().clear()).isInstanceOf(UnsupportedOperationException.class);
        assertThat(call.getTokens()).extracting(Token::getKind).containsExactly(
                Token.Kind.IDENTIFIER, Token.Kind.PUNCTUATION, Token.Kind.LITERAL,
                Token.Kind.PUNCTUATION, Token.Kind.LITERAL, Token.Kind.PUNCTUATION);
    }

    @Test
    void testCallArgumentsDefaultToChildrenAfterCallee() {
        FixtureTranslationUnit unit = loader.parse("""
                {"root": {"kind": "TRANSLATION_UNIT", "spelling": "a.cpp", "children": [
                  {"kind": "CALL_EXPR", "spelling": "g", "children": [
                    {"kind": "DECL_REF_EXPR", "spelling": "g"},
                    {"kind": "INTEGER_LITERAL", "tokens": ["7"]}
                  ]}
                ]}}
                """);

        Cursor call = unit.getCursor().getChildren().get(0);
        assertThat(call.getArguments()).containsExactly(call.getChildren().get(1));
    }

    @Test
    void testOperatorsLocationErrorsAndUnknownKinds() {
        FixtureTranslationUnit unit = loader.parse("""
                {"root": {"kind": "TRANSLATION_UNIT", "spelling": "a.cpp", "children": [
                  {"kind": "BINARY_OPERATOR", "operator": "add"},
                  {"kind": "VAR_DECL", "locationError": "invalid source location"},
                  {"kind": "VAR_DECL", "file": null},
                  {"kind": "OMP_PARALLEL_DIRECTIVE"}
                ]}}
                """);

        List<Cursor> children = unit.getCursor().getChildren();
        assertThat(children.get(0).getBinaryOperator()).contains(BinaryOperatorKind.ADD);
        assertThatThrownBy(() -> children.get(1).getLocation()).isInstanceOf(CursorAccessException.class);
        assertThat(children.get(2).getLocation()).isEmpty();
        assertThat(children.get(3).getKind()).isEqualTo(CursorKind.UNRECOGNIZED);
        assertThat(children.get(3).getKindName()).isEqualTo("OMP_PARALLEL_DIRECTIVE");
    }

    @Test
    void testUnknownLinkFails() {
        assertThatThrownBy(() -> loader.load(resource("broken_link.json")))
                .isInstanceOf(FixtureLoadException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void testRootMustBeTranslationUnit() {
        assertThatThrownBy(() -> loader.parse("{\"root\": {\"kind\": \"NAMESPACE\"}}"))
                .isInstanceOf(FixtureLoadException.class)
                .hasMessageContaining("TRANSLATION_UNIT");
    }

    @Test
    void testMalformedJsonFails(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("bad.json");
        Files.writeString(file, "{ not json");

        assertThatThrownBy(() -> loader.load(file)).isInstanceOf(FixtureLoadException.class);
        assertThatThrownBy(() -> loader.load(tempDir.resolve("absent.json"))).isInstanceOf(FixtureLoadException.class);
    }

    @Test
    void testTokenInference() {
        assertThat(FixtureLoader.inferToken("return").getKind()).isEqualTo(Token.Kind.KEYWORD);
        assertThat(FixtureLoader.inferToken("value").getKind()).isEqualTo(Token.Kind.IDENTIFIER);
        assertThat(FixtureLoader.inferToken("'c'").getKind()).isEqualTo(Token.Kind.LITERAL);
        assertThat(FixtureLoader.inferToken("<<=").getKind()).isEqualTo(Token.Kind.PUNCTUATION);
    }
}
