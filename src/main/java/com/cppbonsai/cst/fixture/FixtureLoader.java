package com.cppbonsai.cst.fixture;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cppbonsai.cst.BinaryOperatorKind;
import com.cppbonsai.cst.Cursor;
import com.cppbonsai.cst.CursorKind;
import com.cppbonsai.cst.CursorLocation;
import com.cppbonsai.cst.CxxAccessSpecifier;
import com.cppbonsai.cst.FrontendDiagnostic;
import com.cppbonsai.cst.Token;
import com.cppbonsai.cst.UnaryOperatorKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads a recorded CST from JSON.
 *
 * <pre>
 * {
 *   "workspace": "/work",
 *   "diagnostics": [ { "severity": "ERROR", "spelling": "unknown type name 'Foo'" } ],
 *   "root": {
 *     "kind": "TRANSLATION_UNIT", "spelling": "/work/main.cpp",
 *     "children": [ { "id": "f", "kind": "FUNCTION_DECL", "spelling": "f", "line": 1, "column": 6 } ]
 *   }
 * }
 * </pre>
 *
 * A cursor without {@code file} inherits its parent's file; children of the translation unit
 * inherit its spelling. An explicit {@code "file": null} marks a cursor without a source file.
 * Cross links ({@code referencedId}, {@code definitionId}, {@code argumentIds}) name other cursors
 * by their {@code id}. Tokens are either objects with {@code kind} and {@code spelling} or bare
 * strings whose kind is inferred.
 */
public final class FixtureLoader {

    private static final Logger log = LoggerFactory.getLogger(FixtureLoader.class);

    private static final Set<String> KEYWORDS = Set.of(
            "auto", "bool", "break", "case", "catch", "char", "class", "const", "continue",
            "default", "delete", "do", "double", "else", "enum", "false", "float", "for", "if",
            "int", "long", "namespace", "new", "nullptr", "private", "protected", "public",
            "return", "short", "signed", "sizeof", "static", "struct", "switch", "this", "throw",
            "true", "try", "typedef", "union", "unsigned", "using", "virtual", "void", "while");

    private final ObjectMapper mapper = createMapper();

    public FixtureTranslationUnit load(Path file) {
        String json;
        try {
            json = Files.readString(file);
        } catch (IOException e) {
            throw new FixtureLoadException("Failed to read CST fixture " + file + ": " + e.getMessage(), e);
        }
        log.debug("Loading CST fixture {}", file);
        return parse(json);
    }

    public FixtureTranslationUnit parse(String json) {
        JsonNode document;
        try {
            document = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new FixtureLoadException("Failed to parse CST fixture: " + e.getOriginalMessage(), e);
        }
        if (document == null || !document.isObject()) {
            throw new FixtureLoadException("CST fixture must be a JSON object");
        }
        JsonNode rootNode = document.get("root");
        if (rootNode == null || !rootNode.isObject()) {
            throw new FixtureLoadException("CST fixture has no 'root' cursor");
        }

        Resolution resolution = new Resolution();
        FixtureCursor root = readCursor(rootNode, null, resolution, "root");
        if (root.getKind() != CursorKind.TRANSLATION_UNIT) {
            throw new FixtureLoadException("CST fixture root must be a TRANSLATION_UNIT, got " + root.getKindName());
        }
        resolution.link();

        FixtureTranslationUnit.FixtureTranslationUnitBuilder unit = FixtureTranslationUnit.builder().cursor(root);
        JsonNode workspace = document.get("workspace");
        if (workspace != null && workspace.isTextual() && !workspace.asText().isBlank()) {
            unit.workspace(Path.of(workspace.asText()));
        }
        JsonNode diagnostics = document.get("diagnostics");
        if (diagnostics != null) {
            for (JsonNode diagnostic : diagnostics) {
                unit.diagnostic(readDiagnostic(diagnostic));
            }
        }
        return unit.build();
    }

    private FixtureCursor readCursor(JsonNode node, String inheritedFile, Resolution resolution, String path) {
        CursorKind kind = readKind(node, path);
        FixtureCursor.FixtureCursorBuilder builder = FixtureCursor.builder()
                .kind(kind)
                .kindName(kind == CursorKind.UNRECOGNIZED ? text(node, "kind") : null)
                .spelling(text(node, "spelling"))
                .displayName(text(node, "displayName"))
                .typeSpelling(text(node, "type"))
                .resultTypeSpelling(text(node, "resultType"))
                .definition(node.path("definition").asBoolean(false))
                .usr(text(node, "usr"))
                .locationError(text(node, "locationError"));

        String access = text(node, "access");
        if (access != null) {
            builder.accessSpecifier(readEnum(CxxAccessSpecifier.class, access, path + ".access"));
        }

        String file = node.has("file") ? text(node, "file") : inheritedFile;
        if (node.has("line") || (file != null && kind != CursorKind.TRANSLATION_UNIT)) {
            builder.location(new CursorLocation(file, node.path("line").asInt(0), node.path("column").asInt(0)));
        }

        String operator = text(node, "operator");
        if (operator != null) {
            if (kind == CursorKind.UNARY_OPERATOR) {
                builder.unaryOperator(readEnum(UnaryOperatorKind.class, operator, path + ".operator"));
            } else {
                builder.binaryOperator(readEnum(BinaryOperatorKind.class, operator, path + ".operator"));
            }
        }

        for (JsonNode token : node.path("tokens")) {
            builder.token(readToken(token, path));
        }

        String childFile = file;
        if (kind == CursorKind.TRANSLATION_UNIT && !node.has("file")) {
            childFile = text(node, "spelling");
        }
        int index = 0;
        for (JsonNode child : node.path("children")) {
            builder.child(readCursor(child, childFile, resolution, path + ".children[" + index++ + "]"));
        }

        FixtureCursor cursor = builder.build();
        resolution.register(node, cursor, path);
        return cursor;
    }

    private static CursorKind readKind(JsonNode node, String path) {
        String name = text(node, "kind");
        if (name == null) {
            throw new FixtureLoadException("Cursor at " + path + " has no 'kind'");
        }
        CursorKind kind = CursorKind.fromName(name);
        if (kind == CursorKind.UNRECOGNIZED) {
            log.debug("Unknown cursor kind '{}' at {}", name, path);
        }
        return kind;
    }

    private static Token readToken(JsonNode token, String path) {
        if (token.isTextual()) {
            return inferToken(token.asText());
        }
        String spelling = text(token, "spelling");
        if (spelling == null) {
            throw new FixtureLoadException("Token at " + path + " has no 'spelling'");
        }
        String kind = text(token, "kind");
        return kind == null ? inferToken(spelling) : new Token(readEnum(Token.Kind.class, kind, path + ".tokens"), spelling);
    }

    static Token inferToken(String spelling) {
        if (spelling.isEmpty()) {
            return Token.punctuation(spelling);
        }
        char first = spelling.charAt(0);
        if (Character.isDigit(first) || first == '"' || first == '\'') {
            return Token.literal(spelling);
        }
        if (Character.isLetter(first) || first == '_') {
            return KEYWORDS.contains(spelling) ? Token.keyword(spelling) : Token.identifier(spelling);
        }
        return Token.punctuation(spelling);
    }

    private static FrontendDiagnostic readDiagnostic(JsonNode node) {
        String severity = text(node, "severity");
        return new FrontendDiagnostic(
                severity == null ? FrontendDiagnostic.Severity.WARNING
                        : readEnum(FrontendDiagnostic.Severity.class, severity, "diagnostics"),
                text(node, "spelling") == null ? "" : text(node, "spelling"));
    }

    private static <E extends Enum<E>> E readEnum(Class<E> type, String value, String path) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new FixtureLoadException("Invalid " + type.getSimpleName() + " '" + value + "' at " + path, e);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    /**
     * Creates the mapper used for fixture files.
     */
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Cursor ids and pending cross links, resolved once the whole tree is read.
     */
    private static final class Resolution {
        private final Map<String, FixtureCursor> byId = new HashMap<>();
        private final List<Runnable> links = new ArrayList<>();

        void register(JsonNode node, FixtureCursor cursor, String path) {
            String id = text(node, "id");
            if (id != null && byId.putIfAbsent(id, cursor) != null) {
                throw new FixtureLoadException("Duplicate cursor id '" + id + "' at " + path);
            }
            String referencedId = text(node, "referencedId");
            if (referencedId != null) {
                links.add(() -> cursor.linkReferenced(lookup(referencedId, path)));
            }
            String definitionId = text(node, "definitionId");
            if (definitionId != null) {
                links.add(() -> cursor.linkDefinition(lookup(definitionId, path)));
            }
            JsonNode argumentIds = node.get("argumentIds");
            if (argumentIds != null && argumentIds.isArray()) {
                List<String> ids = new ArrayList<>();
                argumentIds.forEach(a -> ids.add(a.asText()));
                links.add(() -> {
                    List<Cursor> arguments = new ArrayList<>();
                    for (String argumentId : ids) {
                        arguments.add(lookup(argumentId, path));
                    }
                    cursor.linkArguments(arguments);
                });
            }
        }

        void link() {
            links.forEach(Runnable::run);
        }

        private FixtureCursor lookup(String id, String path) {
            FixtureCursor target = byId.get(id);
            if (target == null) {
                throw new FixtureLoadException("Unknown cursor id '" + id + "' referenced at " + path);
            }
            return target;
        }
    }
}
