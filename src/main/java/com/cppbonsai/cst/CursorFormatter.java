package com.cppbonsai.cst;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Human readable rendering of cursors for debug logs and the {@code --print} option.
 */
public final class CursorFormatter {

    private static final String INDENT = "| ";

    private CursorFormatter() {
        // Utility class
    }

    public static String format(Cursor cursor) {
        return format(cursor, 0, false);
    }

    /**
     * {@code [line:col] KIND: spelling [n tokens]}; verbose output adds the symbol reference, the
     * access specifier and, for short cursors, the tokens themselves.
     */
    public static String format(Cursor cursor, int indent, boolean verbose) {
        Optional<CursorLocation> location = Cursors.safeLocation(cursor);
        int line = location.map(CursorLocation::getLine).orElse(0);
        int column = location.map(CursorLocation::getColumn).orElse(0);

        List<String> items = new ArrayList<>();
        items.add(INDENT.repeat(indent) + "[" + line + ":" + column + "]");
        if (verbose) {
            items.add("[" + cursor.getUsr() + "]");
            items.add("(" + cursor.getAccessSpecifier() + ")");
        }
        items.add(cursor.getKindName() + ":");
        String spelling = cursor.getSpelling();
        items.add(spelling == null || spelling.isEmpty() ? "[no spelling]" : spelling);

        List<Token> tokens = cursor.getTokens();
        items.add("[" + tokens.size() + " tokens]");
        if (verbose && tokens.size() < 5) {
            items.add(tokens.stream()
                    .map(t -> "(" + t.getSpelling() + ", " + t.getKind() + ")")
                    .toList()
                    .toString());
        }
        return String.join(" ", items);
    }

    /**
     * Renders the whole CST under a translation unit, one cursor per line, skipping top-level
     * cursors outside {@code workspace}.
     */
    public static String dump(Cursor translationUnit, Path workspace, boolean verbose) {
        if (translationUnit.getKind() != CursorKind.TRANSLATION_UNIT) {
            throw new IllegalArgumentException("Expected TRANSLATION_UNIT, got " + translationUnit.getKindName());
        }

        Deque<Cursor> stack = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        List<Cursor> topLevel = translationUnit.getChildren().stream()
                .filter(c -> WorkspaceFilter.accepts(c, workspace))
                .toList();
        for (int i = topLevel.size() - 1; i >= 0; i--) {
            stack.push(topLevel.get(i));
            depths.push(0);
        }

        List<String> lines = new ArrayList<>();
        while (!stack.isEmpty()) {
            Cursor cursor = stack.pop();
            int depth = depths.pop();
            lines.add(format(cursor, depth, verbose));
            List<Cursor> children = cursor.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
                depths.push(depth + 1);
            }
        }
        return String.join(System.lineSeparator(), lines);
    }
}
