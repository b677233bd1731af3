package com.cppbonsai.cst;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Helpers over {@link Cursor} that paper over front-end quirks.
 */
public final class Cursors {

    private static final Logger log = LoggerFactory.getLogger(Cursors.class);

    private Cursors() {
        // Utility class
    }

    /**
     * Location of the cursor, or empty when the front end has none or fails to compute it.
     */
    public static Optional<CursorLocation> safeLocation(Cursor cursor) {
        try {
            Optional<CursorLocation> location = cursor.getLocation();
            return location != null ? location.filter(CursorLocation::hasFile) : Optional.empty();
        } catch (CursorAccessException e) {
            log.debug("Unable to extract location from cursor {} '{}': {}",
                    cursor.getKindName(), cursor.getSpelling(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Strips implicit wrappers: an {@link CursorKind#UNEXPOSED_EXPR} or {@link CursorKind#PAREN_EXPR}
     * with exactly one child stands for that child. Applied repeatedly.
     */
    public static Cursor unwrap(Cursor cursor) {
        Cursor current = cursor;
        while (isTransparent(current)) {
            current = current.getChildren().get(0);
        }
        return current;
    }

    public static boolean isTransparent(Cursor cursor) {
        CursorKind kind = cursor.getKind();
        if (kind != CursorKind.UNEXPOSED_EXPR && kind != CursorKind.PAREN_EXPR) {
            return false;
        }
        return cursor.getChildren().size() == 1;
    }

    /**
     * Identity comparison after unwrapping implicit wrappers on both sides.
     */
    public static boolean sameConstruct(Cursor a, Cursor b) {
        return a.equals(b) || unwrap(a).equals(unwrap(b));
    }

    /**
     * Bare name of a referenced type or namespace: {@code "class N::C"} becomes {@code "C"}.
     * Uses the referenced declaration's spelling when the front end can resolve it.
     */
    public static String referencedName(Cursor reference) {
        Optional<Cursor> referenced = reference.getReferenced();
        if (referenced.isPresent() && !isBlank(referenced.get().getSpelling())) {
            return referenced.get().getSpelling();
        }
        String spelling = stripTypeKeyword(reference.getSpelling());
        int sep = spelling.lastIndexOf("::");
        return sep >= 0 ? spelling.substring(sep + 2) : spelling;
    }

    /**
     * Removes an elaborated-type keyword ({@code class}, {@code struct}, {@code union},
     * {@code enum}) from a type spelling.
     */
    public static String stripTypeKeyword(String spelling) {
        if (spelling == null) {
            return "";
        }
        String text = spelling.trim();
        for (String keyword : List.of("class ", "struct ", "union ", "enum ")) {
            if (text.startsWith(keyword)) {
                return text.substring(keyword.length()).trim();
            }
        }
        return text;
    }

    public static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
