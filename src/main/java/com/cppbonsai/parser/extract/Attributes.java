package com.cppbonsai.parser.extract;

import com.cppbonsai.cst.Cursor;
import com.cppbonsai.cst.Cursors;

/**
 * Labels written into CUSTOM_ATTRIBUTES.
 */
final class Attributes {

    private Attributes() {
        // Utility class
    }

    /**
     * The attribute's spelling ({@code annotate} text, visibility value), or a fixed label for
     * attributes the front end leaves unspelled.
     */
    static String label(Cursor attribute) {
        if (!Cursors.isBlank(attribute.getSpelling())) {
            return attribute.getSpelling();
        }
        return switch (attribute.getKind()) {
            case CXX_FINAL_ATTR -> "final";
            case CXX_OVERRIDE_ATTR -> "override";
            case WARN_UNUSED_RESULT_ATTR -> "nodiscard";
            case ALIGNED_ATTR -> "aligned";
            case VISIBILITY_ATTR -> "visibility";
            case ANNOTATE_ATTR -> "annotate";
            default -> attribute.getKindName().toLowerCase();
        };
    }
}
