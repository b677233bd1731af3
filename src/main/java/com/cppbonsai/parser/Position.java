package com.cppbonsai.parser;

/**
 * Syntactic position a child cursor is met in. The same native kind may map to different
 * strategies, or be dropped, depending on where it appears.
 */
public enum Position {
    TOP_LEVEL,
    CLASS_MEMBER,
    STATEMENT,
    EXPRESSION
}
