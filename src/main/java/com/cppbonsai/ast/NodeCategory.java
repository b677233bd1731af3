package com.cppbonsai.ast;

/**
 * Coarse classification of normalized node kinds. Every {@link NodeKind} belongs to exactly one.
 */
public enum NodeCategory {
    DECLARATION,
    DEFINITION,
    STATEMENT,
    EXPRESSION,
    HELPER
}
