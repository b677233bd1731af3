package com.cppbonsai.ast;

/**
 * C++ member access as written on class members.
 */
public enum AccessSpecifier {
    PUBLIC,
    PROTECTED,
    PRIVATE;

    public String label() {
        return name().toLowerCase();
    }
}
