package com.cppbonsai.cst;

/**
 * Access specifier property of a cursor, as the front end reports it.
 */
public enum CxxAccessSpecifier {
    INVALID,
    PUBLIC,
    PROTECTED,
    PRIVATE,
    NONE
}
