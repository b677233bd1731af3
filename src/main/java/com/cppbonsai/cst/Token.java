package com.cppbonsai.cst;

import lombok.Value;

/**
 * A lexical token covered by a cursor's extent.
 */
@Value
public class Token {
    Kind kind;
    String spelling;

    public enum Kind {
        PUNCTUATION,
        KEYWORD,
        IDENTIFIER,
        LITERAL,
        COMMENT
    }

    public boolean isPunctuation() {
        return kind == Kind.PUNCTUATION;
    }

    public static Token punctuation(String spelling) {
        return new Token(Kind.PUNCTUATION, spelling);
    }

    public static Token keyword(String spelling) {
        return new Token(Kind.KEYWORD, spelling);
    }

    public static Token identifier(String spelling) {
        return new Token(Kind.IDENTIFIER, spelling);
    }

    public static Token literal(String spelling) {
        return new Token(Kind.LITERAL, spelling);
    }
}
