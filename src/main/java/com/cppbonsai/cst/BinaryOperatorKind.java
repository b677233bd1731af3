package com.cppbonsai.cst;

/**
 * Structured binary opcodes, available from newer front ends only.
 */
public enum BinaryOperatorKind {
    PTR_MEM_D(".*"),
    PTR_MEM_I("->*"),
    MUL("*"),
    DIV("/"),
    REM("%"),
    ADD("+"),
    SUB("-"),
    SHL("<<"),
    SHR(">>"),
    CMP("<=>"),
    LT("<"),
    GT(">"),
    LE("<="),
    GE(">="),
    EQ("=="),
    NE("!="),
    AND("&"),
    XOR("^"),
    OR("|"),
    LAND("&&"),
    LOR("||"),
    ASSIGN("="),
    MUL_ASSIGN("*="),
    DIV_ASSIGN("/="),
    REM_ASSIGN("%="),
    ADD_ASSIGN("+="),
    SUB_ASSIGN("-="),
    SHL_ASSIGN("<<="),
    SHR_ASSIGN(">>="),
    AND_ASSIGN("&="),
    XOR_ASSIGN("^="),
    OR_ASSIGN("|="),
    COMMA(",");

    private final String spelling;

    BinaryOperatorKind(String spelling) {
        this.spelling = spelling;
    }

    public String getSpelling() {
        return spelling;
    }
}
