package com.cppbonsai.parser.extract;

import java.util.Set;

import com.cppbonsai.cst.CursorKind;

/**
 * A strategy was handed a cursor of a kind it does not accept. This is a wiring error in the
 * dispatch table and aborts the build.
 */
public class InvalidCursorKindException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String kindName;

    public InvalidCursorKindException(String extractor, String kindName, Set<CursorKind> accepted) {
        super(extractor + " cannot handle cursor kind " + kindName + "; accepted kinds: " + accepted);
        this.kindName = kindName;
    }

    public String getKindName() {
        return kindName;
    }
}
