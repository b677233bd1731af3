package com.cppbonsai.parser.extract;

import com.cppbonsai.ast.NodeKind;
import com.cppbonsai.cst.CursorKind;

/**
 * Differences between free functions, methods and constructors, plugged into
 * {@link FunctionExtractor}.
 */
public enum FunctionFlavor {
    FUNCTION(CursorKind.FUNCTION_DECL, NodeKind.FUNCTION_DECL, NodeKind.FUNCTION_DEF, true, false, false),
    METHOD(CursorKind.CXX_METHOD, NodeKind.METHOD_DECL, NodeKind.METHOD_DEF, true, true, false),
    CONSTRUCTOR(CursorKind.CONSTRUCTOR, NodeKind.CONSTRUCTOR_DECL, NodeKind.CONSTRUCTOR_DEF, false, true, true);

    private final CursorKind cursorKind;
    private final NodeKind declarationKind;
    private final NodeKind definitionKind;
    private final boolean returnType;
    private final boolean access;
    private final boolean memberInitializers;

    FunctionFlavor(CursorKind cursorKind, NodeKind declarationKind, NodeKind definitionKind,
                   boolean returnType, boolean access, boolean memberInitializers) {
        this.cursorKind = cursorKind;
        this.declarationKind = declarationKind;
        this.definitionKind = definitionKind;
        this.returnType = returnType;
        this.access = access;
        this.memberInitializers = memberInitializers;
    }

    public CursorKind getCursorKind() {
        return cursorKind;
    }

    public NodeKind nodeKind(boolean definition) {
        return definition ? definitionKind : declarationKind;
    }

    public boolean writesReturnType() {
        return returnType;
    }

    public boolean writesAccess() {
        return access;
    }

    /** Whether MEMBER_REF children pair with the following expression into an initializer. */
    public boolean pairsMemberInitializers() {
        return memberInitializers;
    }
}
