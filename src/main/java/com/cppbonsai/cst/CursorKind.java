package com.cppbonsai.cst;

import java.util.EnumSet;
import java.util.Set;

/**
 * Native cursor kinds reported by the C++ front end. Names follow the front end's own spelling.
 *
 * {@link #UNRECOGNIZED} stands for any kind this enumeration does not know yet; it is never mapped
 * and lets newer front ends feed constructs through without breaking the build.
 */
public enum CursorKind {
    TRANSLATION_UNIT,
    UNRECOGNIZED,

    // Declarations
    UNEXPOSED_DECL,
    NAMESPACE,
    NAMESPACE_ALIAS,
    LINKAGE_SPEC,
    CLASS_DECL,
    STRUCT_DECL,
    UNION_DECL,
    ENUM_DECL,
    ENUM_CONSTANT_DECL,
    FIELD_DECL,
    VAR_DECL,
    PARM_DECL,
    FUNCTION_DECL,
    CXX_METHOD,
    CONSTRUCTOR,
    DESTRUCTOR,
    CONVERSION_FUNCTION,
    FUNCTION_TEMPLATE,
    CLASS_TEMPLATE,
    TEMPLATE_TYPE_PARAMETER,
    TYPEDEF_DECL,
    TYPE_ALIAS_DECL,
    USING_DIRECTIVE,
    USING_DECLARATION,
    STATIC_ASSERT,
    FRIEND_DECL,
    CXX_ACCESS_SPEC_DECL,
    CXX_BASE_SPECIFIER,

    // References
    NAMESPACE_REF,
    TYPE_REF,
    TEMPLATE_REF,
    MEMBER_REF,
    OVERLOADED_DECL_REF,
    VARIABLE_REF,

    // Attributes
    UNEXPOSED_ATTR,
    ANNOTATE_ATTR,
    CXX_FINAL_ATTR,
    CXX_OVERRIDE_ATTR,
    VISIBILITY_ATTR,
    WARN_UNUSED_RESULT_ATTR,
    ALIGNED_ATTR,

    // Statements
    UNEXPOSED_STMT,
    COMPOUND_STMT,
    DECL_STMT,
    RETURN_STMT,
    IF_STMT,
    WHILE_STMT,
    DO_STMT,
    FOR_STMT,
    CXX_FOR_RANGE_STMT,
    SWITCH_STMT,
    CASE_STMT,
    DEFAULT_STMT,
    BREAK_STMT,
    CONTINUE_STMT,
    NULL_STMT,
    GOTO_STMT,
    LABEL_STMT,
    CXX_TRY_STMT,
    CXX_CATCH_STMT,

    // Expressions
    UNEXPOSED_EXPR,
    DECL_REF_EXPR,
    MEMBER_REF_EXPR,
    CALL_EXPR,
    INTEGER_LITERAL,
    FLOATING_LITERAL,
    STRING_LITERAL,
    CHARACTER_LITERAL,
    CXX_BOOL_LITERAL_EXPR,
    CXX_NULL_PTR_LITERAL_EXPR,
    PAREN_EXPR,
    UNARY_OPERATOR,
    BINARY_OPERATOR,
    COMPOUND_ASSIGNMENT_OPERATOR,
    CONDITIONAL_OPERATOR,
    CSTYLE_CAST_EXPR,
    CXX_STATIC_CAST_EXPR,
    CXX_DYNAMIC_CAST_EXPR,
    CXX_REINTERPRET_CAST_EXPR,
    CXX_CONST_CAST_EXPR,
    CXX_FUNCTIONAL_CAST_EXPR,
    ARRAY_SUBSCRIPT_EXPR,
    CXX_THIS_EXPR,
    CXX_NEW_EXPR,
    CXX_DELETE_EXPR,
    CXX_THROW_EXPR,
    INIT_LIST_EXPR,
    LAMBDA_EXPR,
    PACK_EXPANSION_EXPR,
    SIZE_OF_PACK_EXPR,

    // Preprocessing
    MACRO_DEFINITION,
    MACRO_INSTANTIATION,
    INCLUSION_DIRECTIVE;

    private static final Set<CursorKind> ATTRIBUTES = EnumSet.of(
            UNEXPOSED_ATTR, ANNOTATE_ATTR, CXX_FINAL_ATTR, CXX_OVERRIDE_ATTR,
            VISIBILITY_ATTR, WARN_UNUSED_RESULT_ATTR, ALIGNED_ATTR);

    private static final Set<CursorKind> STATEMENTS = EnumSet.range(UNEXPOSED_STMT, CXX_CATCH_STMT);

    private static final Set<CursorKind> EXPRESSIONS = EnumSet.range(UNEXPOSED_EXPR, SIZE_OF_PACK_EXPR);

    private static final Set<CursorKind> REFERENCES = EnumSet.range(NAMESPACE_REF, VARIABLE_REF);

    public boolean isAttribute() {
        return ATTRIBUTES.contains(this);
    }

    public boolean isStatement() {
        return STATEMENTS.contains(this);
    }

    public boolean isExpression() {
        return EXPRESSIONS.contains(this);
    }

    public boolean isReference() {
        return REFERENCES.contains(this);
    }

    /**
     * Parses a kind name, mapping anything unknown to {@link #UNRECOGNIZED}.
     */
    public static CursorKind fromName(String name) {
        if (name == null) {
            return UNRECOGNIZED;
        }
        try {
            return valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return UNRECOGNIZED;
        }
    }
}
