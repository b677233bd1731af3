package com.cppbonsai.ast;

/**
 * Closed taxonomy of normalized C++ node kinds.
 *
 * The cross-cutting predicates are written as exhaustive switch expressions without a default
 * branch, so adding a kind does not compile until every predicate has decided on it.
 */
public enum NodeKind {
    FILE(NodeCategory.HELPER),
    NAMESPACE(NodeCategory.DECLARATION),

    // Declarations and definitions
    CLASS_DECL(NodeCategory.DECLARATION),
    CLASS_DEF(NodeCategory.DEFINITION),
    FIELD_DECL(NodeCategory.DECLARATION),
    VARIABLE_DECL(NodeCategory.DECLARATION),
    PARAMETER_DECL(NodeCategory.DECLARATION),
    FUNCTION_DECL(NodeCategory.DECLARATION),
    FUNCTION_DEF(NodeCategory.DEFINITION),
    METHOD_DECL(NodeCategory.DECLARATION),
    METHOD_DEF(NodeCategory.DEFINITION),
    CONSTRUCTOR_DECL(NodeCategory.DECLARATION),
    CONSTRUCTOR_DEF(NodeCategory.DEFINITION),

    // Statements
    COMPOUND_STMT(NodeCategory.STATEMENT),
    EXPRESSION_STMT(NodeCategory.STATEMENT),
    DECLARATION_STMT(NodeCategory.STATEMENT),
    RETURN_STMT(NodeCategory.STATEMENT),
    IF_STMT(NodeCategory.STATEMENT),
    WHILE_STMT(NodeCategory.STATEMENT),
    DO_STMT(NodeCategory.STATEMENT),
    FOR_STMT(NodeCategory.STATEMENT),
    FOR_RANGE_STMT(NodeCategory.STATEMENT),
    SWITCH_STMT(NodeCategory.STATEMENT),
    BREAK_STMT(NodeCategory.STATEMENT),
    CONTINUE_STMT(NodeCategory.STATEMENT),
    NULL_STMT(NodeCategory.STATEMENT),
    TRY_STMT(NodeCategory.STATEMENT),

    // Expressions
    LITERAL(NodeCategory.EXPRESSION),
    REFERENCE(NodeCategory.EXPRESSION),
    MEMBER_REFERENCE(NodeCategory.EXPRESSION),
    FUNCTION_CALL(NodeCategory.EXPRESSION),
    BINARY_OPERATOR(NodeCategory.EXPRESSION),
    UNARY_OPERATOR(NodeCategory.EXPRESSION),
    CONDITIONAL_EXPR(NodeCategory.EXPRESSION),
    CAST_EXPR(NodeCategory.EXPRESSION),
    ITEM_ACCESS(NodeCategory.EXPRESSION),
    THIS_EXPR(NodeCategory.EXPRESSION),
    NEW_EXPR(NodeCategory.EXPRESSION),
    DELETE_EXPR(NodeCategory.EXPRESSION),
    THROW_EXPR(NodeCategory.EXPRESSION),

    // Helpers
    MEMBER_INITIALIZER(NodeCategory.HELPER),
    SWITCH_CASE(NodeCategory.HELPER),
    SWITCH_DEFAULT(NodeCategory.HELPER),
    CATCH_CLAUSE(NodeCategory.HELPER);

    private final NodeCategory category;

    NodeKind(NodeCategory category) {
        this.category = category;
    }

    public NodeCategory getCategory() {
        return category;
    }

    public boolean isFile() {
        return this == FILE;
    }

    public boolean isDeclaration() {
        return category == NodeCategory.DECLARATION;
    }

    public boolean isDefinition() {
        return category == NodeCategory.DEFINITION;
    }

    public boolean isStatement() {
        return category == NodeCategory.STATEMENT;
    }

    public boolean isExpression() {
        return category == NodeCategory.EXPRESSION;
    }

    public boolean isHelper() {
        return category == NodeCategory.HELPER;
    }

    /**
     * Functions, methods and constructors, declared or defined.
     */
    public boolean isFunction() {
        return switch (this) {
            case FUNCTION_DECL, FUNCTION_DEF, METHOD_DECL, METHOD_DEF,
                    CONSTRUCTOR_DECL, CONSTRUCTOR_DEF -> true;
            case FILE, NAMESPACE, CLASS_DECL, CLASS_DEF, FIELD_DECL, VARIABLE_DECL, PARAMETER_DECL,
                    COMPOUND_STMT, EXPRESSION_STMT, DECLARATION_STMT, RETURN_STMT, IF_STMT,
                    WHILE_STMT, DO_STMT, FOR_STMT, FOR_RANGE_STMT, SWITCH_STMT, BREAK_STMT,
                    CONTINUE_STMT, NULL_STMT, TRY_STMT,
                    LITERAL, REFERENCE, MEMBER_REFERENCE, FUNCTION_CALL, BINARY_OPERATOR,
                    UNARY_OPERATOR, CONDITIONAL_EXPR, CAST_EXPR, ITEM_ACCESS, THIS_EXPR, NEW_EXPR,
                    DELETE_EXPR, THROW_EXPR,
                    MEMBER_INITIALIZER, SWITCH_CASE, SWITCH_DEFAULT, CATCH_CLAUSE -> false;
        };
    }

    public boolean isClass() {
        return switch (this) {
            case CLASS_DECL, CLASS_DEF -> true;
            case FILE, NAMESPACE, FIELD_DECL, VARIABLE_DECL, PARAMETER_DECL,
                    FUNCTION_DECL, FUNCTION_DEF, METHOD_DECL, METHOD_DEF,
                    CONSTRUCTOR_DECL, CONSTRUCTOR_DEF,
                    COMPOUND_STMT, EXPRESSION_STMT, DECLARATION_STMT, RETURN_STMT, IF_STMT,
                    WHILE_STMT, DO_STMT, FOR_STMT, FOR_RANGE_STMT, SWITCH_STMT, BREAK_STMT,
                    CONTINUE_STMT, NULL_STMT, TRY_STMT,
                    LITERAL, REFERENCE, MEMBER_REFERENCE, FUNCTION_CALL, BINARY_OPERATOR,
                    UNARY_OPERATOR, CONDITIONAL_EXPR, CAST_EXPR, ITEM_ACCESS, THIS_EXPR, NEW_EXPR,
                    DELETE_EXPR, THROW_EXPR,
                    MEMBER_INITIALIZER, SWITCH_CASE, SWITCH_DEFAULT, CATCH_CLAUSE -> false;
        };
    }

    /**
     * Expressions that name another entity and may carry a resolved definition.
     */
    public boolean isReference() {
        return switch (this) {
            case REFERENCE, MEMBER_REFERENCE, FUNCTION_CALL -> true;
            case FILE, NAMESPACE, CLASS_DECL, CLASS_DEF, FIELD_DECL, VARIABLE_DECL, PARAMETER_DECL,
                    FUNCTION_DECL, FUNCTION_DEF, METHOD_DECL, METHOD_DEF,
                    CONSTRUCTOR_DECL, CONSTRUCTOR_DEF,
                    COMPOUND_STMT, EXPRESSION_STMT, DECLARATION_STMT, RETURN_STMT, IF_STMT,
                    WHILE_STMT, DO_STMT, FOR_STMT, FOR_RANGE_STMT, SWITCH_STMT, BREAK_STMT,
                    CONTINUE_STMT, NULL_STMT, TRY_STMT,
                    LITERAL, BINARY_OPERATOR, UNARY_OPERATOR, CONDITIONAL_EXPR, CAST_EXPR,
                    ITEM_ACCESS, THIS_EXPR, NEW_EXPR, DELETE_EXPR, THROW_EXPR,
                    MEMBER_INITIALIZER, SWITCH_CASE, SWITCH_DEFAULT, CATCH_CLAUSE -> false;
        };
    }

    public boolean isOperator() {
        return switch (this) {
            case BINARY_OPERATOR, UNARY_OPERATOR, CONDITIONAL_EXPR -> true;
            case FILE, NAMESPACE, CLASS_DECL, CLASS_DEF, FIELD_DECL, VARIABLE_DECL, PARAMETER_DECL,
                    FUNCTION_DECL, FUNCTION_DEF, METHOD_DECL, METHOD_DEF,
                    CONSTRUCTOR_DECL, CONSTRUCTOR_DEF,
                    COMPOUND_STMT, EXPRESSION_STMT, DECLARATION_STMT, RETURN_STMT, IF_STMT,
                    WHILE_STMT, DO_STMT, FOR_STMT, FOR_RANGE_STMT, SWITCH_STMT, BREAK_STMT,
                    CONTINUE_STMT, NULL_STMT, TRY_STMT,
                    LITERAL, REFERENCE, MEMBER_REFERENCE, FUNCTION_CALL, CAST_EXPR, ITEM_ACCESS,
                    THIS_EXPR, NEW_EXPR, DELETE_EXPR, THROW_EXPR,
                    MEMBER_INITIALIZER, SWITCH_CASE, SWITCH_DEFAULT, CATCH_CLAUSE -> false;
        };
    }

    /**
     * Kinds whose nodes introduce a named scope that members can refer to as their owner.
     */
    public boolean isScope() {
        return switch (this) {
            case NAMESPACE, CLASS_DEF -> true;
            case FILE, CLASS_DECL, FIELD_DECL, VARIABLE_DECL, PARAMETER_DECL,
                    FUNCTION_DECL, FUNCTION_DEF, METHOD_DECL, METHOD_DEF,
                    CONSTRUCTOR_DECL, CONSTRUCTOR_DEF,
                    COMPOUND_STMT, EXPRESSION_STMT, DECLARATION_STMT, RETURN_STMT, IF_STMT,
                    WHILE_STMT, DO_STMT, FOR_STMT, FOR_RANGE_STMT, SWITCH_STMT, BREAK_STMT,
                    CONTINUE_STMT, NULL_STMT, TRY_STMT,
                    LITERAL, REFERENCE, MEMBER_REFERENCE, FUNCTION_CALL, BINARY_OPERATOR,
                    UNARY_OPERATOR, CONDITIONAL_EXPR, CAST_EXPR, ITEM_ACCESS, THIS_EXPR, NEW_EXPR,
                    DELETE_EXPR, THROW_EXPR,
                    MEMBER_INITIALIZER, SWITCH_CASE, SWITCH_DEFAULT, CATCH_CLAUSE -> false;
        };
    }
}
