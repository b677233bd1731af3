package com.cppbonsai.parser.extract;

import static com.cppbonsai.parser.Position.CLASS_MEMBER;
import static com.cppbonsai.parser.Position.EXPRESSION;
import static com.cppbonsai.parser.Position.STATEMENT;
import static com.cppbonsai.parser.Position.TOP_LEVEL;

import java.util.EnumSet;
import java.util.Set;

import com.cppbonsai.cst.CursorKind;
import com.cppbonsai.parser.DispatchRule;
import com.cppbonsai.parser.DispatchTable;

/**
 * The built-in dispatch table.
 */
public final class Extractors {

    /** Declarations that have no node kind of their own. */
    static final Set<CursorKind> IGNORED_DECLARATIONS = EnumSet.of(
            CursorKind.UNEXPOSED_DECL, CursorKind.NAMESPACE_ALIAS, CursorKind.LINKAGE_SPEC,
            CursorKind.ENUM_DECL, CursorKind.ENUM_CONSTANT_DECL, CursorKind.DESTRUCTOR,
            CursorKind.CONVERSION_FUNCTION, CursorKind.FUNCTION_TEMPLATE, CursorKind.CLASS_TEMPLATE,
            CursorKind.TEMPLATE_TYPE_PARAMETER, CursorKind.TYPEDEF_DECL, CursorKind.TYPE_ALIAS_DECL,
            CursorKind.USING_DIRECTIVE, CursorKind.USING_DECLARATION, CursorKind.STATIC_ASSERT,
            CursorKind.FRIEND_DECL, CursorKind.CXX_ACCESS_SPEC_DECL, CursorKind.CXX_BASE_SPECIFIER,
            CursorKind.MACRO_DEFINITION, CursorKind.MACRO_INSTANTIATION, CursorKind.INCLUSION_DIRECTIVE);

    /** Expressions that are not normalized; wrappers reaching the table have zero or several children. */
    static final Set<CursorKind> IGNORED_EXPRESSIONS = EnumSet.of(
            CursorKind.UNEXPOSED_EXPR, CursorKind.PAREN_EXPR, CursorKind.INIT_LIST_EXPR,
            CursorKind.LAMBDA_EXPR, CursorKind.PACK_EXPANSION_EXPR, CursorKind.SIZE_OF_PACK_EXPR);

    static final Set<CursorKind> REFERENCES = EnumSet.range(CursorKind.NAMESPACE_REF, CursorKind.VARIABLE_REF);

    static final Set<CursorKind> ATTRIBUTES = EnumSet.range(CursorKind.UNEXPOSED_ATTR, CursorKind.ALIGNED_ATTR);

    private static final DispatchTable STANDARD = createStandardTable();

    private Extractors() {
        // Utility class
    }

    public static DispatchTable standardTable() {
        return STANDARD;
    }

    private static DispatchTable createStandardTable() {
        DispatchTable.Builder table = DispatchTable.builder()
                // Never normalized, wherever they appear
                .rule(DispatchRule.drop(IGNORED_DECLARATIONS))
                .rule(DispatchRule.drop(IGNORED_EXPRESSIONS))
                .rule(DispatchRule.drop(REFERENCES))
                .rule(DispatchRule.drop(ATTRIBUTES))
                .drop(CursorKind.TRANSLATION_UNIT)

                // Declarations
                .map(NamespaceExtractor.INSTANCE, TOP_LEVEL)
                .map(ClassExtractor.INSTANCE, TOP_LEVEL, CLASS_MEMBER, STATEMENT)
                .map(FunctionExtractor.FUNCTION, TOP_LEVEL)
                .map(FunctionExtractor.METHOD, TOP_LEVEL, CLASS_MEMBER)
                .map(FunctionExtractor.CONSTRUCTOR, TOP_LEVEL)
                .drop(CursorKind.CONSTRUCTOR, CLASS_MEMBER)
                .map(FieldExtractor.INSTANCE, CLASS_MEMBER)
                .map(VariableExtractor.INSTANCE, TOP_LEVEL, CLASS_MEMBER, STATEMENT, EXPRESSION)
                .drop(CursorKind.PARM_DECL)

                // Statements
                .drop(CursorKind.UNEXPOSED_STMT, STATEMENT)
                .drop(CursorKind.LABEL_STMT, STATEMENT)
                .drop(CursorKind.GOTO_STMT, STATEMENT);
        for (StatementExtractor statement : StatementExtractor.ALL) {
            table.map(statement, STATEMENT);
        }

        // Expressions
        table.map(LiteralExtractor.INSTANCE, EXPRESSION)
                .map(ReferenceExtractor.INSTANCE, EXPRESSION)
                .map(CallExtractor.INSTANCE, EXPRESSION)
                .map(OperatorExtractor.INSTANCE, EXPRESSION);
        for (ExpressionExtractor expression : ExpressionExtractor.ALL) {
            table.map(expression, EXPRESSION);
        }

        // An expression met where a statement is expected
        table.map(ExpressionStatementExtractor.INSTANCE, STATEMENT);
        return table.build();
    }
}
