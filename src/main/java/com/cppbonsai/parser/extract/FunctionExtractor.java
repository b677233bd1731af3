package com.cppbonsai.parser.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cppbonsai.ast.AttributeKey;
import com.cppbonsai.ast.AttributeMap;
import com.cppbonsai.ast.NodeKind;
import com.cppbonsai.cst.Cursor;
import com.cppbonsai.cst.CursorKind;
import com.cppbonsai.cst.Cursors;

/**
 * Functions, methods and constructors.
 *
 * Children are consumed in three stages: leading attributes, then the leading namespace/type
 * references, then parameters, constructor initializers and the body.
 *
 * Leading references only qualify the owning scope at file or namespace level, where out-of-line
 * definitions such as {@code void N::C::f()} appear. Inside a class they name the return type and
 * the class scope is kept.
 */
public final class FunctionExtractor extends AbstractExtractor {

    private static final Logger log = LoggerFactory.getLogger(FunctionExtractor.class);

    public static final FunctionExtractor FUNCTION = new FunctionExtractor(FunctionFlavor.FUNCTION);
    public static final FunctionExtractor METHOD = new FunctionExtractor(FunctionFlavor.METHOD);
    public static final FunctionExtractor CONSTRUCTOR = new FunctionExtractor(FunctionFlavor.CONSTRUCTOR);

    private final FunctionFlavor flavor;

    private FunctionExtractor(FunctionFlavor flavor) {
        super(flavor.getCursorKind());
        this.flavor = flavor;
    }

    public FunctionFlavor getFlavor() {
        return flavor;
    }

    @Override
    protected NodeKind kindOf(Cursor cursor) {
        return flavor.nodeKind(cursor.isDefinition());
    }

    @Override
    protected void extractInto(Cursor cursor, ExtractionContext context, AttributeMap attributes,
                               List<Dependency> children) {
        ChildStages stages = ChildStages.of(cursor);

        List<String> custom = new ArrayList<>();
        for (Cursor attribute : stages.takeWhile(c -> c.getKind().isAttribute())) {
            custom.add(Attributes.label(attribute));
        }

        StringBuilder qualifier = new StringBuilder();
        for (Cursor ref : stages.takeWhile(FunctionExtractor::isScopeReference)) {
            qualifier.append(ref.getKind() == CursorKind.NAMESPACE_REF ? "@N@" : "@S@")
                    .append(Cursors.referencedName(ref));
        }

        String name = cursor.getSpelling();
        String scope = context.getScope();
        if (qualifier.length() > 0 && isNamespaceLevel(scope)) {
            scope = orFileLevel(scope) + qualifier;
        }
        String usr = cursor.getUsr();
        if (Cursors.isBlank(usr)) {
            usr = orFileLevel(scope) + "@F@" + name;
            log.debug("No USR for {} '{}', using {}", cursor.getKindName(), name, usr);
        }

        attributes.putIfPresent(AttributeKey.NAME, name);
        attributes.put(AttributeKey.USR, usr);
        attributes.putIfPresent(AttributeKey.DISPLAY_NAME, cursor.getDisplayName());
        attributes.putIfPresent(AttributeKey.DATA_TYPE, cursor.getTypeSpelling());
        if (flavor.writesReturnType()) {
            attributes.putIfPresent(AttributeKey.RETURN_TYPE, cursor.getResultTypeSpelling());
        }
        attributes.putIfPresent(AttributeKey.SCOPE, scope);
        if (flavor.writesAccess()) {
            writeAccess(cursor, attributes);
        }
        attributes.putIfNotEmpty(AttributeKey.CUSTOM_ATTRIBUTES, custom);

        ExtractionContext inner = context.inherit().withScope(usr);
        int parameterIndex = 0;
        while (stages.hasNext()) {
            Cursor child = stages.next().orElseThrow();
            switch (child.getKind()) {
                case PARM_DECL -> children.add(new Dependency(child, ParameterExtractor.INSTANCE,
                        inner.withIndex(parameterIndex++)));
                case COMPOUND_STMT -> children.add(new Dependency(child, StatementExtractor.COMPOUND, inner));
                case MEMBER_REF -> {
                    if (flavor.pairsMemberInitializers()) {
                        Optional<Cursor> initializer = stages.peek().filter(c -> c.getKind().isExpression());
                        initializer.ifPresent(c -> stages.next());
                        children.add(new Dependency(child, MemberInitializerExtractor.INSTANCE,
                                inner.withPaired(initializer.orElse(null))));
                    } else {
                        log.debug("Ignoring member reference '{}' in {}", child.getSpelling(), name);
                    }
                }
                default -> log.debug("Ignoring {} '{}' in {} '{}'",
                        child.getKindName(), child.getSpelling(), cursor.getKindName(), name);
            }
        }
    }

    private static boolean isScopeReference(Cursor cursor) {
        return cursor.getKind() == CursorKind.NAMESPACE_REF || cursor.getKind() == CursorKind.TYPE_REF;
    }

    /**
     * True for file level (no scope) and for namespace symbols such as {@code c:@N@N}.
     */
    static boolean isNamespaceLevel(String scope) {
        if (Cursors.isBlank(scope)) {
            return true;
        }
        int last = scope.lastIndexOf('@');
        int tag = last > 0 ? scope.lastIndexOf('@', last - 1) : -1;
        return tag >= 0 && scope.substring(tag + 1, last).equals("N");
    }

    private static String orFileLevel(String scope) {
        return Cursors.isBlank(scope) ? "c:" : scope;
    }

    @Override
    public String toString() {
        return "FunctionExtractor[" + flavor + "]";
    }
}
