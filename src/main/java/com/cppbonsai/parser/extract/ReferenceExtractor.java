package com.cppbonsai.parser.extract;

import java.util.List;

import com.cppbonsai.ast.AttributeKey;
import com.cppbonsai.ast.AttributeMap;
import com.cppbonsai.ast.NodeKind;
import com.cppbonsai.cst.Cursor;
import com.cppbonsai.cst.CursorKind;
import com.cppbonsai.cst.Cursors;

/**
 * Named references to variables, functions and members. Leading namespace/type references
 * qualify the display name; a member reference keeps its object expression as child.
 */
public final class ReferenceExtractor extends AbstractExtractor {

    public static final ReferenceExtractor INSTANCE = new ReferenceExtractor();

    private ReferenceExtractor() {
        super(CursorKind.DECL_REF_EXPR, CursorKind.MEMBER_REF_EXPR);
    }

    @Override
    protected NodeKind kindOf(Cursor cursor) {
        return cursor.getKind() == CursorKind.MEMBER_REF_EXPR ? NodeKind.MEMBER_REFERENCE : NodeKind.REFERENCE;
    }

    @Override
    protected void extractInto(Cursor cursor, ExtractionContext context, AttributeMap attributes,
                               List<Dependency> children) {
        ChildStages stages = ChildStages.of(cursor);
        StringBuilder qualified = new StringBuilder();
        for (Cursor ref : stages.takeWhile(c -> c.getKind() == CursorKind.NAMESPACE_REF
                || c.getKind() == CursorKind.TYPE_REF)) {
            qualified.append(Cursors.referencedName(ref)).append("::");
        }
        qualified.append(cursor.getSpelling());

        writeReferenceAttributes(cursor, attributes);
        attributes.putIfPresent(AttributeKey.DISPLAY_NAME, qualified.toString());
        addExpressionChildren(stages.rest(), context, children);
    }

    /**
     * NAME, USR of the referenced declaration, DATA_TYPE and the resolved DEFINITION.
     */
    static void writeReferenceAttributes(Cursor cursor, AttributeMap attributes) {
        attributes.putIfPresent(AttributeKey.NAME, cursor.getSpelling());
        cursor.getReferenced().ifPresent(target -> attributes.putIfPresent(AttributeKey.USR, target.getUsr()));
        attributes.putIfPresent(AttributeKey.DATA_TYPE, cursor.getTypeSpelling());
        cursor.getDefinition().ifPresent(definition ->
                attributes.putIfPresent(AttributeKey.DEFINITION, definition.getUsr()));
    }
}
