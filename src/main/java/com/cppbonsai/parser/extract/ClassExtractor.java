package com.cppbonsai.parser.extract;

import java.util.ArrayList;
import java.util.List;

import com.cppbonsai.ast.AttributeKey;
import com.cppbonsai.ast.AttributeMap;
import com.cppbonsai.ast.NodeKind;
import com.cppbonsai.cst.Cursor;
import com.cppbonsai.cst.CursorKind;
import com.cppbonsai.cst.Cursors;
import com.cppbonsai.parser.Position;

/**
 * Classes, structs and unions. Base specifiers lead the child list and are folded into
 * BASE_CLASSES; the remaining children are members.
 */
public final class ClassExtractor extends AbstractExtractor {

    public static final ClassExtractor INSTANCE = new ClassExtractor();

    private ClassExtractor() {
        super(CursorKind.CLASS_DECL, CursorKind.STRUCT_DECL, CursorKind.UNION_DECL);
    }

    @Override
    protected NodeKind kindOf(Cursor cursor) {
        return cursor.isDefinition() ? NodeKind.CLASS_DEF : NodeKind.CLASS_DECL;
    }

    @Override
    protected void extractInto(Cursor cursor, ExtractionContext context, AttributeMap attributes,
                               List<Dependency> children) {
        attributes.putIfPresent(AttributeKey.NAME, cursor.getSpelling());
        attributes.putIfPresent(AttributeKey.USR, cursor.getUsr());
        attributes.putIfPresent(AttributeKey.DISPLAY_NAME, cursor.getDisplayName());
        writeScope(context, attributes);
        writeAccess(cursor, attributes);

        ChildStages stages = ChildStages.of(cursor);

        List<String> bases = new ArrayList<>();
        for (Cursor base : stages.takeWhile(c -> c.getKind() == CursorKind.CXX_BASE_SPECIFIER)) {
            bases.add(Cursors.stripTypeKeyword(base.getSpelling()));
        }
        attributes.putIfNotEmpty(AttributeKey.BASE_CLASSES, bases);

        List<String> custom = new ArrayList<>();
        ExtractionContext members = context.inherit().withScope(cursor.getUsr());
        for (Cursor member : stages.rest()) {
            if (member.getKind().isAttribute()) {
                custom.add(Attributes.label(member));
                continue;
            }
            context.child(member, Position.CLASS_MEMBER, members).ifPresent(children::add);
        }
        attributes.putIfNotEmpty(AttributeKey.CUSTOM_ATTRIBUTES, custom);
    }
}
