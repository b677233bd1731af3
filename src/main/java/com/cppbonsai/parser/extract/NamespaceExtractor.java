package com.cppbonsai.parser.extract;

import java.util.List;

import com.cppbonsai.ast.AttributeKey;
import com.cppbonsai.ast.AttributeMap;
import com.cppbonsai.ast.NodeKind;
import com.cppbonsai.cst.Cursor;
import com.cppbonsai.cst.CursorKind;
import com.cppbonsai.parser.Position;

public final class NamespaceExtractor extends AbstractExtractor {

    public static final NamespaceExtractor INSTANCE = new NamespaceExtractor();

    private NamespaceExtractor() {
        super(CursorKind.NAMESPACE);
    }

    @Override
    protected NodeKind kindOf(Cursor cursor) {
        return NodeKind.NAMESPACE;
    }

    @Override
    protected void extractInto(Cursor cursor, ExtractionContext context, AttributeMap attributes,
                               List<Dependency> children) {
        attributes.putIfPresent(AttributeKey.NAME, cursor.getSpelling());
        attributes.putIfPresent(AttributeKey.USR, cursor.getUsr());
        writeScope(context, attributes);

        ExtractionContext members = context.inherit().withScope(cursor.getUsr());
        for (Cursor child : ChildStages.of(cursor).rest()) {
            context.child(child, Position.TOP_LEVEL, members).ifPresent(children::add);
        }
    }
}
