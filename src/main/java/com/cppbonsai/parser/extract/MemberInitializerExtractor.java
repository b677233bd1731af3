package com.cppbonsai.parser.extract;

import java.util.List;

import com.cppbonsai.ast.AttributeKey;
import com.cppbonsai.ast.AttributeMap;
import com.cppbonsai.ast.NodeKind;
import com.cppbonsai.cst.Cursor;
import com.cppbonsai.cst.CursorKind;
import com.cppbonsai.cst.Cursors;
import com.cppbonsai.parser.Position;

/**
 * One entry of a constructor's initializer list: the member reference plus the paired
 * initializer expression carried in the context.
 */
public final class MemberInitializerExtractor extends AbstractExtractor {

    public static final MemberInitializerExtractor INSTANCE = new MemberInitializerExtractor();

    private MemberInitializerExtractor() {
        super(CursorKind.MEMBER_REF);
    }

    @Override
    protected NodeKind kindOf(Cursor cursor) {
        return NodeKind.MEMBER_INITIALIZER;
    }

    @Override
    protected void extractInto(Cursor cursor, ExtractionContext context, AttributeMap attributes,
                               List<Dependency> children) {
        attributes.putIfPresent(AttributeKey.NAME, Cursors.referencedName(cursor));
        cursor.getReferenced().ifPresent(member -> {
            attributes.putIfPresent(AttributeKey.USR, member.getUsr());
            attributes.putIfPresent(AttributeKey.DATA_TYPE, member.getTypeSpelling());
        });
        if (context.getPaired() != null) {
            context.child(context.getPaired(), Position.EXPRESSION).ifPresent(children::add);
        }
    }
}
