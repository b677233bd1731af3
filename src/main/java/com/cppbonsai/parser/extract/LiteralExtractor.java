package com.cppbonsai.parser.extract;

import java.util.List;

import com.cppbonsai.ast.AttributeKey;
import com.cppbonsai.ast.AttributeMap;
import com.cppbonsai.ast.NodeKind;
import com.cppbonsai.cst.Cursor;
import com.cppbonsai.cst.CursorKind;

public final class LiteralExtractor extends AbstractExtractor {

    public static final LiteralExtractor INSTANCE = new LiteralExtractor();

    private LiteralExtractor() {
        super(CursorKind.INTEGER_LITERAL, CursorKind.FLOATING_LITERAL, CursorKind.STRING_LITERAL,
                CursorKind.CHARACTER_LITERAL, CursorKind.CXX_BOOL_LITERAL_EXPR, CursorKind.CXX_NULL_PTR_LITERAL_EXPR);
    }

    @Override
    protected NodeKind kindOf(Cursor cursor) {
        return NodeKind.LITERAL;
    }

    /**
     * The literal text is the first token of the cursor's extent; the spelling is used when the
     * front end reports no tokens.
     */
    @Override
    protected void extractInto(Cursor cursor, ExtractionContext context, AttributeMap attributes,
                               List<Dependency> children) {
        String value = cursor.getTokens().isEmpty() ? cursor.getSpelling() : cursor.getTokens().get(0).getSpelling();
        attributes.putIfPresent(AttributeKey.LITERAL_VALUE, value);
        attributes.putIfPresent(AttributeKey.DATA_TYPE, cursor.getTypeSpelling());
    }
}
