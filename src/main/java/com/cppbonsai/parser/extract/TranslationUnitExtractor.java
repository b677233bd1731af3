package com.cppbonsai.parser.extract;

import java.util.List;

import com.cppbonsai.ast.AttributeKey;
import com.cppbonsai.ast.AttributeMap;
import com.cppbonsai.ast.NodeKind;
import com.cppbonsai.ast.SourceLocation;
import com.cppbonsai.cst.Cursor;
import com.cppbonsai.cst.CursorKind;
import com.cppbonsai.cst.WorkspaceFilter;
import com.cppbonsai.parser.Position;

/**
 * Root strategy: one FILE node per translation unit, keeping the top-level declarations that
 * belong to the workspace.
 */
public final class TranslationUnitExtractor extends AbstractExtractor {

    public static final TranslationUnitExtractor INSTANCE = new TranslationUnitExtractor();

    private TranslationUnitExtractor() {
        super(CursorKind.TRANSLATION_UNIT);
    }

    @Override
    protected NodeKind kindOf(Cursor cursor) {
        return NodeKind.FILE;
    }

    @Override
    public SourceLocation location(Cursor cursor) {
        return SourceLocation.ofFile(cursor.getSpelling());
    }

    @Override
    protected void extractInto(Cursor cursor, ExtractionContext context, AttributeMap attributes,
                               List<Dependency> children) {
        attributes.putIfPresent(AttributeKey.NAME, cursor.getSpelling());
        for (Cursor child : ChildStages.of(cursor).rest()) {
            if (WorkspaceFilter.accepts(child, context.getWorkspace())) {
                context.child(child, Position.TOP_LEVEL).ifPresent(children::add);
            }
        }
    }
}
