package com.cppbonsai.parser.extract;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cppbonsai.ast.AttributeKey;
import com.cppbonsai.ast.AttributeMap;
import com.cppbonsai.ast.NodeKind;
import com.cppbonsai.cst.Cursor;
import com.cppbonsai.cst.CursorKind;
import com.cppbonsai.cst.Cursors;
import com.cppbonsai.parser.Position;

/**
 * Function calls.
 *
 * The argument list is captured before the children are visited. A child that is the same
 * construct as the next pending argument receives the next argument index; any other child (the
 * callee) receives none.
 */
public final class CallExtractor extends AbstractExtractor {

    private static final Logger log = LoggerFactory.getLogger(CallExtractor.class);

    public static final CallExtractor INSTANCE = new CallExtractor();

    private CallExtractor() {
        super(CursorKind.CALL_EXPR);
    }

    @Override
    protected NodeKind kindOf(Cursor cursor) {
        return NodeKind.FUNCTION_CALL;
    }

    @Override
    protected void extractInto(Cursor cursor, ExtractionContext context, AttributeMap attributes,
                               List<Dependency> children) {
        ReferenceExtractor.writeReferenceAttributes(cursor, attributes);
        attributes.putIfPresent(AttributeKey.DISPLAY_NAME, cursor.getDisplayName());

        Deque<Cursor> pending = new ArrayDeque<>(cursor.getArguments());
        int argumentIndex = 0;
        for (Cursor child : ChildStages.of(cursor).rest()) {
            ExtractionContext childContext = context.inherit();
            if (!pending.isEmpty() && Cursors.sameConstruct(child, pending.peekFirst())) {
                pending.pollFirst();
                childContext = childContext.withIndex(argumentIndex++);
            }
            context.child(child, Position.EXPRESSION, childContext).ifPresent(children::add);
        }

        if (!pending.isEmpty()) {
            String diagnostic = "unmatched-arguments:" + pending.size();
            log.warn("Call to '{}' at {}: {} of {} arguments did not match any child",
                    cursor.getSpelling(), location(cursor), pending.size(), cursor.getArguments().size());
            attributes.put(AttributeKey.DIAGNOSTIC, List.of(diagnostic));
            context.getDiagnostics().warn("Call to '" + cursor.getSpelling() + "' at " + location(cursor)
                    + " has " + pending.size() + " unmatched argument(s)");
        }
    }
}
