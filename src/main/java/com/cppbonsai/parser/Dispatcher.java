package com.cppbonsai.parser;

import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cppbonsai.cst.Cursor;
import com.cppbonsai.cst.Cursors;
import com.cppbonsai.parser.extract.Dependency;
import com.cppbonsai.parser.extract.ExtractionContext;

/**
 * Resolves a child cursor met in a given position to a {@link Dependency}, looking through
 * implicit wrapper expressions first.
 */
public class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final DispatchTable table;

    public Dispatcher(DispatchTable table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    public Optional<Dependency> dispatch(Cursor cursor, Position position, ExtractionContext context) {
        Cursor target = Cursors.unwrap(cursor);
        DispatchTable.Decision decision = table.decide(target.getKind(), position);
        switch (decision.getOutcome()) {
            case MAP:
                return Optional.of(new Dependency(target, decision.getExtractor(), context));
            case DROP:
                log.debug("Dropping {} '{}' in {} position", target.getKindName(), target.getSpelling(), position);
                return Optional.empty();
            default:
                log.debug("Ignoring unrecognized {} '{}' in {} position",
                        target.getKindName(), target.getSpelling(), position);
                return Optional.empty();
        }
    }

    public DispatchTable getTable() {
        return table;
    }
}
