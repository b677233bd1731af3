package com.cppbonsai.parser.extract;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cppbonsai.ast.SourceLocation;
import com.cppbonsai.cst.Cursor;
import com.cppbonsai.cst.Cursors;

public final class Locations {

    private static final Logger log = LoggerFactory.getLogger(Locations.class);

    private Locations() {
        // Utility class
    }

    /**
     * The cursor's location, or the zero location when it is unavailable.
     */
    public static SourceLocation fromCursor(Cursor cursor) {
        return Cursors.safeLocation(cursor)
                .map(l -> new SourceLocation(l.getFile(), l.getLine(), l.getColumn()))
                .orElseGet(() -> {
                    log.debug("No location for {} '{}', using zero location", cursor.getKindName(), cursor.getSpelling());
                    return SourceLocation.EMPTY;
                });
    }
}
