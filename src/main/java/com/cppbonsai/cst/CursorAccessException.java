package com.cppbonsai.cst;

/**
 * Raised by a {@link Cursor} accessor when the front end cannot answer for this cursor, for
 * example a location query on a cursor without a backing source range.
 */
public class CursorAccessException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CursorAccessException(String message) {
        super(message);
    }

    public CursorAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
