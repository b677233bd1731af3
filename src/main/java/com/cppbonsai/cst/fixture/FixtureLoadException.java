package com.cppbonsai.cst.fixture;

/**
 * A CST fixture file could not be read or does not describe a valid tree.
 */
public class FixtureLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public FixtureLoadException(String message) {
        super(message);
    }

    public FixtureLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
