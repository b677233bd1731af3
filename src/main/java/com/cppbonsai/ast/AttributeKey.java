package com.cppbonsai.ast;

/**
 * Closed set of attribute keys an extractor may write on a node.
 */
public enum AttributeKey {
    NAME(Shape.TEXT),
    /** Unique symbol reference, as reported by the front end or synthesized from the owning scope. */
    USR(Shape.TEXT),
    DISPLAY_NAME(Shape.TEXT),
    DATA_TYPE(Shape.TEXT),
    RETURN_TYPE(Shape.TEXT),
    ACCESS(Shape.TEXT),
    BASE_CLASSES(Shape.TEXT_LIST),
    /** Symbol of the enclosing namespace or class. */
    SCOPE(Shape.TEXT),
    CUSTOM_ATTRIBUTES(Shape.TEXT_LIST),
    LITERAL_VALUE(Shape.TEXT),
    /** 0-based position of an argument or parameter. */
    PARAMETER_INDEX(Shape.INTEGER),
    /** Symbol of the definition a reference resolves to. */
    DEFINITION(Shape.TEXT),
    DIAGNOSTIC(Shape.TEXT_LIST);

    /**
     * Value shape accepted for a key.
     */
    public enum Shape {
        TEXT,
        TEXT_LIST,
        INTEGER
    }

    private final Shape shape;

    AttributeKey(Shape shape) {
        this.shape = shape;
    }

    public Shape getShape() {
        return shape;
    }

    /**
     * Lower-case name used in text and JSON renderings.
     */
    public String label() {
        return name().toLowerCase();
    }
}
