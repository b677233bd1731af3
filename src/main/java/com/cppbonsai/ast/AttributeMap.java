package com.cppbonsai.ast;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.stream.Collectors;

/**
 * Typed attribute container written by extractors.
 *
 * Every key can be written once. Once {@link #snapshot()} has been taken for the finished node the
 * snapshot rejects all writes.
 */
public final class AttributeMap {

    private final EnumMap<AttributeKey, Object> values;
    private final boolean sealed;

    public AttributeMap() {
        this(new EnumMap<>(AttributeKey.class), false);
    }

    private AttributeMap(EnumMap<AttributeKey, Object> values, boolean sealed) {
        this.values = values;
        this.sealed = sealed;
    }

    public AttributeMap put(AttributeKey key, String value) {
        requireShape(key, AttributeKey.Shape.TEXT);
        return write(key, Objects.requireNonNull(value, "value"));
    }

    public AttributeMap put(AttributeKey key, int value) {
        requireShape(key, AttributeKey.Shape.INTEGER);
        return write(key, value);
    }

    public AttributeMap put(AttributeKey key, List<String> value) {
        requireShape(key, AttributeKey.Shape.TEXT_LIST);
        return write(key, List.copyOf(value));
    }

    /**
     * Writes a text value only when it is neither null nor blank. Front ends frequently report
     * empty spellings, and those carry no information worth keeping.
     */
    public AttributeMap putIfPresent(AttributeKey key, String value) {
        if (value != null && !value.isBlank()) {
            put(key, value);
        }
        return this;
    }

    public AttributeMap putIfNotEmpty(AttributeKey key, List<String> value) {
        if (value != null && !value.isEmpty()) {
            put(key, value);
        }
        return this;
    }

    public boolean contains(AttributeKey key) {
        return values.containsKey(key);
    }

    public Optional<String> getText(AttributeKey key) {
        requireShape(key, AttributeKey.Shape.TEXT);
        return Optional.ofNullable((String) values.get(key));
    }

    public List<String> getList(AttributeKey key) {
        requireShape(key, AttributeKey.Shape.TEXT_LIST);
        List<?> list = (List<?>) values.get(key);
        if (list == null) {
            return List.of();
        }
        return list.stream().map(Object::toString).collect(Collectors.toUnmodifiableList());
    }

    public OptionalInt getInt(AttributeKey key) {
        requireShape(key, AttributeKey.Shape.INTEGER);
        Integer value = (Integer) values.get(key);
        return value != null ? OptionalInt.of(value) : OptionalInt.empty();
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public boolean isSealed() {
        return sealed;
    }

    /**
     * Read-only view in key declaration order.
     */
    public Map<AttributeKey, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    /**
     * Sealed copy handed to the finished node.
     */
    public AttributeMap snapshot() {
        return new AttributeMap(new EnumMap<>(values), true);
    }

    private AttributeMap write(AttributeKey key, Object value) {
        if (sealed) {
            throw new UnsupportedOperationException("Attributes are sealed; cannot write " + key);
        }
        if (values.containsKey(key)) {
            throw new IllegalStateException("Attribute " + key + " already written (" + values.get(key) + ")");
        }
        values.put(key, value);
        return this;
    }

    private static void requireShape(AttributeKey key, AttributeKey.Shape shape) {
        Objects.requireNonNull(key, "key");
        if (key.getShape() != shape) {
            throw new IllegalArgumentException("Attribute " + key + " holds " + key.getShape() + ", not " + shape);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AttributeMap other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
