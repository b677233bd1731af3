package com.cppbonsai.ast;

import java.util.List;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * Finished node of the normalized tree.
 *
 * Identity is (id, kind); parent, children, attributes and location are payload and do not take
 * part in equality.
 */
@Value
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class AstNode {

    /** Reserved id of the synthetic file root. */
    public static final int NULL_ID = 0;

    @EqualsAndHashCode.Include
    int id;

    @EqualsAndHashCode.Include
    NodeKind kind;

    int parent;

    List<Integer> children;

    @ToString.Exclude
    AttributeMap attributes;

    SourceLocation location;

    @Builder
    private AstNode(int id, @NonNull NodeKind kind, int parent, @NonNull List<Integer> children,
                    @NonNull AttributeMap attributes, @NonNull SourceLocation location) {
        if (id < 0) {
            throw new IllegalArgumentException("Node id must be non-negative: " + id);
        }
        this.id = id;
        this.kind = kind;
        this.parent = parent;
        this.children = List.copyOf(children);
        this.attributes = attributes.isSealed() ? attributes : attributes.snapshot();
        this.location = location;
    }

    public boolean isRoot() {
        return id == NULL_ID;
    }

    public String getName() {
        return attributes.getText(AttributeKey.NAME).orElse("");
    }
}
