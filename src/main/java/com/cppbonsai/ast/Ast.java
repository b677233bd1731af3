package com.cppbonsai.ast;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Stream;

import lombok.Getter;

/**
 * A normalized translation unit: its name plus every node keyed by id.
 *
 * Instances are read-only. The sentinel root ({@link AstNode#NULL_ID}) is always present.
 */
public final class Ast {

    @Getter
    private final String name;
    private final SortedMap<Integer, AstNode> nodes;

    public Ast(String name, Map<Integer, AstNode> nodes) {
        this.name = name != null ? name : "";
        Objects.requireNonNull(nodes, "nodes");
        AstNode root = nodes.get(AstNode.NULL_ID);
        if (root == null || !root.getKind().isFile()) {
            throw new IllegalArgumentException("AST must contain a FILE root with id " + AstNode.NULL_ID);
        }
        this.nodes = Collections.unmodifiableSortedMap(new TreeMap<>(nodes));
    }

    public AstNode getRoot() {
        return nodes.get(AstNode.NULL_ID);
    }

    public AstNode getNode(int id) {
        AstNode node = nodes.get(id);
        if (node == null) {
            throw new NoSuchElementException("No node with id " + id);
        }
        return node;
    }

    public Optional<AstNode> findNode(int id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean contains(int id) {
        return nodes.containsKey(id);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * All nodes in ascending id order.
     */
    public Collection<AstNode> getNodes() {
        return nodes.values();
    }

    public Stream<AstNode> stream() {
        return nodes.values().stream();
    }

    public List<AstNode> getChildren(int id) {
        return getNode(id).getChildren().stream()
                .map(this::getNode)
                .toList();
    }

    public Optional<AstNode> getParent(int id) {
        AstNode node = getNode(id);
        if (node.isRoot()) {
            return Optional.empty();
        }
        return findNode(node.getParent());
    }

    public Stream<AstNode> findByKind(NodeKind kind) {
        return stream().filter(n -> n.getKind() == kind);
    }

    /**
     * Pre-order, depth-first walk of the subtree rooted at {@code start}. Each call to
     * {@link Iterable#iterator()} starts a fresh walk.
     */
    public Iterable<AstNode> traverse(int start) {
        AstNode first = getNode(start);
        return () -> new PreOrderIterator(first);
    }

    public Iterable<AstNode> traverse() {
        return traverse(AstNode.NULL_ID);
    }

    private final class PreOrderIterator implements Iterator<AstNode> {
        private final Deque<AstNode> stack = new ArrayDeque<>();

        PreOrderIterator(AstNode start) {
            stack.push(start);
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public AstNode next() {
            if (stack.isEmpty()) {
                throw new NoSuchElementException();
            }
            AstNode node = stack.pop();
            List<Integer> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(getNode(children.get(i)));
            }
            return node;
        }
    }

    @Override
    public String toString() {
        return "Ast[" + name + ", " + nodes.size() + " nodes]";
    }
}
