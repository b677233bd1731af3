package com.cppbonsai.ast;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Deterministic text renderings of an {@link Ast}, suitable for golden-file comparison.
 */
public final class AstPrinter {

    private AstPrinter() {
        // Utility class
    }

    /**
     * One line per node in ascending id order.
     *
     * <pre>
     * #1 NAMESPACE parent=0 children=[2] loc=a.cpp:1:11 {name=N, usr=c:@N@N}
     * </pre>
     */
    public static String render(Ast ast) {
        StringBuilder sb = new StringBuilder();
        sb.append("[AST] ").append(ast.getName()).append(System.lineSeparator());
        for (AstNode node : ast.getNodes()) {
            sb.append('#').append(node.getId())
                    .append(' ').append(node.getKind())
                    .append(" parent=").append(node.getParent())
                    .append(" children=").append(node.getChildren())
                    .append(" loc=").append(node.getLocation())
                    .append(' ').append(renderAttributes(node.getAttributes()))
                    .append(System.lineSeparator());
        }
        return sb.toString();
    }

    /**
     * Indented pre-order rendering of the subtree under {@code start}.
     */
    public static String renderTree(Ast ast, int start) {
        StringBuilder sb = new StringBuilder();
        Deque<Integer> depths = new ArrayDeque<>();
        Deque<AstNode> stack = new ArrayDeque<>();
        stack.push(ast.getNode(start));
        depths.push(0);
        while (!stack.isEmpty()) {
            AstNode node = stack.pop();
            int depth = depths.pop();
            sb.append("  ".repeat(depth))
                    .append(node.getKind()).append(" #").append(node.getId());
            if (!node.getAttributes().isEmpty()) {
                sb.append(' ').append(renderAttributes(node.getAttributes()));
            }
            sb.append(System.lineSeparator());
            List<Integer> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(ast.getNode(children.get(i)));
                depths.push(depth + 1);
            }
        }
        return sb.toString();
    }

    public static String renderTree(Ast ast) {
        return renderTree(ast, AstNode.NULL_ID);
    }

    static String renderAttributes(AttributeMap attributes) {
        return attributes.asMap().entrySet().stream()
                .map(AstPrinter::renderEntry)
                .collect(Collectors.joining(", ", "{", "}"));
    }

    private static String renderEntry(Map.Entry<AttributeKey, Object> entry) {
        Object value = entry.getValue();
        String text = value instanceof List<?> list
                ? list.stream().map(String::valueOf).collect(Collectors.joining(", ", "[", "]"))
                : String.valueOf(value);
        return entry.getKey().label() + "=" + text;
    }
}
