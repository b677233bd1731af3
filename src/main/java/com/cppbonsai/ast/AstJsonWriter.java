package com.cppbonsai.ast;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Serializes an {@link Ast} to JSON. Nodes are written in ascending id order and attributes in key
 * declaration order, so equal trees always produce equal documents.
 */
public final class AstJsonWriter {

    private AstJsonWriter() {
    }

    public static String toJson(Ast ast) {
        try {
            return createMapper().writeValueAsString(toTree(ast));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize AST " + ast.getName() + ": " + e.getMessage(), e);
        }
    }

    public static ObjectNode toTree(Ast ast) {
        ObjectMapper mapper = createMapper();
        ObjectNode doc = mapper.createObjectNode();
        doc.put("name", ast.getName());
        ArrayNode nodes = doc.putArray("nodes");
        for (AstNode node : ast.getNodes()) {
            ObjectNode json = nodes.addObject();
            json.put("id", node.getId());
            json.put("kind", node.getKind().name());
            json.put("parent", node.getParent());
            ArrayNode children = json.putArray("children");
            node.getChildren().forEach(children::add);

            ObjectNode location = json.putObject("location");
            location.put("file", node.getLocation().getFile());
            location.put("line", node.getLocation().getLine());
            location.put("column", node.getLocation().getColumn());

            ObjectNode attributes = json.putObject("attributes");
            for (Map.Entry<AttributeKey, Object> entry : node.getAttributes().asMap().entrySet()) {
                String key = entry.getKey().label();
                Object value = entry.getValue();
                if (value instanceof Integer i) {
                    attributes.put(key, i);
                } else if (value instanceof List<?> list) {
                    ArrayNode array = attributes.putArray(key);
                    list.forEach(item -> array.add(String.valueOf(item)));
                } else {
                    attributes.put(key, String.valueOf(value));
                }
            }
        }
        return doc;
    }

    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
