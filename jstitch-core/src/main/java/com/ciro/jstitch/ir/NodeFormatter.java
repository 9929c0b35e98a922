package com.ciro.jstitch.ir;

import com.ciro.jstitch.diagnostics.IrDiagnostic;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Volcado JSON del árbol intermedio, para depurar pases y para los tests.
 */
public final class NodeFormatter {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private NodeFormatter() {}

    public static String toJson(IrNode node) {
        try {
            return MAPPER.writeValueAsString(toTree(node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot format IR node " + node.kind(), e);
        }
    }

    public static ObjectNode toTree(IrNode node) {
        ObjectNode json = MAPPER.createObjectNode();
        json.put("kind", node.kind());

        String name = nameOf(node);
        if (name != null) json.put("name", name);

        if (node instanceof TokenNode t) {
            json.put("content", t.content);
            json.put("tokenKind", t.tokenKind.name());
        }

        if (node.source != null) {
            ObjectNode src = json.putObject("source");
            if (node.source.filePath() != null) src.put("file", node.source.filePath());
            src.put("index", node.source.absoluteIndex());
            src.put("length", node.source.length());
        }

        if (!node.diagnostics.isEmpty()) {
            ArrayNode diags = json.putArray("diagnostics");
            for (IrDiagnostic d : node.diagnostics) {
                diags.addObject()
                     .put("id", d.id())
                     .put("severity", d.severity().name())
                     .put("message", d.message());
            }
        }

        if (!node.children.isEmpty()) {
            ArrayNode kids = json.putArray("children");
            for (IrNode child : node.children) kids.add(toTree(child));
        }
        return json;
    }

    private static String nameOf(IrNode node) {
        if (node instanceof ElementNode el) return el.tagName;
        if (node instanceof AttributeNode a) return a.attributeName;
        if (node instanceof ConstructNode c) return c.tagName;
        if (node instanceof ConstructAttributeNode ca) return ca.attributeName;
        if (node instanceof DocumentNode d) return d.name;
        return null;
    }
}
