package com.ciro.jstitch.ir;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Aserciones compactas sobre nodos del árbol intermedio.
 */
public final class NodeAssert {

    private NodeAssert() {}

    public static ElementNode element(IrNode node, String tagName) {
        assertThat(node).isInstanceOf(ElementNode.class);
        ElementNode el = (ElementNode) node;
        assertThat(el.tagName).isEqualTo(tagName);
        return el;
    }

    public static AttributeNode attribute(IrNode node, String name, String value) {
        assertThat(node).isInstanceOf(AttributeNode.class);
        AttributeNode attr = (AttributeNode) node;
        assertThat(attr.attributeName).isEqualTo(name);
        assertThat(attr.children).hasSize(1);
        assertThat(attr.children.get(0)).isInstanceOf(AttributeValueNode.class);
        assertThat(((AttributeValueNode) attr.children.get(0)).content()).isEqualTo(value);
        return attr;
    }

    /** Texto cuyo contenido, sin espacios alrededor, es {@code text}. */
    public static MarkupNode content(IrNode node, String text) {
        assertThat(node).isInstanceOf(MarkupNode.class);
        MarkupNode markup = (MarkupNode) node;
        assertThat(markup.content().trim()).isEqualTo(text);
        return markup;
    }

    public static MarkupNode whitespace(IrNode node) {
        assertThat(node).isInstanceOf(MarkupNode.class);
        MarkupNode markup = (MarkupNode) node;
        assertThat(markup.content()).isBlank();
        return markup;
    }

    /** Concatena el texto de todas las hojas de markup en orden de documento. */
    public static String leafText(IrNode node) {
        StringBuilder sb = new StringBuilder();
        appendLeafText(node, sb);
        return sb.toString();
    }

    private static void appendLeafText(IrNode node, StringBuilder sb) {
        if (node instanceof MarkupNode markup) {
            sb.append(markup.content());
            return;
        }
        for (IrNode child : node.children) appendLeafText(child, sb);
    }
}
