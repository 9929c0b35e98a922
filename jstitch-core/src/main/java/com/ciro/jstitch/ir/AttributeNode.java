package com.ciro.jstitch.ir;

/**
 * Atributo de un elemento. El valor es el subárbol de hijos:
 * literales ({@link AttributeValueNode}) mezclados con expresiones ({@link ExpressionValueNode}).
 */
public class AttributeNode extends IrNode {
    public final String attributeName;

    public AttributeNode(String attributeName) {
        this.attributeName = attributeName;
    }

    /** Atributo con un único valor literal, p.ej. {@code cool="beans"}. */
    public static AttributeNode literal(String name, String value) {
        AttributeNode node = new AttributeNode(name);
        node.children.add(AttributeValueNode.of(value));
        return node;
    }

    @Override
    public String toString() {
        return "Attribute(" + attributeName + ")" + children;
    }
}
