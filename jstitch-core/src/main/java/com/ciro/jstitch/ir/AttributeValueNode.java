package com.ciro.jstitch.ir;

/**
 * Parte literal del valor de un atributo.
 */
public class AttributeValueNode extends IrNode {

    public static AttributeValueNode of(String value) {
        AttributeValueNode node = new AttributeValueNode();
        node.children.add(TokenNode.markup(value));
        return node;
    }

    public String content() {
        StringBuilder sb = new StringBuilder();
        for (IrNode child : children) {
            if (child instanceof TokenNode token) sb.append(token.content);
        }
        return sb.toString();
    }
}
