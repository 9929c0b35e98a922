package com.ciro.jstitch.ir;

/**
 * Expresión de código embebida en el cuerpo ({@code @hello}).
 */
public class ExpressionNode extends IrNode {

    public static ExpressionNode of(String code) {
        ExpressionNode node = new ExpressionNode();
        node.children.add(TokenNode.code(code));
        return node;
    }

    public String code() {
        return CodeText.of(this);
    }
}
