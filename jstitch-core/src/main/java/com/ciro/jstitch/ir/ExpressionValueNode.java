package com.ciro.jstitch.ir;

/**
 * Expresión de código usada como (parte del) valor de un atributo ({@code title="hi @there"}).
 */
public class ExpressionValueNode extends IrNode {

    public static ExpressionValueNode of(String code) {
        ExpressionValueNode node = new ExpressionValueNode();
        node.children.add(TokenNode.code(code));
        return node;
    }

    public String code() {
        return CodeText.of(this);
    }
}
