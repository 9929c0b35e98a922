package com.ciro.jstitch.ir;

/**
 * Bloque de sentencias ({@code @if (x) { ... }}). Se emite tal cual.
 */
public class CodeBlockNode extends IrNode {

    public static CodeBlockNode of(String code) {
        CodeBlockNode node = new CodeBlockNode();
        node.children.add(TokenNode.code(code));
        return node;
    }

    public String code() {
        return CodeText.of(this);
    }
}
