package com.ciro.jstitch.ir;

final class CodeText {

    private CodeText() {}

    static String of(IrNode node) {
        StringBuilder sb = new StringBuilder();
        for (IrNode child : node.children) {
            if (child instanceof TokenNode token && !token.isMarkup()) sb.append(token.content);
        }
        return sb.toString();
    }
}
