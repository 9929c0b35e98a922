package com.ciro.jstitch.ir;

/**
 * Fragmento de HTML crudo.
 * Antes de estructurar es HTML opaco (puede contener etiquetas a medias);
 * después solo aparece como texto dentro de un elemento.
 */
public class MarkupNode extends IrNode {

    public static MarkupNode of(String text) {
        MarkupNode node = new MarkupNode();
        node.children.add(TokenNode.markup(text));
        return node;
    }

    public static MarkupNode of(String text, SourceSpan source) {
        MarkupNode node = of(text);
        node.source = source;
        return node;
    }

    /** Concatena los tokens de markup; los de código se ignoran. */
    public String content() {
        StringBuilder sb = new StringBuilder();
        for (IrNode child : children) {
            if (child instanceof TokenNode token && token.isMarkup()) {
                sb.append(token.content);
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "Markup(" + content() + ")";
    }
}
