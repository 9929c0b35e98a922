package com.ciro.jstitch.ir;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Elemento HTML ya estructurado.
 * Los {@link AttributeNode} van siempre antes que el cuerpo.
 */
public class ElementNode extends IrNode {
    public final String tagName;

    public ElementNode(String tagName) {
        this.tagName = tagName;
    }

    public List<AttributeNode> attributes() {
        return children.stream()
                .filter(AttributeNode.class::isInstance)
                .map(AttributeNode.class::cast)
                .collect(Collectors.toList());
    }

    public List<IrNode> body() {
        return children.stream()
                .filter(c -> !(c instanceof AttributeNode))
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "Element<" + tagName + ">" + children;
    }
}
