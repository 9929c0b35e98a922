package com.ciro.jstitch.ir;

/**
 * Atributo HTML capturado por una {@link ConstructNode}.
 */
public class ConstructAttributeNode extends IrNode {
    public final String attributeName;

    public ConstructAttributeNode(String attributeName) {
        this.attributeName = attributeName;
    }

    @Override
    public String toString() {
        return "ConstructAttribute(" + attributeName + ")" + children;
    }
}
