package com.ciro.jstitch.ir;

/**
 * Raíz de una plantilla compilada.
 */
public class DocumentNode extends IrNode {
    public final String name;

    public DocumentNode(String name) {
        this.name = name;
    }
}
