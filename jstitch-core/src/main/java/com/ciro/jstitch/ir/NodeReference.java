package com.ciro.jstitch.ir;

/**
 * Dirección de un hijo: (padre, índice). Permite recolectar primero y reescribir después
 * sin mutar el árbol mientras se recorre.
 */
public record NodeReference(IrNode parent, int index) {

    public IrNode node() {
        return parent.children.get(index);
    }

    /** Sustituye el nodo de esta posición y devuelve el anterior. */
    public IrNode replaceWith(IrNode replacement) {
        return parent.children.set(index, replacement);
    }
}
