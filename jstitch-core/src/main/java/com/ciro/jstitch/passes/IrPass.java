package com.ciro.jstitch.passes;

import com.ciro.jstitch.ir.DocumentNode;

/**
 * Transformación del árbol de un documento. El pipeline las ejecuta por {@link #order()} ascendente.
 */
public interface IrPass {

    int order();

    void execute(DocumentNode document);

    default String name() {
        return getClass().getSimpleName();
    }
}
