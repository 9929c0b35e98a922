package com.ciro.jstitch.codegen;

import com.ciro.jstitch.ir.ConstructNode;
import com.ciro.jstitch.ir.ElementNode;

/**
 * Punto de extensión del emisor: cada destino decide cómo se escriben elementos,
 * componentes y la apertura de un atributo.
 */
public abstract class NodeWriter {

    /** Escribe el comienzo de {@code target.addAttribute(seq, "key", } sin el valor. */
    public abstract void beginWriteAttribute(CodeWriter writer, String key);

    public abstract void writeElement(RenderContext context, ElementNode node);

    public abstract void writeComponent(RenderContext context, ConstructNode node);
}
