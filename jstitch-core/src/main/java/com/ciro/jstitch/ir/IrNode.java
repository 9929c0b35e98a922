package com.ciro.jstitch.ir;

import com.ciro.jstitch.diagnostics.IrDiagnostic;
import java.util.ArrayList;
import java.util.List;

/**
 * Nodo base del árbol intermedio.
 * Los hijos van en orden de documento y no hay referencias al padre:
 * quien quiera reescribir un hijo usa {@link NodeReference}.
 */
public abstract class IrNode {
    public final List<IrNode> children = new ArrayList<>();
    public final List<IrDiagnostic> diagnostics = new ArrayList<>();
    public SourceSpan source;

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    /** Nombre corto del tipo de nodo, usado en el volcado JSON y en los logs. */
    public String kind() {
        return getClass().getSimpleName().replace("Node", "");
    }

    @Override
    public String toString() {
        return kind() + children;
    }
}
