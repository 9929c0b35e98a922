package com.ciro.jstitch.ir;

import java.util.List;

/**
 * Construcción de alto nivel reconocida por el matcher externo (un componente candidato).
 * Si al final resulta no ser un componente, {@code OrphanLoweringPass} la convierte
 * de vuelta en un {@link ElementNode}.
 */
public class ConstructNode extends IrNode {
    public final String tagName;
    /** Reglas del matcher que reconocieron este tag. */
    public final List<String> matchedRules;

    public ConstructNode(String tagName, List<String> matchedRules) {
        this.tagName = tagName;
        this.matchedRules = List.copyOf(matchedRules);
    }

    public ConstructNode(String tagName) {
        this(tagName, List.of());
    }

    /** El cuerpo, o {@code null} si el matcher no lo generó. */
    public ConstructBodyNode body() {
        for (IrNode child : children) {
            if (child instanceof ConstructBodyNode b) return b;
        }
        return null;
    }

    @Override
    public String toString() {
        return "Construct<" + tagName + ">" + children;
    }
}
