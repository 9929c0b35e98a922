package com.ciro.jstitch.passes;

import com.ciro.jstitch.ir.ConstructNode;

/**
 * Pregunta externa: ¿esta construcción es un componente de verdad?
 * La respuesta viene de las reglas del matcher, nunca del propio nodo.
 */
@FunctionalInterface
public interface ComponentClassifier {

    boolean isComponent(ConstructNode node);

    /** Componente = tag que empieza por mayúscula (la convención de las plantillas). */
    static ComponentClassifier byTagCase() {
        return node -> !node.tagName.isEmpty() && Character.isUpperCase(node.tagName.charAt(0));
    }
}
