package com.ciro.jstitch.passes;

import com.ciro.jstitch.diagnostics.InternalCompilerException;
import com.ciro.jstitch.ir.AttributeNode;
import com.ciro.jstitch.ir.ConstructAttributeNode;
import com.ciro.jstitch.ir.ConstructBodyNode;
import com.ciro.jstitch.ir.ConstructNode;
import com.ciro.jstitch.ir.DocumentNode;
import com.ciro.jstitch.ir.ElementNode;
import com.ciro.jstitch.ir.IrNode;
import com.ciro.jstitch.ir.NodeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Algunas reglas del matcher se aplican a elementos HTML normales, y entonces el elemento entero
 * llega como {@link ConstructNode}. Este pase devuelve esas construcciones "huérfanas"
 * (las que no son componentes) a {@link ElementNode}, aplanando atributos y cuerpo.
 * <p>
 * Dos fases: recolección de solo lectura (post-orden, hojas primero) y reescritura.
 * Como cada reescritura sustituye un hijo por otro en la misma posición, las
 * referencias pendientes a los ancestros siguen siendo válidas.
 */
public class OrphanLoweringPass implements IrPass {

    private static final Logger log = LoggerFactory.getLogger(OrphanLoweringPass.class);

    public static final int ORDER = 1000;

    private final ComponentClassifier classifier;

    public OrphanLoweringPass(ComponentClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public int order() {
        return ORDER;
    }

    @Override
    public void execute(DocumentNode document) {
        List<NodeReference> orphans = new ArrayList<>();
        collect(document, orphans);

        for (NodeReference reference : orphans) {
            ConstructNode construct = (ConstructNode) reference.node();
            reference.replaceWith(lower(construct));
        }

        if (!orphans.isEmpty()) {
            log.debug("Lowered {} orphan constructs in document '{}'", orphans.size(), document.name);
        }
    }

    /** Recolecta en post-orden los (padre, índice) de las construcciones que no son componentes. */
    List<NodeReference> collect(IrNode node, List<NodeReference> into) {
        for (int i = 0; i < node.children.size(); i++) {
            IrNode child = node.children.get(i);
            collect(child, into);
            if (child instanceof ConstructNode construct && !classifier.isComponent(construct)) {
                into.add(new NodeReference(node, i));
            }
        }
        return into;
    }

    private ElementNode lower(ConstructNode construct) {
        ElementNode element = new ElementNode(construct.tagName);
        element.source = construct.source;
        element.diagnostics.addAll(construct.diagnostics);

        // Primero atributos (el cuerpo suele venir antes, lo dejamos para el final)
        ConstructBodyNode body = null;
        for (IrNode child : construct.children) {
            if (child instanceof ConstructBodyNode b) {
                body = b;
            } else if (child instanceof ConstructAttributeNode attribute) {
                element.children.add(lowerAttribute(attribute));
            } else {
                // No debería aparecer nada más, pero por si acaso se conserva tal cual
                element.children.add(child);
            }
        }

        if (body == null) {
            throw new InternalCompilerException("construct <" + construct.tagName + "> has no body node");
        }
        element.children.addAll(body.children);
        return element;
    }

    private static AttributeNode lowerAttribute(ConstructAttributeNode attribute) {
        AttributeNode node = new AttributeNode(attribute.attributeName);
        node.source = attribute.source;
        node.children.addAll(attribute.children);
        node.diagnostics.addAll(attribute.diagnostics);
        return node;
    }
}
