package com.ciro.jstitch.passes;

import com.ciro.jstitch.StitchOptions;
import com.ciro.jstitch.ir.DocumentNode;
import com.ciro.jstitch.ir.IrNode;
import com.ciro.jstitch.ir.MarkupNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Reescribe el HTML opaco del documento como árbol de elementos y atributos.
 * <p>
 * Recorrido post-orden: primero se estructuran los hijos y después el padre, así un
 * contenedor solo ve hijos ya resueltos o huecos opacos. El parser garantiza que el HTML
 * está bien anidado dentro de los hijos de cada contenedor, nada más.
 */
public class StructuringPass implements IrPass {

    private static final Logger log = LoggerFactory.getLogger(StructuringPass.class);

    public static final int ORDER = 100;

    private final StitchOptions options;

    public StructuringPass(StitchOptions options) {
        this.options = options;
    }

    @Override
    public int order() {
        return ORDER;
    }

    @Override
    public void execute(DocumentNode document) {
        int rewritten = visit(document);
        log.debug("Structured {} containers in document '{}'", rewritten, document.name);
    }

    private int visit(IrNode node) {
        int rewritten = 0;
        boolean foundMarkup = false;
        // Por índice: los hijos se reescriben en su sitio, la lista no cambia de tamaño aquí
        for (int i = 0; i < node.children.size(); i++) {
            IrNode child = node.children.get(i);
            rewritten += visit(child);
            if (child instanceof MarkupNode) {
                foundMarkup = true;
            }
        }

        if (foundMarkup) {
            List<IrNode> structured = new MarkupTreeBuilder(options).structure(node.children);
            node.children.clear();
            node.children.addAll(structured);
            rewritten++;
        }
        return rewritten;
    }
}
