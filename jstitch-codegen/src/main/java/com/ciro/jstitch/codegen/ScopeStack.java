package com.ciro.jstitch.codegen;

import com.ciro.jstitch.diagnostics.InternalCompilerException;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sigue el anidamiento de elementos y componentes mientras se emite el código.
 * <p>
 * Cuando un componente recibe su primer hijo se abre una lambda que captura el contenido
 * hijo ({@code ChildContent}); se cierra al cerrar el ámbito del componente. Cada nivel de
 * lambda usa su propia variable de builder: {@code builder}, {@code builder2}, {@code builder3}...
 */
public class ScopeStack {

    private final Deque<ScopeEntry> stack = new ArrayDeque<>();
    private final String baseVarName;
    private int builderVarNumber = 1;
    private String builderVarName;
    private boolean finished;

    public ScopeStack(String baseVarName) {
        this.baseVarName = baseVarName;
        this.builderVarName = baseVarName;
    }

    public ScopeStack() {
        this("builder");
    }

    /** Variable de builder del ámbito de emisión actual. */
    public String builderVarName() {
        return builderVarName;
    }

    public int depth() {
        return stack.size();
    }

    public void openScope(String tagName, boolean isComponent) {
        checkNotFinished();
        stack.push(new ScopeEntry(tagName, isComponent));
    }

    public void closeScope(RenderContext context) {
        checkNotFinished();
        if (stack.isEmpty()) {
            throw new InternalCompilerException("closeScope called on an empty scope stack");
        }
        ScopeEntry current = stack.pop();

        // Componente con hijos: toca cerrar la lambda
        if (current.closure != null) {
            current.closure.end();
            current.closure = null;
            context.writer().write(")");
            context.writer().writeEndMethodInvocation();
            offsetBuilderVarNumber(-1);
        }
    }

    /**
     * Anota un hijo más en el ámbito actual. Con la pila vacía (nivel superior) no hace nada.
     */
    public void incrementCurrentScopeChildCount(RenderContext context) {
        checkNotFinished();
        if (stack.isEmpty()) {
            return;
        }
        ScopeEntry current = stack.peek();

        if (current.isComponent && current.childCount == 0) {
            // Primer hijo de un componente: se abre la lambda de ChildContent
            CodeWriter writer = context.writer();
            context.nodeWriter().beginWriteAttribute(writer, context.options().getChildContentAttribute());
            offsetBuilderVarNumber(1);
            writer.write("(").write(context.options().getFragmentType()).write(")(");
            current.closure = writer.buildLambda(builderVarName);
        }

        current.childCount++;
    }

    /**
     * Fin de la emisión. Después de esto cualquier llamada es un error interno.
     */
    public void finish() {
        checkNotFinished();
        if (!stack.isEmpty()) {
            throw new InternalCompilerException("scope <" + stack.peek().tagName + "> was never closed");
        }
        finished = true;
    }

    private void checkNotFinished() {
        if (finished) {
            throw new InternalCompilerException("scope stack used after it was fully unwound");
        }
    }

    private void offsetBuilderVarNumber(int delta) {
        builderVarNumber += delta;
        builderVarName = builderVarNumber == 1
                ? baseVarName
                : baseVarName + builderVarNumber;
    }

    private static final class ScopeEntry {
        final String tagName;
        final boolean isComponent;
        int childCount;
        CodeWriter.ClosureHandle closure;

        ScopeEntry(String tagName, boolean isComponent) {
            this.tagName = tagName;
            this.isComponent = isComponent;
        }
    }
}
