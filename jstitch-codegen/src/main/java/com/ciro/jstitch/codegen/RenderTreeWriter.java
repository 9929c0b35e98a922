package com.ciro.jstitch.codegen;

import com.ciro.jstitch.StitchOptions;
import com.ciro.jstitch.ir.AttributeValueNode;
import com.ciro.jstitch.ir.AttributeNode;
import com.ciro.jstitch.ir.CodeBlockNode;
import com.ciro.jstitch.ir.ConstructAttributeNode;
import com.ciro.jstitch.ir.ConstructBodyNode;
import com.ciro.jstitch.ir.ConstructNode;
import com.ciro.jstitch.ir.DocumentNode;
import com.ciro.jstitch.ir.ElementNode;
import com.ciro.jstitch.ir.ExpressionNode;
import com.ciro.jstitch.ir.ExpressionValueNode;
import com.ciro.jstitch.ir.IrNode;
import com.ciro.jstitch.ir.MarkupNode;
import com.ciro.jstitch.ir.TokenNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Emite las llamadas al builder de runtime para un documento ya estructurado:
 * <pre>
 *   builder.openElement(0, "div");
 *   builder.addAttribute(1, "class", "box");
 *   builder.addContent(2, "Hola");
 *   builder.closeElement();
 * </pre>
 * Las {@link ConstructNode} que siguen en el árbol son componentes (las huérfanas
 * ya se bajaron a elementos).
 */
public class RenderTreeWriter extends NodeWriter {

    private static final Logger log = LoggerFactory.getLogger(RenderTreeWriter.class);

    private final StitchOptions options;
    private ScopeStack scopeStack;
    private int sequence;

    public RenderTreeWriter(StitchOptions options) {
        this.options = options;
    }

    public String writeDocument(DocumentNode document) {
        CodeWriter writer = new CodeWriter();
        scopeStack = new ScopeStack(options.getBuilderVariable());
        sequence = 0;

        RenderContext context = new RenderContext(writer, this, options);
        for (IrNode child : document.children) {
            writeNode(context, child);
        }
        scopeStack.finish();

        log.debug("Emitted {} render tree frames for '{}'", sequence, document.name);
        return writer.generatedCode();
    }

    @Override
    public void beginWriteAttribute(CodeWriter writer, String key) {
        writer.writeStartMethodInvocation(scopeStack.builderVarName(), RenderTreeApi.ADD_ATTRIBUTE)
              .write(String.valueOf(sequence++))
              .write(", ")
              .writeStringLiteral(key)
              .write(", ");
    }

    @Override
    public void writeElement(RenderContext context, ElementNode node) {
        CodeWriter writer = context.writer();
        scopeStack.incrementCurrentScopeChildCount(context);

        writer.writeStartMethodInvocation(scopeStack.builderVarName(), RenderTreeApi.OPEN_ELEMENT)
              .write(String.valueOf(sequence++))
              .write(", ")
              .writeStringLiteral(node.tagName)
              .writeEndMethodInvocation();

        scopeStack.openScope(node.tagName, false);
        for (AttributeNode attribute : node.attributes()) {
            writeAttribute(writer, attribute.attributeName, attribute.children);
        }
        for (IrNode child : node.body()) {
            writeNode(context, child);
        }
        scopeStack.closeScope(context);

        writer.writeStartMethodInvocation(scopeStack.builderVarName(), RenderTreeApi.CLOSE_ELEMENT)
              .writeEndMethodInvocation();
    }

    @Override
    public void writeComponent(RenderContext context, ConstructNode node) {
        CodeWriter writer = context.writer();
        scopeStack.incrementCurrentScopeChildCount(context);

        writer.writeStartMethodInvocation(scopeStack.builderVarName(), RenderTreeApi.OPEN_COMPONENT)
              .write(String.valueOf(sequence++))
              .write(", ")
              .writeStringLiteral(node.tagName)
              .writeEndMethodInvocation();

        scopeStack.openScope(node.tagName, true);

        // Atributos antes que el contenido hijo: la lambda se abre con el primer hijo
        for (IrNode child : node.children) {
            if (child instanceof ConstructAttributeNode attribute) {
                writeAttribute(writer, attribute.attributeName, attribute.children);
            }
        }
        ConstructBodyNode body = node.body();
        if (body != null) {
            for (IrNode child : body.children) {
                writeNode(context, child);
            }
        }
        scopeStack.closeScope(context);

        writer.writeStartMethodInvocation(scopeStack.builderVarName(), RenderTreeApi.CLOSE_COMPONENT)
              .writeEndMethodInvocation();
    }

    private void writeNode(RenderContext context, IrNode node) {
        CodeWriter writer = context.writer();

        if (node instanceof ElementNode el) {
            writeElement(context, el);
        } else if (node instanceof ConstructNode construct) {
            writeComponent(context, construct);
        } else if (node instanceof MarkupNode markup) {
            scopeStack.incrementCurrentScopeChildCount(context);
            writer.writeStartMethodInvocation(scopeStack.builderVarName(), RenderTreeApi.ADD_CONTENT)
                  .write(String.valueOf(sequence++))
                  .write(", ")
                  .writeStringLiteral(markup.content())
                  .writeEndMethodInvocation();
        } else if (node instanceof ExpressionNode expression) {
            scopeStack.incrementCurrentScopeChildCount(context);
            writer.writeStartMethodInvocation(scopeStack.builderVarName(), RenderTreeApi.ADD_CONTENT)
                  .write(String.valueOf(sequence++))
                  .write(", ")
                  .write(expression.code().trim())
                  .writeEndMethodInvocation();
        } else if (node instanceof CodeBlockNode block) {
            scopeStack.incrementCurrentScopeChildCount(context);
            writer.writeLine(block.code().strip());
        } else {
            // Contenedor sin semántica propia: se emiten sus hijos
            for (IrNode child : node.children) {
                writeNode(context, child);
            }
        }
    }

    private void writeAttribute(CodeWriter writer, String name, List<IrNode> value) {
        beginWriteAttribute(writer, name);

        List<String> parts = new ArrayList<>();
        for (IrNode part : value) {
            if (part instanceof AttributeValueNode literal) {
                parts.add(literal(literal.content()));
            } else if (part instanceof ExpressionValueNode expression) {
                parts.add("(" + expression.code().trim() + ")");
            } else if (part instanceof TokenNode token) {
                parts.add(token.isMarkup() ? literal(token.content) : "(" + token.content.trim() + ")");
            }
        }
        writer.write(parts.isEmpty() ? "\"\"" : String.join(" + ", parts));
        writer.writeEndMethodInvocation();
    }

    private static String literal(String value) {
        return new CodeWriter().writeStringLiteral(value).generatedCode();
    }
}
