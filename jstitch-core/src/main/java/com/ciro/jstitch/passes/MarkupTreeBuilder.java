package com.ciro.jstitch.passes;

import com.ciro.jstitch.StitchOptions;
import com.ciro.jstitch.diagnostics.DiagnosticFactory;
import com.ciro.jstitch.diagnostics.InternalCompilerException;
import com.ciro.jstitch.ir.AttributeNode;
import com.ciro.jstitch.ir.AttributeValueNode;
import com.ciro.jstitch.ir.ElementNode;
import com.ciro.jstitch.ir.IrNode;
import com.ciro.jstitch.ir.MarkupNode;
import com.ciro.jstitch.ir.SourceSpan;
import com.ciro.jstitch.markup.FragmentTokenizer;
import com.ciro.jstitch.markup.MarkupLexer;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Convierte los hijos de un contenedor (fragmentos de HTML crudo mezclados con huecos de código)
 * en un árbol de {@link ElementNode} / {@link AttributeNode}.
 * <p>
 * Cada fragmento se tokeniza por separado, así que una etiqueta puede venir partida:
 * <pre>
 *   Markup    &lt;foo bar="17"
 *   Attribute baz = @baz
 *   Markup    /&gt;
 * </pre>
 * El trozo sin consumir se guarda y se completa con el siguiente fragmento, y los
 * {@link AttributeNode} intermedios se cuelgan del siguiente elemento que se abra.
 * Cualquier otro hueco que llegue con la etiqueta a medias va dentro del valor de atributo
 * abierto: {@code <a y="}, {@code @h}, {@code 2">} da {@code y = [h, "2"]}.
 * <p>
 * Un objeto por contenedor: el estado no sobrevive a {@link #structure(List)}.
 */
public class MarkupTreeBuilder {

    private static final Logger log = LoggerFactory.getLogger(MarkupTreeBuilder.class);

    // Elementos HTML5 vacíos: <img> equivale a <img/>
    private static final Set<String> VOID_ELEMENTS = Set.of(
            "area", "base", "br", "col", "embed", "hr", "img", "input",
            "link", "meta", "param", "source", "track", "wbr");

    /** Marco sintético del fondo de la pila: representa al contenedor. */
    private static final class RootFrame extends IrNode {}

    // Marcas de uso privado que sustituyen a un hueco dentro del texto de una etiqueta partida
    private static final char HOLE_START = '\uE000';
    private static final char HOLE_END = '\uE001';

    private final StitchOptions options;
    private final RootFrame root = new RootFrame();
    private final Deque<IrNode> stack = new ArrayDeque<>();
    private final List<AttributeNode> pendingAttributes = new ArrayList<>();
    private final FragmentTokenizer tokenizer = new FragmentTokenizer();
    private final Map<Integer, IrNode> threadedHoles = new LinkedHashMap<>();
    private int holeCounter;

    // Origen del trozo arrastrado, para poder dar posición a lo que empieza en él
    private SourceSpan carriedSource;
    private boolean used;

    public MarkupTreeBuilder(StitchOptions options) {
        this.options = options;
    }

    public static boolean isVoidElement(String tagName) {
        return VOID_ELEMENTS.contains(tagName.toLowerCase(Locale.ROOT));
    }

    /**
     * Estructura la lista de hijos de un contenedor y devuelve la lista que la sustituye.
     *
     * @throws InternalCompilerException si al terminar queda un elemento abierto o HTML sin consumir
     */
    public List<IrNode> structure(List<IrNode> children) {
        if (used) {
            throw new IllegalStateException("MarkupTreeBuilder is single use");
        }
        used = true;
        stack.push(root);

        for (IrNode child : children) {
            if (child instanceof MarkupNode markup) {
                consumeMarkup(markup);
            } else if (child instanceof AttributeNode attribute) {
                // Se escribe junto con la etiqueta que se está abriendo
                pendingAttributes.add(attribute);
            } else if (tokenizer.hasRemainder()) {
                threadIntoTag(child);
            } else {
                // Código u otra cosa ya estructurada
                stack.peek().children.add(child);
            }
        }

        if (stack.peek() != root) {
            String open = stack.peek() instanceof ElementNode el ? el.tagName : stack.peek().kind();
            throw new InternalCompilerException(
                    "unbalanced markup, element <" + open + "> was opened but never closed inside its container");
        }
        if (tokenizer.hasRemainder()) {
            throw new InternalCompilerException(
                    "unconsumed markup left at the end of a container: '" + tokenizer.remainder() + "'");
        }
        if (!threadedHoles.isEmpty()) {
            throw new InternalCompilerException("code hole was left inside an unfinished tag");
        }
        if (!pendingAttributes.isEmpty()) {
            throw new InternalCompilerException(
                    "attribute '" + pendingAttributes.get(0).attributeName + "' has no element to attach to");
        }

        log.debug("Structured {} children into {} nodes", children.size(), root.children.size());
        return new ArrayList<>(root.children);
    }

    private void consumeMarkup(MarkupNode markup) {
        FragmentTokenizer.Scan scan = tokenizer.feed(markup.content());

        for (MarkupLexer.Token token : scan.tokens()) {
            switch (token.type()) {
                case TEXT -> appendText(token, spanOf(scan, markup, token.position(), token.length()));
                case START_TAG, END_TAG -> handleTag(scan, token, spanOf(scan, markup, token.position(), token.length()));
                case COMMENT, END_OF_INPUT -> {
                    // Los comentarios no llegan al árbol
                }
                default -> throw new InternalCompilerException("unsupported markup token type " + token.type());
            }
        }

        if (!scan.isComplete()) {
            // EOF a mitad de una etiqueta: seguramente vienen atributos con código.
            carriedSource = spanOf(scan, markup, scan.consumed(), scan.text().length() - scan.consumed());
        } else {
            carriedSource = null;
            if (!threadedHoles.isEmpty()) {
                throw new InternalCompilerException(
                        "code hole inside a tag is not part of an attribute value: '" + scan.text() + "'");
            }
        }
    }

    /**
     * Un hueco que llega con una etiqueta a medias: se deja una marca en el texto arrastrado
     * y {@link #createAttribute} lo recupera cuando la etiqueta se completa.
     */
    private void threadIntoTag(IrNode hole) {
        int id = holeCounter++;
        threadedHoles.put(id, hole);
        FragmentTokenizer.Scan scan = tokenizer.feed(HOLE_START + Integer.toString(id) + HOLE_END);
        if (scan.isComplete()) {
            throw new InternalCompilerException(
                    "code hole cannot be placed inside the tag '" + scan.text() + "'");
        }
        log.debug("Threaded {} into the unfinished tag '{}'", hole.kind(), tokenizer.remainder());
    }

    private void appendText(MarkupLexer.Token token, SourceSpan span) {
        // Fuera de cualquier etiqueta el espacio en blanco no aporta nada
        if (stack.peek() == root && options.isDiscardOuterWhitespace() && token.data().isBlank()) {
            return;
        }
        stack.peek().children.add(MarkupNode.of(token.data(), span));
    }

    private void handleTag(FragmentTokenizer.Scan scan, MarkupLexer.Token token, SourceSpan span) {
        String tagName = originalCaseName(scan.text(), token);
        if (tagName.indexOf(HOLE_START) >= 0) {
            throw new InternalCompilerException("code hole inside the tag name '" + tagName + "'");
        }

        // </img> y compañía no cierran nada: el elemento vacío ya se cerró al abrirse
        if (token.type() == MarkupLexer.TokenType.END_TAG && isVoidElement(token.name())) {
            log.debug("Ignoring end tag </{}> of a void element", tagName);
            return;
        }

        if (token.type() == MarkupLexer.TokenType.START_TAG) {
            ElementNode element = new ElementNode(tagName);
            element.source = span;
            stack.peek().children.add(element);
            stack.push(element);

            for (Map.Entry<String, String> attr : token.attributes().entrySet()) {
                element.children.add(createAttribute(attr.getKey(), attr.getValue()));
            }
            element.children.addAll(pendingAttributes);
            pendingAttributes.clear();
        }

        if (token.type() == MarkupLexer.TokenType.END_TAG || token.selfClosing() || isVoidElement(token.name())) {
            if (stack.peek() == root) {
                throw new InternalCompilerException("closing tag </" + tagName + "> has no open element in its container");
            }
            ElementNode popped = (ElementNode) stack.pop();
            if (!popped.tagName.equalsIgnoreCase(token.name())) {
                log.debug("Mismatched closing tag: <{}> closed by </{}>", popped.tagName, tagName);
                popped.diagnostics.add(DiagnosticFactory.mismatchedClosingTag(span, popped.tagName, tagName));
            }
        }
    }

    private AttributeNode createAttribute(String name, String value) {
        if (name.indexOf(HOLE_START) >= 0) {
            throw new InternalCompilerException("code hole inside the attribute name '" + name + "'");
        }
        if (value.indexOf(HOLE_START) < 0) {
            return AttributeNode.literal(name, decode(value));
        }

        // Valor mixto: trozos literales intercalados con los huecos marcados
        AttributeNode attribute = new AttributeNode(name);
        int pos = 0;
        while (pos < value.length()) {
            int start = value.indexOf(HOLE_START, pos);
            if (start < 0) {
                attribute.children.add(AttributeValueNode.of(decode(value.substring(pos))));
                break;
            }
            if (start > pos) {
                attribute.children.add(AttributeValueNode.of(decode(value.substring(pos, start))));
            }
            int end = value.indexOf(HOLE_END, start);
            IrNode hole = threadedHoles.remove(Integer.parseInt(value.substring(start + 1, end)));
            if (hole == null) {
                throw new InternalCompilerException("code hole in attribute '" + name + "' was already used");
            }
            attribute.children.add(hole);
            pos = end + 1;
        }
        return attribute;
    }

    private String decode(String value) {
        return options.isDecodeAttributeEntities() ? Parser.unescapeEntities(value, true) : value;
    }

    // El lexer pasa el nombre a minúsculas; nosotros queremos lo que escribió el autor.
    private static String originalCaseName(String text, MarkupLexer.Token token) {
        int offset = token.type() == MarkupLexer.TokenType.END_TAG ? 2 : 1; // "</" o "<"
        int start = token.position() + offset;
        return text.substring(start, start + token.name().length());
    }

    private SourceSpan spanOf(FragmentTokenizer.Scan scan, MarkupNode markup, int offset, int length) {
        if (offset >= scan.carriedLength()) {
            return markup.source == null ? null : markup.source.slice(offset - scan.carriedLength(), length);
        }
        return carriedSource == null ? null : carriedSource.slice(offset, length);
    }
}
