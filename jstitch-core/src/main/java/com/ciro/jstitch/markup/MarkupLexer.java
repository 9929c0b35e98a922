package com.ciro.jstitch.markup;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Tokenizador HTML incremental (pull): cada {@link #next()} devuelve un token.
 * No decodifica entidades en el texto: el texto sale tal cual lo escribió el autor.
 * <p>
 * Si la entrada se acaba a mitad de una etiqueta ({@code <foo bar="17" baz="}) devuelve
 * {@link TokenType#END_OF_INPUT} y {@link #consumed()} apunta al {@code <} de esa etiqueta,
 * para que el llamador guarde el resto y lo complete con el siguiente fragmento.
 */
public class MarkupLexer {

    public enum TokenType {
        TEXT,
        START_TAG,
        END_TAG,
        COMMENT,
        DOCTYPE,
        END_OF_INPUT
    }

    /**
     * @param position offset del primer carácter del token dentro de la entrada
     * @param name     nombre de la etiqueta en minúsculas (solo START_TAG / END_TAG)
     * @param data     texto, contenido del comentario o del doctype
     */
    public record Token(TokenType type, int position, int length, String name, String data,
                        Map<String, String> attributes, boolean selfClosing) {

        static Token text(int position, String data) {
            return new Token(TokenType.TEXT, position, data.length(), "", data, Map.of(), false);
        }

        static Token of(TokenType type, int position, int length, String data) {
            return new Token(type, position, length, "", data, Map.of(), false);
        }

        public boolean isTag() {
            return type == TokenType.START_TAG || type == TokenType.END_TAG;
        }
    }

    private final String input;
    private final int len;
    private int i = 0;
    private int consumed = -1;

    public MarkupLexer(String input) {
        this.input = input == null ? "" : input;
        this.len = this.input.length();
    }

    /**
     * Offset donde se detuvo el escaneo. Igual a la longitud de la entrada salvo que
     * haya quedado una etiqueta sin cerrar.
     */
    public int consumed() {
        return consumed < 0 ? i : consumed;
    }

    public boolean isIncomplete() {
        return consumed() < len;
    }

    public Token next() {
        if (consumed >= 0 || i >= len) {
            if (consumed < 0) consumed = len;
            return Token.of(TokenType.END_OF_INPUT, consumed, 0, "");
        }

        if (input.charAt(i) == '<') {
            Token markup = readMarkup();
            if (markup != null) return markup;
        }
        return readText();
    }

    // ==============================================================
    // Texto plano: hasta el siguiente '<' que abra algo
    // ==============================================================
    private Token readText() {
        int start = i;
        i++; // el primer carácter siempre es texto (puede ser un '<' suelto)
        while (i < len && !opensMarkup(i)) i++;
        return Token.text(start, input.substring(start, i));
    }

    private boolean opensMarkup(int at) {
        if (input.charAt(at) != '<' || at + 1 >= len) return false;
        char c = input.charAt(at + 1);
        return isAsciiLetter(c) || c == '/' || c == '!' || c == '?';
    }

    // ==============================================================
    // '<' : etiqueta, comentario, doctype... o texto si no encaja
    // ==============================================================
    private Token readMarkup() {
        int start = i;
        if (start + 1 >= len) return null;
        char c = input.charAt(start + 1);

        if (isAsciiLetter(c)) {
            return readTag(start, false, start + 1);
        }

        if (c == '/') {
            if (start + 2 >= len) return null; // "</" al final es texto
            char c2 = input.charAt(start + 2);
            if (isAsciiLetter(c2)) return readTag(start, true, start + 2);
            if (c2 == '>') {
                // "</>" no produce nada útil
                i = start + 3;
                return Token.of(TokenType.COMMENT, start, 3, "");
            }
            return readBogusComment(start, start + 2);
        }

        if (c == '!') {
            if (input.startsWith("<!--", start)) return readComment(start);
            if (input.regionMatches(true, start + 2, "DOCTYPE", 0, 7)) return readDoctype(start);
            return readBogusComment(start, start + 2);
        }

        if (c == '?') {
            return readBogusComment(start, start + 1);
        }
        return null;
    }

    private Token readComment(int start) {
        int dataStart = start + 4;
        int close = input.indexOf("-->", dataStart);
        if (close < 0) {
            // Comentario sin cerrar: se come hasta el final
            i = len;
            return Token.of(TokenType.COMMENT, start, len - start, input.substring(dataStart));
        }
        i = close + 3;
        return Token.of(TokenType.COMMENT, start, i - start, input.substring(dataStart, close));
    }

    private Token readDoctype(int start) {
        int dataStart = start + 9;
        int close = input.indexOf('>', dataStart);
        int end = close < 0 ? len : close;
        i = close < 0 ? len : close + 1;
        String data = dataStart < end ? input.substring(dataStart, end).trim() : "";
        return Token.of(TokenType.DOCTYPE, start, i - start, data);
    }

    private Token readBogusComment(int start, int dataStart) {
        int close = input.indexOf('>', dataStart);
        int end = close < 0 ? len : close;
        i = close < 0 ? len : close + 1;
        return Token.of(TokenType.COMMENT, start, i - start, input.substring(dataStart, end));
    }

    // ==============================================================
    // Etiquetas: <name attr="v" attr2='v' attr3=v bool /> y </name>
    // ==============================================================
    private Token readTag(int start, boolean isEnd, int nameStart) {
        int j = nameStart;
        while (j < len && !isTagNameEnd(input.charAt(j))) j++;
        String name = input.substring(nameStart, j).toLowerCase(Locale.ROOT);

        Map<String, String> attributes = new LinkedHashMap<>();
        boolean selfClosing = false;

        while (true) {
            j = skipWhitespace(j);
            if (j >= len) return incomplete(start);

            char c = input.charAt(j);
            if (c == '>') {
                j++;
                break;
            }
            if (c == '/') {
                if (j + 1 >= len) return incomplete(start);
                if (input.charAt(j + 1) == '>') {
                    selfClosing = true;
                    j += 2;
                    break;
                }
                j++;
                continue;
            }

            // Nombre del atributo (se respeta lo que escribió el autor)
            int attrStart = j;
            j++;
            while (j < len && !isAttributeNameEnd(input.charAt(j))) j++;
            String attrName = input.substring(attrStart, j);

            j = skipWhitespace(j);
            if (j >= len) return incomplete(start);

            String value = "";
            if (input.charAt(j) == '=') {
                j = skipWhitespace(j + 1);
                if (j >= len) return incomplete(start);

                char q = input.charAt(j);
                if (q == '"' || q == '\'') {
                    int close = input.indexOf(q, j + 1);
                    if (close < 0) return incomplete(start);
                    value = input.substring(j + 1, close);
                    j = close + 1;
                } else {
                    int valueStart = j;
                    while (j < len && !isWhitespace(input.charAt(j)) && input.charAt(j) != '>') j++;
                    if (j >= len) return incomplete(start);
                    value = input.substring(valueStart, j);
                }
            }
            // El primero gana, como en HTML
            attributes.putIfAbsent(attrName, value);
        }

        i = j;
        if (isEnd) {
            return new Token(TokenType.END_TAG, start, j - start, name, "", Map.of(), selfClosing);
        }
        return new Token(TokenType.START_TAG, start, j - start, name, "",
                Collections.unmodifiableMap(attributes), selfClosing);
    }

    private Token incomplete(int start) {
        consumed = start;
        i = len;
        return Token.of(TokenType.END_OF_INPUT, start, 0, "");
    }

    private int skipWhitespace(int j) {
        while (j < len && isWhitespace(input.charAt(j))) j++;
        return j;
    }

    private static boolean isTagNameEnd(char c) {
        return isWhitespace(c) || c == '/' || c == '>';
    }

    private static boolean isAttributeNameEnd(char c) {
        return isWhitespace(c) || c == '/' || c == '>' || c == '=';
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
