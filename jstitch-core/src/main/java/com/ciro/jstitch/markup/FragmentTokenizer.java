package com.ciro.jstitch.markup;

import java.util.ArrayList;
import java.util.List;

/**
 * Alimenta el {@link MarkupLexer} fragmento a fragmento.
 * Lo que el lexer no pudo consumir (una etiqueta partida por un hueco de código)
 * se guarda y se antepone al siguiente fragmento.
 */
public class FragmentTokenizer {

    /**
     * Resultado de escanear un fragmento.
     *
     * @param text          texto realmente escaneado (resto previo + fragmento)
     * @param carriedLength cuántos caracteres de {@code text} venían del resto previo
     * @param tokens        tokens en orden, terminando en END_OF_INPUT
     * @param consumed      offset en {@code text} donde se paró el escaneo
     */
    public record Scan(String text, int carriedLength, List<MarkupLexer.Token> tokens, int consumed) {

        public boolean isComplete() {
            return consumed >= text.length();
        }
    }

    private String remainder = "";

    public Scan feed(String fragment) {
        String text = remainder + (fragment == null ? "" : fragment);
        int carried = remainder.length();
        remainder = "";

        MarkupLexer lexer = new MarkupLexer(text);
        List<MarkupLexer.Token> tokens = new ArrayList<>();
        MarkupLexer.Token token;
        do {
            token = lexer.next();
            tokens.add(token);
        } while (token.type() != MarkupLexer.TokenType.END_OF_INPUT);

        int consumed = lexer.consumed();
        if (consumed < text.length()) {
            remainder = text.substring(consumed);
        }
        return new Scan(text, carried, tokens, consumed);
    }

    public boolean hasRemainder() {
        return !remainder.isEmpty();
    }

    public String remainder() {
        return remainder;
    }
}
