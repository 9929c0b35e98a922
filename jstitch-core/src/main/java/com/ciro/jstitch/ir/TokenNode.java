package com.ciro.jstitch.ir;

/**
 * Hoja con el texto literal tal y como lo escribió el autor.
 */
public class TokenNode extends IrNode {

    public enum Kind {
        MARKUP,
        CODE
    }

    public final Kind tokenKind;
    public final String content;

    public TokenNode(Kind tokenKind, String content) {
        this.tokenKind = tokenKind;
        this.content = content;
    }

    public static TokenNode markup(String content) {
        return new TokenNode(Kind.MARKUP, content);
    }

    public static TokenNode code(String content) {
        return new TokenNode(Kind.CODE, content);
    }

    public boolean isMarkup() {
        return tokenKind == Kind.MARKUP;
    }

    @Override
    public String toString() {
        return tokenKind + "(" + content + ")";
    }
}
