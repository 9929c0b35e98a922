package com.ciro.jstitch.codegen;

import com.ciro.jstitch.diagnostics.InternalCompilerException;
import com.fasterxml.jackson.core.io.JsonStringEncoder;

/**
 * Acumula el código generado, con indentación automática al principio de cada línea.
 */
public class CodeWriter {

    private static final String INDENT = "    ";

    private final StringBuilder sb = new StringBuilder();
    private int indent = 0;
    private boolean atLineStart = true;

    public CodeWriter write(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                sb.append('\n');
                atLineStart = true;
                continue;
            }
            if (atLineStart) {
                sb.append(INDENT.repeat(indent));
                atLineStart = false;
            }
            sb.append(c);
        }
        return this;
    }

    public CodeWriter writeLine(String text) {
        return write(text).writeLine();
    }

    public CodeWriter writeLine() {
        sb.append('\n');
        atLineStart = true;
        return this;
    }

    /** Escribe {@code value} como literal de cadena entre comillas, con los escapes necesarios. */
    public CodeWriter writeStringLiteral(String value) {
        char[] escaped = JsonStringEncoder.getInstance().quoteAsString(value);
        return write("\"").write(new String(escaped)).write("\"");
    }

    public CodeWriter writeStartMethodInvocation(String target, String method) {
        return write(target).write(".").write(method).write("(");
    }

    public CodeWriter writeEndMethodInvocation() {
        return writeLine(");");
    }

    /**
     * Abre una lambda de un parámetro. El llamador es responsable de cerrar el handle
     * con {@link ClosureHandle#end()} exactamente una vez.
     */
    public ClosureHandle buildLambda(String parameter) {
        write("(").write(parameter).write(") -> {").writeLine();
        indent++;
        return new ClosureHandle(this);
    }

    public int indentLevel() {
        return indent;
    }

    public String generatedCode() {
        return sb.toString();
    }

    @Override
    public String toString() {
        return sb.toString();
    }

    /**
     * Lambda abierta en el código generado.
     */
    public static final class ClosureHandle {
        private final CodeWriter writer;
        private boolean ended;

        private ClosureHandle(CodeWriter writer) {
            this.writer = writer;
        }

        public void end() {
            if (ended) {
                throw new InternalCompilerException("closure ended twice");
            }
            ended = true;
            writer.indent--;
            writer.write("}");
        }

        public boolean isEnded() {
            return ended;
        }
    }
}
