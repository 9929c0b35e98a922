package com.ciro.jstitch.diagnostics;

/**
 * Fallo de un invariante interno: el contrato con el parser (o con el emisor) se rompió.
 * No es un error del usuario; aborta el documento actual pero no el lote.
 */
public class InternalCompilerException extends RuntimeException {

    public InternalCompilerException(String message) {
        super("Internal compiler error: " + message);
    }

    public InternalCompilerException(String message, Throwable cause) {
        super("Internal compiler error: " + message, cause);
    }
}
