package com.ciro.jstitch.diagnostics;

import com.ciro.jstitch.ir.SourceSpan;

/**
 * Error o aviso para el autor de la plantilla. Va pegado al nodo afectado;
 * el driver lo recoge al final del documento.
 */
public record IrDiagnostic(String id, Severity severity, SourceSpan source, String message) {

    public enum Severity {
        WARNING,
        ERROR
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        String where = source == null ? "" : source.filePath() + "(" + source.absoluteIndex() + "): ";
        return where + severity.name().toLowerCase() + " " + id + ": " + message;
    }
}
