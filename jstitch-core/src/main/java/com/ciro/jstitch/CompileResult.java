package com.ciro.jstitch;

import com.ciro.jstitch.diagnostics.InternalCompilerException;
import com.ciro.jstitch.diagnostics.IrDiagnostic;
import com.ciro.jstitch.ir.DocumentNode;

import java.util.List;

/**
 * Resultado de compilar un documento.
 *
 * @param failure fallo interno que abortó el documento, o {@code null}
 */
public record CompileResult(DocumentNode document, List<IrDiagnostic> diagnostics, InternalCompilerException failure) {

    public CompileResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean isAborted() {
        return failure != null;
    }

    public boolean isSuccess() {
        return failure == null && diagnostics.stream().noneMatch(IrDiagnostic::isError);
    }
}
