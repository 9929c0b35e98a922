package com.ciro.jstitch.diagnostics;

import com.ciro.jstitch.ir.SourceSpan;

/**
 * Catálogo de diagnósticos que el usuario puede ver.
 */
public final class DiagnosticFactory {

    public static final String MISMATCHED_CLOSING_TAG = "JST9980";

    private DiagnosticFactory() {}

    public static IrDiagnostic mismatchedClosingTag(SourceSpan source, String expectedTag, String foundTag) {
        return new IrDiagnostic(
                MISMATCHED_CLOSING_TAG,
                IrDiagnostic.Severity.ERROR,
                source,
                "Mismatching closing tag. Found '</" + foundTag + ">' but expected '</" + expectedTag + ">'.");
    }
}
