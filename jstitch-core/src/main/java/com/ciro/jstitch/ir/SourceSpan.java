package com.ciro.jstitch.ir;

/**
 * Posición de un nodo en la plantilla original.
 */
public record SourceSpan(String filePath, int absoluteIndex, int length) {

    /** Sub-rango que empieza {@code offset} caracteres después de este. */
    public SourceSpan slice(int offset, int length) {
        return new SourceSpan(filePath, absoluteIndex + offset, length);
    }
}
