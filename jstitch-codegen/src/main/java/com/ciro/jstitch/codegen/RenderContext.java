package com.ciro.jstitch.codegen;

import com.ciro.jstitch.StitchOptions;

/**
 * Lo que comparte una emisión: el código de salida, el escritor de nodos y las opciones.
 */
public record RenderContext(CodeWriter writer, NodeWriter nodeWriter, StitchOptions options) {
}
