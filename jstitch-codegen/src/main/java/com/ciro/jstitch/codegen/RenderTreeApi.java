package com.ciro.jstitch.codegen;

/**
 * Nombres de la API del builder de runtime que invoca el código generado.
 */
public final class RenderTreeApi {

    private RenderTreeApi() {}

    public static final String OPEN_ELEMENT = "openElement";
    public static final String CLOSE_ELEMENT = "closeElement";
    public static final String OPEN_COMPONENT = "openComponent";
    public static final String CLOSE_COMPONENT = "closeComponent";
    public static final String ADD_ATTRIBUTE = "addAttribute";
    public static final String ADD_CONTENT = "addContent";
}
