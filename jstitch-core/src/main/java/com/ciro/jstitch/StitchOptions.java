package com.ciro.jstitch;

import java.util.Properties;

/**
 * Opciones del compilador. Todas tienen un valor por defecto razonable;
 * {@link #fromProperties(Properties)} lee las claves {@code jstitch.*}.
 */
public class StitchOptions {

    public static final String PREFIX = "jstitch.";

    /** Descarta el texto en blanco que queda fuera de cualquier elemento */
    private boolean discardOuterWhitespace = true;
    /** Decodifica entidades (&amp;amp; etc.) en los valores literales de atributos */
    private boolean decodeAttributeEntities = true;
    /** Nombre de la variable del builder en el ámbito más externo */
    private String builderVariable = "builder";
    /** Atributo que recibe el contenido hijo de un componente */
    private String childContentAttribute = "ChildContent";
    /** Tipo al que se castea la lambda del contenido hijo */
    private String fragmentType = "RenderFragment";

    public static StitchOptions defaults() {
        return new StitchOptions();
    }

    public static StitchOptions fromProperties(Properties props) {
        StitchOptions o = new StitchOptions();
        o.setDiscardOuterWhitespace(bool(props, "discard-outer-whitespace", o.discardOuterWhitespace));
        o.setDecodeAttributeEntities(bool(props, "decode-attribute-entities", o.decodeAttributeEntities));
        o.setBuilderVariable(props.getProperty(PREFIX + "builder-variable", o.builderVariable).trim());
        o.setChildContentAttribute(props.getProperty(PREFIX + "child-content-attribute", o.childContentAttribute).trim());
        o.setFragmentType(props.getProperty(PREFIX + "fragment-type", o.fragmentType).trim());
        return o;
    }

    private static boolean bool(Properties props, String key, boolean def) {
        String v = props.getProperty(PREFIX + key);
        if (v == null || v.isBlank()) return def;
        return Boolean.parseBoolean(v.trim());
    }

    public boolean isDiscardOuterWhitespace() { return discardOuterWhitespace; }
    public void setDiscardOuterWhitespace(boolean discardOuterWhitespace) { this.discardOuterWhitespace = discardOuterWhitespace; }

    public boolean isDecodeAttributeEntities() { return decodeAttributeEntities; }
    public void setDecodeAttributeEntities(boolean decodeAttributeEntities) { this.decodeAttributeEntities = decodeAttributeEntities; }

    public String getBuilderVariable() { return builderVariable; }
    public void setBuilderVariable(String builderVariable) {
        if (builderVariable == null || builderVariable.isEmpty()) {
            throw new IllegalArgumentException("builderVariable must not be empty");
        }
        this.builderVariable = builderVariable;
    }

    public String getChildContentAttribute() { return childContentAttribute; }
    public void setChildContentAttribute(String childContentAttribute) { this.childContentAttribute = childContentAttribute; }

    public String getFragmentType() { return fragmentType; }
    public void setFragmentType(String fragmentType) { this.fragmentType = fragmentType; }
}
