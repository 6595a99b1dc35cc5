package org.sysmlite.frontend.parser.ast;

/**
 * Keys of {@link AstNode#properties()}. A key is present only when the
 * corresponding optional syntax appeared in the source.
 */
public final class PropertyKeys {

    /** The element name. Valid on every node type except root. */
    public static final String NAME = "name";
    /** The specialized part name. Valid on parts. */
    public static final String SPECIALIZES = "specializes";
    /** The declared type after {@code :}. Valid on attributes and ports. */
    public static final String PROP_TYPE = "propType";
    /** The default value after {@code =}, a {@link Double} or a {@link String}. Valid on attributes. */
    public static final String DEFAULT_VALUE = "defaultValue";
    /** The first endpoint after {@code :}. Valid on connections. */
    public static final String FROM_REF = "fromRef";
    /** The second endpoint. Valid on connections. */
    public static final String TO_REF = "toRef";

    private PropertyKeys() {}
}
