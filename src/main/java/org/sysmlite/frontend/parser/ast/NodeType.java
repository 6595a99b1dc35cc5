package org.sysmlite.frontend.parser.ast;

/**
 * The type tags of AST nodes. The {@link #tag()} is the lower-case name
 * downstream consumers switch on.
 */
public enum NodeType {
    ROOT("root"),
    PACKAGE("package"),
    PART("part"),
    ATTRIBUTE("attribute"),
    PORT("port"),
    CONNECTION("connection"),
    REQUIREMENT("requirement"),
    USECASE("usecase"),
    GENERIC("generic");

    private final String tag;

    NodeType(String tag) {
        this.tag = tag;
    }

    /**
     * @return The lower-case tag of this node type, e.g. {@code "usecase"}.
     */
    public String tag() {
        return tag;
    }

    @Override
    public String toString() {
        return tag;
    }
}
