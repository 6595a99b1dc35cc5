package org.sysmlite.frontend.lexer;

import java.util.Set;

/**
 * The fixed, case-sensitive keyword set of the language.
 */
public final class Keywords {

    private static final Set<String> KEYWORDS = Set.of(
            "package", "part", "attribute", "port", "connection", "interface",
            "block", "requirement", "constraint", "activity", "state", "transition",
            "use", "case", "actor", "subject", "stakeholder", "concern",
            "view", "viewpoint", "rendering", "expose", "import", "private", "protected", "public",
            "abstract", "readonly", "derived", "end", "redefines", "specializes", "conjugates"
    );

    private Keywords() {}

    /**
     * Checks whether the given text is a keyword.
     * @param text The identifier text to check.
     * @return true if the text exactly matches a keyword, false otherwise.
     */
    public static boolean isKeyword(String text) {
        return KEYWORDS.contains(text);
    }

    /**
     * Returns all keywords.
     * @return An unmodifiable set of the keywords.
     */
    public static Set<String> all() {
        return KEYWORDS;
    }
}
