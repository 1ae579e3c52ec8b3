package org.desugar.ast.decl;

public enum AccessSpecifier {
    PUBLIC("public"),
    PROTECTED("protected"),
    PRIVATE("private"),
    NONE("");

    private final String spelling;

    AccessSpecifier(String spelling) {
        this.spelling = spelling;
    }

    public String getSpelling() {
        return spelling;
    }

    /**
     * {@code "public: "} and so on, empty for {@link #NONE}.
     */
    public String withColon() {
        return this == NONE ? "" : spelling + ": ";
    }
}
