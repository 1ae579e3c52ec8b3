package org.desugar.ast.expr;

/**
 * Encoding prefix of a character or string literal.
 */
public enum CharacterKind {
    ASCII(""),
    WIDE("L"),
    UTF8("u8"),
    UTF16("u"),
    UTF32("U");

    private final String prefix;

    CharacterKind(String prefix) {
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }
}
