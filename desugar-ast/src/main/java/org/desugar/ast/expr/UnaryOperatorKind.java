package org.desugar.ast.expr;

public enum UnaryOperatorKind {
    POST_INC("++", true),
    POST_DEC("--", true),
    PRE_INC("++", false),
    PRE_DEC("--", false),
    ADDR_OF("&", false),
    DEREF("*", false),
    PLUS("+", false),
    MINUS("-", false),
    NOT("~", false),
    LNOT("!", false),
    REAL("__real ", false),
    IMAG("__imag ", false),
    EXTENSION("__extension__ ", false),
    COAWAIT("co_await ", false);

    private final String spelling;
    private final boolean postfix;

    UnaryOperatorKind(String spelling, boolean postfix) {
        this.spelling = spelling;
        this.postfix = postfix;
    }

    public String getSpelling() {
        return spelling;
    }

    public boolean isPostfix() {
        return postfix;
    }
}
