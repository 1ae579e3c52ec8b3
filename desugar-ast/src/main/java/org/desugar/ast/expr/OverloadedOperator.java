package org.desugar.ast.expr;

/**
 * The operator an {@link OperatorCallExpr} was resolved from.
 */
public enum OverloadedOperator {
    NEW("new"),
    DELETE("delete"),
    ARRAY_NEW("new[]"),
    ARRAY_DELETE("delete[]"),
    PLUS("+"),
    MINUS("-"),
    STAR("*"),
    SLASH("/"),
    PERCENT("%"),
    CARET("^"),
    AMP("&"),
    PIPE("|"),
    TILDE("~"),
    EXCLAIM("!"),
    EQUAL("="),
    LESS("<"),
    GREATER(">"),
    PLUS_EQUAL("+="),
    MINUS_EQUAL("-="),
    STAR_EQUAL("*="),
    SLASH_EQUAL("/="),
    PERCENT_EQUAL("%="),
    CARET_EQUAL("^="),
    AMP_EQUAL("&="),
    PIPE_EQUAL("|="),
    LESS_LESS("<<"),
    GREATER_GREATER(">>"),
    LESS_LESS_EQUAL("<<="),
    GREATER_GREATER_EQUAL(">>="),
    EQUAL_EQUAL("=="),
    EXCLAIM_EQUAL("!="),
    LESS_EQUAL("<="),
    GREATER_EQUAL(">="),
    SPACESHIP("<=>"),
    AMP_AMP("&&"),
    PIPE_PIPE("||"),
    PLUS_PLUS("++"),
    MINUS_MINUS("--"),
    COMMA(","),
    ARROW_STAR("->*"),
    ARROW("->"),
    CALL("()"),
    SUBSCRIPT("[]"),
    COAWAIT("co_await");

    private final String spelling;

    OverloadedOperator(String spelling) {
        this.spelling = spelling;
    }

    public String getSpelling() {
        return spelling;
    }
}
