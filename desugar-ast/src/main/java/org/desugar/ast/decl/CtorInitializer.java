package org.desugar.ast.decl;

import org.desugar.ast.expr.Expr;

/**
 * {@code member{init}} or {@code Base{init}} in a constructor's initializer list.
 */
public final class CtorInitializer {

    private final String memberName;
    private final Expr init;

    public CtorInitializer(String memberName, Expr init) {
        this.memberName = memberName;
        this.init = init;
    }

    public String getMemberName() {
        return memberName;
    }

    public Expr getInit() {
        return init;
    }
}
