package org.desugar.ast.expr;

import com.github.javaparser.Position;
import org.desugar.ast.type.Type;
import org.desugar.ast.visitor.VoidVisitor;

/**
 * {@code T(e)} or {@code T{e}}.
 */
public class FunctionalCastExpr extends CastExpr {

    private final boolean listInitialization;

    public FunctionalCastExpr(Position begin, Type type, CastKind castKind, Expr subExpr, boolean listInitialization) {
        super(begin, type, castKind, subExpr);
        this.listInitialization = listInitialization;
    }

    public boolean isListInitialization() {
        return listInitialization;
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
