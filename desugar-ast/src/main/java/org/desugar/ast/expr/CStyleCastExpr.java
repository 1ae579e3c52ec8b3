package org.desugar.ast.expr;

import com.github.javaparser.Position;
import org.desugar.ast.type.Type;
import org.desugar.ast.visitor.VoidVisitor;

/**
 * {@code (T)e}.
 */
public class CStyleCastExpr extends CastExpr {

    public CStyleCastExpr(Position begin, Type type, CastKind castKind, Expr subExpr) {
        super(begin, type, castKind, subExpr);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
