package org.desugar.ast.expr;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.type.Type;

import java.util.List;

/**
 * Base of implicit and written casts. The destination type is the expression type.
 */
public abstract class CastExpr extends Expr {

    private final CastKind castKind;
    private final Expr subExpr;

    protected CastExpr(Position begin, Type type, CastKind castKind, Expr subExpr) {
        super(begin, type);
        this.castKind = castKind;
        this.subExpr = subExpr;
    }

    public CastKind getCastKind() {
        return castKind;
    }

    public Expr getSubExpr() {
        return subExpr;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(subExpr);
    }
}
