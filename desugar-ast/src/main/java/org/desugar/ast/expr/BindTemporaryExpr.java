package org.desugar.ast.expr;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * Binds a temporary to its destructor call.
 */
public class BindTemporaryExpr extends Expr {

    private final Expr subExpr;

    public BindTemporaryExpr(Position begin, Expr subExpr) {
        super(begin, subExpr.getType());
        this.subExpr = subExpr;
    }

    public Expr getSubExpr() {
        return subExpr;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(subExpr);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
