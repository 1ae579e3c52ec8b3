package org.desugar.ast.expr;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * A default argument inserted at a call site.
 */
public class DefaultArgExpr extends Expr {

    private final Expr expr;

    public DefaultArgExpr(Position begin, Expr expr) {
        super(begin, expr.getType());
        this.expr = expr;
    }

    public Expr getExpr() {
        return expr;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(expr);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
