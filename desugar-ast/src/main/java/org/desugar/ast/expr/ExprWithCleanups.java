package org.desugar.ast.expr;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * Marks a full-expression whose temporaries need destruction at its end.
 */
public class ExprWithCleanups extends Expr {

    private final Expr subExpr;

    public ExprWithCleanups(Position begin, Expr subExpr) {
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
