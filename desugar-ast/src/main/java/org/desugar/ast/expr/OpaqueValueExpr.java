package org.desugar.ast.expr;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * A value computed once and referenced from several places of an enclosing expression.
 */
public class OpaqueValueExpr extends Expr {

    private final Expr sourceExpr;

    public OpaqueValueExpr(Position begin, Expr sourceExpr) {
        super(begin, sourceExpr.getType());
        this.sourceExpr = sourceExpr;
    }

    public Expr getSourceExpr() {
        return sourceExpr;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(sourceExpr);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
