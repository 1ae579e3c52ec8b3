package org.desugar.ast.expr;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.type.Type;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * The {@code std::initializer_list} object built from a braced list.
 */
public class StdInitializerListExpr extends Expr {

    private final Expr subExpr;

    public StdInitializerListExpr(Position begin, Type type, Expr subExpr) {
        super(begin, type);
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
