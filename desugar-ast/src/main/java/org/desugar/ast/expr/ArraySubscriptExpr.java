package org.desugar.ast.expr;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.type.Type;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

public class ArraySubscriptExpr extends Expr {

    private final Expr lhs;
    private final Expr rhs;

    public ArraySubscriptExpr(Position begin, Type type, Expr lhs, Expr rhs) {
        super(begin, type);
        this.lhs = lhs;
        this.rhs = rhs;
    }

    public Expr getLhs() {
        return lhs;
    }

    public Expr getRhs() {
        return rhs;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(lhs, rhs);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
