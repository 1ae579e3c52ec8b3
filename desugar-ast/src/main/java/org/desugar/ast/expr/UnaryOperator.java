package org.desugar.ast.expr;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.type.Type;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

public class UnaryOperator extends Expr {

    private final UnaryOperatorKind operator;
    private final Expr subExpr;

    public UnaryOperator(Position begin, Type type, UnaryOperatorKind operator, Expr subExpr) {
        super(begin, type);
        this.operator = operator;
        this.subExpr = subExpr;
    }

    public UnaryOperatorKind getOperator() {
        return operator;
    }

    public Expr getSubExpr() {
        return subExpr;
    }

    public boolean isPostfix() {
        return operator.isPostfix();
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
