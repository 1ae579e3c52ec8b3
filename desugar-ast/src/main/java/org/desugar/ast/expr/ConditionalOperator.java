package org.desugar.ast.expr;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.type.Type;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

public class ConditionalOperator extends Expr {

    private final Expr condition;
    private final Expr trueExpr;
    private final Expr falseExpr;

    public ConditionalOperator(Position begin, Type type, Expr condition, Expr trueExpr, Expr falseExpr) {
        super(begin, type);
        this.condition = condition;
        this.trueExpr = trueExpr;
        this.falseExpr = falseExpr;
    }

    public Expr getCondition() {
        return condition;
    }

    public Expr getTrueExpr() {
        return trueExpr;
    }

    public Expr getFalseExpr() {
        return falseExpr;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(condition, trueExpr, falseExpr);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
