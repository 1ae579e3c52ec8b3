package org.desugar.ast.expr;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.type.Type;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * A built-in binary operator, compound assignments included.
 */
public class BinaryOperator extends Expr {

    private final BinaryOperatorKind operator;
    private final Expr lhs;
    private final Expr rhs;

    public BinaryOperator(Position begin, Type type, BinaryOperatorKind operator, Expr lhs, Expr rhs) {
        super(begin, type);
        this.operator = operator;
        this.lhs = lhs;
        this.rhs = rhs;
    }

    public BinaryOperatorKind getOperator() {
        return operator;
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
