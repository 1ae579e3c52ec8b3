package org.desugar.ast.expr;

import com.github.javaparser.Position;
import org.desugar.ast.type.Type;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * A use of an overloaded operator written in operator syntax. For a member operator the first
 * argument is the object expression.
 */
public class OperatorCallExpr extends CallExpr {

    private final OverloadedOperator operator;

    public OperatorCallExpr(Position begin, Type type, OverloadedOperator operator, Expr callee, List<Expr> args) {
        super(begin, type, callee, args);
        this.operator = operator;
    }

    public OverloadedOperator getOperator() {
        return operator;
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
