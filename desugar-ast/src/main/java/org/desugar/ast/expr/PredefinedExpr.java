package org.desugar.ast.expr;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * {@code __func__} and friends, resolved to the enclosing function's name.
 */
public class PredefinedExpr extends Expr {

    private final StringLiteralExpr functionName;

    public PredefinedExpr(Position begin, StringLiteralExpr functionName) {
        super(begin, functionName.getType());
        this.functionName = functionName;
    }

    public StringLiteralExpr getFunctionName() {
        return functionName;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(functionName);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
