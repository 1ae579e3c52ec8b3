package org.desugar.ast.stmt;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.expr.Expr;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

public class ReturnStmt extends Stmt {

    private final Expr returnValue;

    public ReturnStmt(Position begin, Expr returnValue) {
        super(begin);
        this.returnValue = returnValue;
    }

    public Expr getReturnValue() {
        return returnValue;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(returnValue);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
