package org.desugar.ast.stmt;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.expr.Expr;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

public class CaseStmt extends Stmt {

    private final Expr value;
    private final Stmt subStmt;

    public CaseStmt(Position begin, Expr value, Stmt subStmt) {
        super(begin);
        this.value = value;
        this.subStmt = subStmt;
    }

    public Expr getValue() {
        return value;
    }

    public Stmt getSubStmt() {
        return subStmt;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(value, subStmt);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
