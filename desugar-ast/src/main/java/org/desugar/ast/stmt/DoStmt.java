package org.desugar.ast.stmt;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.expr.Expr;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

public class DoStmt extends Stmt {

    private final Expr condition;
    private final Stmt body;

    public DoStmt(Position begin, Expr condition, Stmt body) {
        super(begin);
        this.condition = condition;
        this.body = body;
    }

    public Expr getCondition() {
        return condition;
    }

    public Stmt getBody() {
        return body;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(body, condition);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
