package org.desugar.ast.stmt;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.expr.Expr;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

public class ForStmt extends Stmt {

    private final Stmt init;
    private final Expr condition;
    private final Expr increment;
    private final Stmt body;

    public ForStmt(Position begin, Stmt init, Expr condition, Expr increment, Stmt body) {
        super(begin);
        this.init = init;
        this.condition = condition;
        this.increment = increment;
        this.body = body;
    }

    public Stmt getInit() {
        return init;
    }

    public Expr getCondition() {
        return condition;
    }

    public Expr getIncrement() {
        return increment;
    }

    public Stmt getBody() {
        return body;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(init, condition, increment, body);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
