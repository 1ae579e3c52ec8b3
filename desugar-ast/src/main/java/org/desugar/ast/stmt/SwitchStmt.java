package org.desugar.ast.stmt;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.decl.VarDecl;
import org.desugar.ast.expr.Expr;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

public class SwitchStmt extends Stmt {

    private final Stmt init;
    private final VarDecl conditionVariable;
    private final Expr condition;
    private final Stmt body;

    public SwitchStmt(Position begin, Expr condition, Stmt body) {
        this(begin, null, null, condition, body);
    }

    public SwitchStmt(Position begin, Stmt init, VarDecl conditionVariable, Expr condition, Stmt body) {
        super(begin);
        this.init = init;
        this.conditionVariable = conditionVariable;
        this.condition = condition;
        this.body = body;
    }

    public Stmt getInit() {
        return init;
    }

    public VarDecl getConditionVariable() {
        return conditionVariable;
    }

    public Expr getCondition() {
        return condition;
    }

    public Stmt getBody() {
        return body;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(init, conditionVariable, condition, body);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
