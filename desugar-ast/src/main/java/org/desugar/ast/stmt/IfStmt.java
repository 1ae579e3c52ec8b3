package org.desugar.ast.stmt;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.decl.VarDecl;
import org.desugar.ast.expr.Expr;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

public class IfStmt extends Stmt {

    private final Stmt init;
    private final VarDecl conditionVariable;
    private final Expr condition;
    private final Stmt thenStmt;
    private final Stmt elseStmt;
    private boolean constexpr;

    public IfStmt(Position begin, Expr condition, Stmt thenStmt, Stmt elseStmt) {
        this(begin, null, null, condition, thenStmt, elseStmt);
    }

    /**
     * @param init              the init-statement of {@code if (init; cond)}, may be null
     * @param conditionVariable the variable declared in {@code if (T x = e)}, may be null
     */
    public IfStmt(Position begin, Stmt init, VarDecl conditionVariable, Expr condition, Stmt thenStmt, Stmt elseStmt) {
        super(begin);
        this.init = init;
        this.conditionVariable = conditionVariable;
        this.condition = condition;
        this.thenStmt = thenStmt;
        this.elseStmt = elseStmt;
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

    public Stmt getThen() {
        return thenStmt;
    }

    public Stmt getElse() {
        return elseStmt;
    }

    public boolean isConstexpr() {
        return constexpr;
    }

    public IfStmt setConstexpr(boolean constexpr) {
        this.constexpr = constexpr;
        return this;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(init, conditionVariable, condition, thenStmt, elseStmt);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
