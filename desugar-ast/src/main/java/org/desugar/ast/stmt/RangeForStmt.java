package org.desugar.ast.stmt;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.decl.VarDecl;
import org.desugar.ast.expr.Expr;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * {@code for (decl : range) body}, together with the implicit declarations the front end
 * synthesized for it: the range temporary, the begin and end iterators, the loop condition,
 * the increment and the per-iteration loop variable.
 */
public class RangeForStmt extends Stmt {

    private final DeclStmt rangeStmt;
    private final DeclStmt beginStmt;
    private final DeclStmt endStmt;
    private final Expr condition;
    private final Expr increment;
    private final DeclStmt loopVariableStmt;
    private final Stmt body;

    public RangeForStmt(Position begin, DeclStmt rangeStmt, DeclStmt beginStmt, DeclStmt endStmt, Expr condition,
                        Expr increment, DeclStmt loopVariableStmt, Stmt body) {
        super(begin);
        this.rangeStmt = rangeStmt;
        this.beginStmt = beginStmt;
        this.endStmt = endStmt;
        this.condition = condition;
        this.increment = increment;
        this.loopVariableStmt = loopVariableStmt;
        this.body = body;
    }

    public DeclStmt getRangeStmt() {
        return rangeStmt;
    }

    public DeclStmt getBeginStmt() {
        return beginStmt;
    }

    public DeclStmt getEndStmt() {
        return endStmt;
    }

    public Expr getCondition() {
        return condition;
    }

    public Expr getIncrement() {
        return increment;
    }

    public DeclStmt getLoopVariableStmt() {
        return loopVariableStmt;
    }

    public VarDecl getLoopVariable() {
        return (VarDecl) loopVariableStmt.getDecls().get(0);
    }

    public Stmt getBody() {
        return body;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(loopVariableStmt, rangeStmt, body);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
