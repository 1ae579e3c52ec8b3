package org.desugar.ast.stmt;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

public class DefaultStmt extends Stmt {

    private final Stmt subStmt;

    public DefaultStmt(Position begin, Stmt subStmt) {
        super(begin);
        this.subStmt = subStmt;
    }

    public Stmt getSubStmt() {
        return subStmt;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(subStmt);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
