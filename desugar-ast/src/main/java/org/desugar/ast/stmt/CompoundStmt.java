package org.desugar.ast.stmt;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

public class CompoundStmt extends Stmt {

    private final List<Stmt> body;

    public CompoundStmt(Position begin, List<? extends Stmt> body) {
        super(begin);
        this.body = List.copyOf(body);
    }

    public List<Stmt> getBody() {
        return body;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(body);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
