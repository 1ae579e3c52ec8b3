package org.desugar.ast.expr;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.type.Type;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

public class InitListExpr extends Expr {

    private final List<Expr> inits;

    public InitListExpr(Position begin, Type type, List<Expr> inits) {
        super(begin, type);
        this.inits = List.copyOf(inits);
    }

    public List<Expr> getInits() {
        return inits;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(inits);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
