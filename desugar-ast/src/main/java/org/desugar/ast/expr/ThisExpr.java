package org.desugar.ast.expr;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.type.Type;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

public class ThisExpr extends Expr {

    private final boolean implicit;

    public ThisExpr(Position begin, Type type, boolean implicit) {
        super(begin, type);
        this.implicit = implicit;
    }

    /**
     * True when {@code this} was not written in the source.
     */
    public boolean isImplicit() {
        return implicit;
    }

    @Override
    public List<Node> getChildNodes() {
        return List.of();
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
