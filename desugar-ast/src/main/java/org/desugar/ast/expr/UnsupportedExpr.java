package org.desugar.ast.expr;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.type.Type;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * An expression kind the front end does not model.
 */
public class UnsupportedExpr extends Expr {

    private final String kindName;

    public UnsupportedExpr(Position begin, Type type, String kindName) {
        super(begin, type);
        this.kindName = kindName;
    }

    @Override
    public String getKindName() {
        return kindName;
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
