package org.desugar.ast.expr;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.type.Type;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * A name whose lookup is deferred to instantiation time.
 */
public class UnresolvedLookupExpr extends Expr {

    private final String name;

    public UnresolvedLookupExpr(Position begin, Type type, String name) {
        super(begin, type);
        this.name = name;
    }

    public String getName() {
        return name;
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
