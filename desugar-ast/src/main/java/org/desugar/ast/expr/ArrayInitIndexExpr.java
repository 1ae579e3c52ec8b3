package org.desugar.ast.expr;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.type.BuiltinType;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

public class ArrayInitIndexExpr extends Expr {

    public ArrayInitIndexExpr(Position begin) {
        super(begin, BuiltinType.UNSIGNED_LONG);
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
