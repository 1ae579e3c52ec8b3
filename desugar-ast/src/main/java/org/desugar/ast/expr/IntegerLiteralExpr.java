package org.desugar.ast.expr;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.type.Type;
import org.desugar.ast.visitor.VoidVisitor;

import java.math.BigInteger;
import java.util.List;

public class IntegerLiteralExpr extends Expr {

    private final BigInteger value;

    public IntegerLiteralExpr(Position begin, Type type, BigInteger value) {
        super(begin, type);
        this.value = value;
    }

    public IntegerLiteralExpr(Position begin, Type type, long value) {
        this(begin, type, BigInteger.valueOf(value));
    }

    public BigInteger getValue() {
        return value;
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
