package org.desugar.ast.expr;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.type.Type;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * Element-wise initialization of an array from another array, as done when an array is captured
 * by copy or decomposed. {@code subExpr} is evaluated once per index with every
 * {@link ArrayInitIndexExpr} standing for the current index.
 */
public class ArrayInitLoopExpr extends Expr {

    private final OpaqueValueExpr commonExpr;
    private final Expr subExpr;
    private final long size;

    public ArrayInitLoopExpr(Position begin, Type type, OpaqueValueExpr commonExpr, Expr subExpr, long size) {
        super(begin, type);
        this.commonExpr = commonExpr;
        this.subExpr = subExpr;
        this.size = size;
    }

    /**
     * The source array.
     */
    public OpaqueValueExpr getCommonExpr() {
        return commonExpr;
    }

    public Expr getSubExpr() {
        return subExpr;
    }

    public long getArraySize() {
        return size;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(commonExpr, subExpr);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
