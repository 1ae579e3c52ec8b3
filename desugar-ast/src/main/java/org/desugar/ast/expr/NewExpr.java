package org.desugar.ast.expr;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.type.Type;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

public class NewExpr extends Expr {

    private final List<Expr> placementArgs;
    private final Type allocatedType;
    private final Expr arraySize;
    private final Expr initializer;

    /**
     * @param arraySize   the size of an array new, may be null
     * @param initializer a construct expression, an initializer list or null
     */
    public NewExpr(Position begin, Type type, List<Expr> placementArgs, Type allocatedType, Expr arraySize,
                   Expr initializer) {
        super(begin, type);
        this.placementArgs = List.copyOf(placementArgs);
        this.allocatedType = allocatedType;
        this.arraySize = arraySize;
        this.initializer = initializer;
    }

    public List<Expr> getPlacementArgs() {
        return placementArgs;
    }

    public Type getAllocatedType() {
        return allocatedType;
    }

    public boolean isArray() {
        return arraySize != null;
    }

    public Expr getArraySize() {
        return arraySize;
    }

    public Expr getInitializer() {
        return initializer;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(placementArgs, arraySize, initializer);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
