package org.desugar.ast.expr;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.type.Type;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

public class TypeidExpr extends Expr {

    private final Type typeOperand;
    private final Expr exprOperand;

    private TypeidExpr(Position begin, Type type, Type typeOperand, Expr exprOperand) {
        super(begin, type);
        this.typeOperand = typeOperand;
        this.exprOperand = exprOperand;
    }

    public static TypeidExpr ofType(Position begin, Type type, Type operand) {
        return new TypeidExpr(begin, type, operand, null);
    }

    public static TypeidExpr ofExpr(Position begin, Type type, Expr operand) {
        return new TypeidExpr(begin, type, null, operand);
    }

    public boolean isTypeOperand() {
        return typeOperand != null;
    }

    public Type getTypeOperand() {
        return typeOperand;
    }

    public Expr getExprOperand() {
        return exprOperand;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(exprOperand);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
