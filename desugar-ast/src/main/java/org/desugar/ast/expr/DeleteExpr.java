package org.desugar.ast.expr;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.type.BuiltinType;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

public class DeleteExpr extends Expr {

    private final boolean arrayForm;
    private final Expr argument;

    public DeleteExpr(Position begin, boolean arrayForm, Expr argument) {
        super(begin, BuiltinType.VOID);
        this.arrayForm = arrayForm;
        this.argument = argument;
    }

    public boolean isArrayForm() {
        return arrayForm;
    }

    public Expr getArgument() {
        return argument;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(argument);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
