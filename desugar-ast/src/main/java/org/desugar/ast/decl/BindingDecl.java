package org.desugar.ast.decl;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.expr.Expr;
import org.desugar.ast.type.Type;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * One name introduced by a {@link DecompositionDecl}.
 * <p>
 * The binding expression is a member access or array subscript on the decomposed object. For
 * tuple-like decompositions the front end introduces a holding variable whose initializer is the
 * {@code get<i>} call.
 */
public class BindingDecl extends ValueDecl {

    private final Expr binding;
    private final VarDecl holdingVar;

    public BindingDecl(Position begin, String name, Type type, Expr binding, VarDecl holdingVar) {
        super(begin, name, type);
        this.binding = binding;
        this.holdingVar = holdingVar;
    }

    public Expr getBinding() {
        return binding;
    }

    public VarDecl getHoldingVar() {
        return holdingVar;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(binding);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
