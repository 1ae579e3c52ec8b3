package org.desugar.ast.decl;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.expr.Expr;
import org.desugar.ast.type.Type;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * {@code auto [a, b] = e;}. The declaration itself is unnamed; its type is the type of the hidden
 * object the bindings refer to.
 */
public class DecompositionDecl extends VarDecl {

    private List<BindingDecl> bindings = List.of();

    public DecompositionDecl(Position begin, Type type, Expr init) {
        super(begin, "", type, init);
    }

    public List<BindingDecl> getBindings() {
        return bindings;
    }

    /**
     * Bindings usually refer back to this declaration and are therefore attached after construction.
     */
    public DecompositionDecl setBindings(List<BindingDecl> bindings) {
        this.bindings = List.copyOf(bindings);
        return this;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(getInit(), bindings);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
