package org.desugar.ast.expr;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * A use of a non-type template parameter, replaced by its argument.
 */
public class SubstNonTypeTemplateParmExpr extends Expr {

    private final Expr replacement;

    public SubstNonTypeTemplateParmExpr(Position begin, Expr replacement) {
        super(begin, replacement.getType());
        this.replacement = replacement;
    }

    public Expr getReplacement() {
        return replacement;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(replacement);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
