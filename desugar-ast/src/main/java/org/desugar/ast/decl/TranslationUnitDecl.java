package org.desugar.ast.decl;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * Root of a resolved tree.
 */
public class TranslationUnitDecl extends Decl {

    private final List<Decl> decls;

    public TranslationUnitDecl(List<Decl> decls) {
        super(new Position(1, 1));
        this.decls = List.copyOf(decls);
    }

    public List<Decl> getDecls() {
        return decls;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(decls);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
