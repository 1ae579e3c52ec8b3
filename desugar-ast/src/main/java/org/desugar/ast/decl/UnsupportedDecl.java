package org.desugar.ast.decl;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * A declaration kind the front end does not model.
 */
public class UnsupportedDecl extends Decl {

    private final String kindName;

    public UnsupportedDecl(Position begin, String kindName) {
        super(begin);
        this.kindName = kindName;
    }

    @Override
    public String getKindName() {
        return kindName;
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
