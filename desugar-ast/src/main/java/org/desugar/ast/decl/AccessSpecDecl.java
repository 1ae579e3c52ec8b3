package org.desugar.ast.decl;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

public class AccessSpecDecl extends Decl {

    private final AccessSpecifier access;

    public AccessSpecDecl(Position begin, AccessSpecifier access) {
        super(begin);
        this.access = access;
    }

    public AccessSpecifier getAccess() {
        return access;
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
