package org.desugar.ast.decl;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

public class UsingDecl extends NamedDecl {

    private final String qualifier;

    /**
     * @param qualifier the nested-name-specifier, e.g. {@code std::}
     */
    public UsingDecl(Position begin, String qualifier, String name) {
        super(begin, name);
        this.qualifier = qualifier;
    }

    public String getQualifier() {
        return qualifier;
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
