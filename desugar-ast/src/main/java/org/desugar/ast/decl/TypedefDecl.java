package org.desugar.ast.decl;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.type.Type;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * {@code typedef Type Name;}
 */
public class TypedefDecl extends NamedDecl {

    private final Type underlyingType;

    public TypedefDecl(Position begin, String name, Type underlyingType) {
        super(begin, name);
        this.underlyingType = underlyingType;
    }

    public Type getUnderlyingType() {
        return underlyingType;
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
