package org.desugar.ast.decl;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.expr.Expr;
import org.desugar.ast.type.Type;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

public class FieldDecl extends ValueDecl {

    private final Expr inClassInitializer;

    public FieldDecl(Position begin, String name, Type type) {
        this(begin, name, type, null);
    }

    public FieldDecl(Position begin, String name, Type type, Expr inClassInitializer) {
        super(begin, name, type);
        this.inClassInitializer = inClassInitializer;
    }

    public Expr getInClassInitializer() {
        return inClassInitializer;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(inClassInitializer);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
