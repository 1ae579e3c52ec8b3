package org.desugar.ast.expr;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.decl.ValueDecl;
import org.desugar.ast.type.Type;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * {@code base.member} or {@code base->member}. The base is an implicit {@link ThisExpr} for
 * unqualified member accesses inside a member function.
 */
public class MemberExpr extends Expr {

    private final Expr base;
    private final ValueDecl memberDecl;
    private final boolean arrow;

    public MemberExpr(Position begin, Type type, Expr base, ValueDecl memberDecl, boolean arrow) {
        super(begin, type);
        this.base = base;
        this.memberDecl = memberDecl;
        this.arrow = arrow;
    }

    public Expr getBase() {
        return base;
    }

    public ValueDecl getMemberDecl() {
        return memberDecl;
    }

    public String getMemberName() {
        return memberDecl.getName();
    }

    public boolean isArrow() {
        return arrow;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(base);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
