package org.desugar.ast.expr;

import com.github.javaparser.Position;
import org.desugar.ast.type.Type;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * A call whose callee is a {@link MemberExpr}, e.g. {@code v.begin()}.
 */
public class MemberCallExpr extends CallExpr {

    public MemberCallExpr(Position begin, Type type, MemberExpr callee, List<Expr> args) {
        super(begin, type, callee, args);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
