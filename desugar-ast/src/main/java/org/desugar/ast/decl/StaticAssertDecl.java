package org.desugar.ast.decl;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.expr.Expr;
import org.desugar.ast.expr.StringLiteralExpr;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

public class StaticAssertDecl extends Decl {

    private final Expr assertExpr;
    private final StringLiteralExpr message;
    private final boolean failed;

    /**
     * @param message may be null
     * @param failed  whether the front end evaluated the assertion to false
     */
    public StaticAssertDecl(Position begin, Expr assertExpr, StringLiteralExpr message, boolean failed) {
        super(begin);
        this.assertExpr = assertExpr;
        this.message = message;
        this.failed = failed;
    }

    public Expr getAssertExpr() {
        return assertExpr;
    }

    public StringLiteralExpr getMessage() {
        return message;
    }

    public boolean isFailed() {
        return failed;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(assertExpr, message);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
