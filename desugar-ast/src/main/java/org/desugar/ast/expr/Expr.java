package org.desugar.ast.expr;

import com.github.javaparser.Position;
import org.desugar.ast.stmt.Stmt;
import org.desugar.ast.type.Type;

/**
 * An expression. Every expression carries its resolved static type.
 */
public abstract class Expr extends Stmt {

    private final Type type;

    protected Expr(Position begin, Type type) {
        super(begin);
        this.type = type;
    }

    public Type getType() {
        return type;
    }

    /**
     * Skips implicit casts and full-expression wrappers.
     */
    public Expr ignoreImpCasts() {
        Expr e = this;
        while (true) {
            if (e instanceof ImplicitCastExpr) {
                e = ((ImplicitCastExpr) e).getSubExpr();
            } else if (e instanceof ExprWithCleanups) {
                e = ((ExprWithCleanups) e).getSubExpr();
            } else {
                return e;
            }
        }
    }

    /**
     * Skips everything {@link #ignoreImpCasts()} does, plus materialized and bound temporaries.
     */
    public Expr ignoreImplicit() {
        Expr e = this;
        while (true) {
            Expr next = e.ignoreImpCasts();
            if (next instanceof MaterializeTemporaryExpr) {
                next = ((MaterializeTemporaryExpr) next).getSubExpr();
            } else if (next instanceof BindTemporaryExpr) {
                next = ((BindTemporaryExpr) next).getSubExpr();
            }
            if (next == e) {
                return e;
            }
            e = next;
        }
    }

    /**
     * Skips all casts, implicit or written, and the transparent wrappers around them.
     */
    public Expr ignoreCasts() {
        Expr e = this;
        while (true) {
            if (e instanceof CastExpr) {
                e = ((CastExpr) e).getSubExpr();
            } else if (e instanceof ExprWithCleanups) {
                e = ((ExprWithCleanups) e).getSubExpr();
            } else if (e instanceof MaterializeTemporaryExpr) {
                e = ((MaterializeTemporaryExpr) e).getSubExpr();
            } else if (e instanceof SubstNonTypeTemplateParmExpr) {
                e = ((SubstNonTypeTemplateParmExpr) e).getReplacement();
            } else {
                return e;
            }
        }
    }
}
