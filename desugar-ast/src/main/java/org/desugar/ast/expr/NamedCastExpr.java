package org.desugar.ast.expr;

import com.github.javaparser.Position;
import org.desugar.ast.type.Type;
import org.desugar.ast.visitor.VoidVisitor;

/**
 * {@code static_cast<T>(e)} and its siblings.
 */
public class NamedCastExpr extends CastExpr {

    public enum CastName {
        STATIC("static_cast"),
        DYNAMIC("dynamic_cast"),
        REINTERPRET("reinterpret_cast"),
        CONST("const_cast");

        private final String spelling;

        CastName(String spelling) {
            this.spelling = spelling;
        }

        public String getSpelling() {
            return spelling;
        }
    }

    private final CastName castName;

    public NamedCastExpr(Position begin, Type type, CastName castName, CastKind castKind, Expr subExpr) {
        super(begin, type, castKind, subExpr);
        this.castName = castName;
    }

    public CastName getCastName() {
        return castName;
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
