package org.desugar.ast.expr;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.type.BuiltinType;
import org.desugar.ast.type.Type;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * {@code sizeof} or {@code alignof} applied to a type or an expression.
 */
public class SizeOfAlignOfExpr extends Expr {

    public enum Kind {
        SIZEOF("sizeof"),
        ALIGNOF("alignof");

        private final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }

        public String getKeyword() {
            return keyword;
        }
    }

    private final Kind kind;
    private final Type argumentType;
    private final Expr argumentExpr;

    private SizeOfAlignOfExpr(Position begin, Kind kind, Type argumentType, Expr argumentExpr) {
        super(begin, BuiltinType.UNSIGNED_LONG);
        this.kind = kind;
        this.argumentType = argumentType;
        this.argumentExpr = argumentExpr;
    }

    public static SizeOfAlignOfExpr ofType(Position begin, Kind kind, Type argumentType) {
        return new SizeOfAlignOfExpr(begin, kind, argumentType, null);
    }

    public static SizeOfAlignOfExpr ofExpr(Position begin, Kind kind, Expr argumentExpr) {
        return new SizeOfAlignOfExpr(begin, kind, null, argumentExpr);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isArgumentType() {
        return argumentType != null;
    }

    public Type getArgumentType() {
        return argumentType;
    }

    public Expr getArgumentExpr() {
        return argumentExpr;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(argumentExpr);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
