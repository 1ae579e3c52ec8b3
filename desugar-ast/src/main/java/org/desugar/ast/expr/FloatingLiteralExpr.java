package org.desugar.ast.expr;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.type.Type;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

public class FloatingLiteralExpr extends Expr {

    private final String valueText;

    /**
     * @param valueText the value as evaluated by the front end, without suffix
     */
    public FloatingLiteralExpr(Position begin, Type type, String valueText) {
        super(begin, type);
        this.valueText = valueText;
    }

    public String getValueText() {
        return valueText;
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
