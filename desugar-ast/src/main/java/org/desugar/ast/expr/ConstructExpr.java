package org.desugar.ast.expr;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.type.Type;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

public class ConstructExpr extends Expr {

    private final List<Expr> args;
    private final boolean listInitialization;

    public ConstructExpr(Position begin, Type type, List<Expr> args, boolean listInitialization) {
        super(begin, type);
        this.args = List.copyOf(args);
        this.listInitialization = listInitialization;
    }

    public List<Expr> getArgs() {
        return args;
    }

    public boolean isListInitialization() {
        return listInitialization;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(args);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
