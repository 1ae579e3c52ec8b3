package org.desugar.ast.stmt;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * A statement kind the front end does not model. Carries the original kind name only.
 */
public class UnsupportedStmt extends Stmt {

    private final String kindName;

    public UnsupportedStmt(Position begin, String kindName) {
        super(begin);
        this.kindName = kindName;
    }

    @Override
    public String getKindName() {
        return kindName;
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
