package org.desugar.ast.stmt;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.decl.Decl;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

/**
 * A statement holding one or more declarations, e.g. {@code int a = 1, b = 2;}.
 */
public class DeclStmt extends Stmt {

    private final List<Decl> decls;

    public DeclStmt(Position begin, List<? extends Decl> decls) {
        super(begin);
        this.decls = List.copyOf(decls);
    }

    public List<Decl> getDecls() {
        return decls;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(decls);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
