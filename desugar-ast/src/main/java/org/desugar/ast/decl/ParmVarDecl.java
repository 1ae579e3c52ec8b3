package org.desugar.ast.decl;

import com.github.javaparser.Position;
import org.desugar.ast.type.Type;
import org.desugar.ast.visitor.VoidVisitor;

/**
 * A function parameter. The initializer, if any, is the default argument.
 */
public class ParmVarDecl extends VarDecl {

    public ParmVarDecl(Position begin, String name, Type type) {
        super(begin, name, type, null);
        setLocal(true);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
