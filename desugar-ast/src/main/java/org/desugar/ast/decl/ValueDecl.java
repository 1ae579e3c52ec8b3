package org.desugar.ast.decl;

import com.github.javaparser.Position;
import org.desugar.ast.type.Type;

/**
 * A named declaration with a type: variables, functions, fields, bindings.
 */
public abstract class ValueDecl extends NamedDecl {

    private final Type type;

    protected ValueDecl(Position begin, String name, Type type) {
        super(begin, name);
        this.type = type;
    }

    public Type getType() {
        return type;
    }
}
