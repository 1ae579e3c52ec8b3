package org.desugar.ast.decl;

import com.github.javaparser.Position;

import java.util.Objects;

public abstract class NamedDecl extends Decl {

    private final String name;

    protected NamedDecl(Position begin, String name) {
        super(begin);
        this.name = Objects.requireNonNull(name);
    }

    /**
     * The unqualified name. Empty for unnamed declarations such as a decomposition.
     */
    public String getName() {
        return name;
    }
}
