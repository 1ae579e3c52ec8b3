package org.desugar.ast.decl;

import org.desugar.ast.type.Type;

public final class BaseSpecifier {

    private final AccessSpecifier access;
    private final Type type;
    private final boolean isVirtual;

    public BaseSpecifier(AccessSpecifier access, Type type, boolean isVirtual) {
        this.access = access;
        this.type = type;
        this.isVirtual = isVirtual;
    }

    public AccessSpecifier getAccess() {
        return access;
    }

    public Type getType() {
        return type;
    }

    public boolean isVirtual() {
        return isVirtual;
    }
}
