package org.desugar.ast.type;

import java.util.Objects;

public final class PointerType extends Type {

    private final Type pointeeType;

    public PointerType(Type pointeeType) {
        this.pointeeType = Objects.requireNonNull(pointeeType);
    }

    public Type getPointeeType() {
        return pointeeType;
    }

    @Override
    public Type getCanonicalType() {
        Type canonicalPointee = pointeeType.getCanonicalType();
        return canonicalPointee == pointeeType ? this : new PointerType(canonicalPointee);
    }

    @Override
    public boolean isPointerType() {
        return true;
    }

    @Override
    public boolean isFunctionPointerType() {
        return pointeeType.getCanonicalType().isFunctionType();
    }

    @Override
    public <R, A> R accept(TypeVisitor<R, A> v, A arg) {
        return v.visit(this, arg);
    }

    @Override
    public String toString() {
        return pointeeType + " *";
    }
}
