package org.desugar.ast.type;

import java.util.Objects;

/**
 * A constant-size array type.
 */
public final class ArrayType extends Type {

    private final Type elementType;
    private final long size;

    public ArrayType(Type elementType, long size) {
        this.elementType = Objects.requireNonNull(elementType);
        this.size = size;
    }

    public Type getElementType() {
        return elementType;
    }

    public long getSize() {
        return size;
    }

    @Override
    public Type getCanonicalType() {
        Type canonicalElement = elementType.getCanonicalType();
        return canonicalElement == elementType ? this : new ArrayType(canonicalElement, size);
    }

    @Override
    public boolean isArrayType() {
        return true;
    }

    @Override
    public <R, A> R accept(TypeVisitor<R, A> v, A arg) {
        return v.visit(this, arg);
    }

    @Override
    public String toString() {
        return elementType + "[" + size + "]";
    }
}
