package org.desugar.ast.type;

import java.util.Objects;

/**
 * Type sugar: a name introduced by {@code typedef} or an alias declaration.
 */
public final class TypedefType extends Type {

    private final String name;
    private final Type underlyingType;

    public TypedefType(String name, Type underlyingType) {
        this.name = Objects.requireNonNull(name);
        this.underlyingType = Objects.requireNonNull(underlyingType);
    }

    public String getName() {
        return name;
    }

    public Type getUnderlyingType() {
        return underlyingType;
    }

    @Override
    public Type getCanonicalType() {
        return underlyingType.getCanonicalType();
    }

    @Override
    public boolean isBuiltinType() {
        return getCanonicalType().isBuiltinType();
    }

    @Override
    public boolean isRecordType() {
        return getCanonicalType().isRecordType();
    }

    @Override
    public boolean isPointerType() {
        return getCanonicalType().isPointerType();
    }

    @Override
    public boolean isReferenceType() {
        return getCanonicalType().isReferenceType();
    }

    @Override
    public boolean isLValueReferenceType() {
        return getCanonicalType().isLValueReferenceType();
    }

    @Override
    public boolean isArrayType() {
        return getCanonicalType().isArrayType();
    }

    @Override
    public boolean isFunctionType() {
        return getCanonicalType().isFunctionType();
    }

    @Override
    public boolean isFunctionPointerType() {
        return getCanonicalType().isFunctionPointerType();
    }

    @Override
    public boolean isSignedIntegerType() {
        return getCanonicalType().isSignedIntegerType();
    }

    @Override
    public RecordType getAsRecordType() {
        return underlyingType.getAsRecordType();
    }

    @Override
    public <R, A> R accept(TypeVisitor<R, A> v, A arg) {
        return v.visit(this, arg);
    }

    @Override
    public String toString() {
        return name;
    }
}
