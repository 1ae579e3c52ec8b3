package org.desugar.ast.type;

import java.util.Objects;

/**
 * A cv-qualified type.
 */
public final class QualifiedType extends Type {

    private final Type baseType;
    private final boolean constQualified;
    private final boolean volatileQualified;

    public QualifiedType(Type baseType, boolean constQualified, boolean volatileQualified) {
        this.baseType = Objects.requireNonNull(baseType);
        this.constQualified = constQualified;
        this.volatileQualified = volatileQualified;
    }

    public static QualifiedType constOf(Type baseType) {
        return new QualifiedType(baseType, true, false);
    }

    public Type getBaseType() {
        return baseType;
    }

    public boolean isVolatileQualified() {
        return volatileQualified;
    }

    @Override
    public boolean isConstQualified() {
        return constQualified;
    }

    @Override
    public Type getCanonicalType() {
        Type canonicalBase = baseType.getCanonicalType();
        return canonicalBase == baseType ? this : new QualifiedType(canonicalBase, constQualified, volatileQualified);
    }

    @Override
    public boolean isBuiltinType() {
        return baseType.isBuiltinType();
    }

    @Override
    public boolean isRecordType() {
        return baseType.isRecordType();
    }

    @Override
    public boolean isPointerType() {
        return baseType.isPointerType();
    }

    @Override
    public boolean isArrayType() {
        return baseType.isArrayType();
    }

    @Override
    public boolean isFunctionPointerType() {
        return baseType.isFunctionPointerType();
    }

    @Override
    public boolean isSignedIntegerType() {
        return baseType.isSignedIntegerType();
    }

    @Override
    public RecordType getAsRecordType() {
        return baseType.getAsRecordType();
    }

    @Override
    public <R, A> R accept(TypeVisitor<R, A> v, A arg) {
        return v.visit(this, arg);
    }

    @Override
    public String toString() {
        return (constQualified ? "const " : "") + (volatileQualified ? "volatile " : "") + baseType;
    }
}
