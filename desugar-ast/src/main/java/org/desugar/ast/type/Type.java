package org.desugar.ast.type;

/**
 * A resolved static type as produced by the front end.
 * <p>
 * Types are immutable. Sugar (typedef names) is kept so that the original spelling can be
 * printed, {@link #getCanonicalType()} strips it.
 */
public abstract class Type {

    public Type getCanonicalType() {
        return this;
    }

    public boolean isBuiltinType() {
        return false;
    }

    public boolean isRecordType() {
        return false;
    }

    public boolean isPointerType() {
        return false;
    }

    public boolean isReferenceType() {
        return false;
    }

    public boolean isLValueReferenceType() {
        return false;
    }

    public boolean isArrayType() {
        return false;
    }

    public boolean isFunctionType() {
        return false;
    }

    public boolean isFunctionPointerType() {
        return false;
    }

    public boolean isSignedIntegerType() {
        return false;
    }

    public boolean isConstQualified() {
        return false;
    }

    /**
     * The record declaration name behind this type, looking through references, qualifiers and sugar.
     */
    public RecordType getAsRecordType() {
        return null;
    }

    public abstract <R, A> R accept(TypeVisitor<R, A> v, A arg);
}
