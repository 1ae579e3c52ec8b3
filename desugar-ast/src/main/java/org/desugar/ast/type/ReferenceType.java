package org.desugar.ast.type;

import java.util.Objects;

public final class ReferenceType extends Type {

    private final Type pointeeType;
    private final boolean rvalue;

    public ReferenceType(Type pointeeType) {
        this(pointeeType, false);
    }

    public ReferenceType(Type pointeeType, boolean rvalue) {
        this.pointeeType = Objects.requireNonNull(pointeeType);
        this.rvalue = rvalue;
    }

    public Type getPointeeType() {
        return pointeeType;
    }

    public boolean isRValue() {
        return rvalue;
    }

    @Override
    public Type getCanonicalType() {
        Type canonicalPointee = pointeeType.getCanonicalType();
        return canonicalPointee == pointeeType ? this : new ReferenceType(canonicalPointee, rvalue);
    }

    @Override
    public boolean isReferenceType() {
        return true;
    }

    @Override
    public boolean isLValueReferenceType() {
        return !rvalue;
    }

    @Override
    public RecordType getAsRecordType() {
        return pointeeType.getAsRecordType();
    }

    @Override
    public <R, A> R accept(TypeVisitor<R, A> v, A arg) {
        return v.visit(this, arg);
    }

    @Override
    public String toString() {
        return pointeeType + (rvalue ? " &&" : " &");
    }
}
