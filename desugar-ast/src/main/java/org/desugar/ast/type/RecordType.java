package org.desugar.ast.type;

import java.util.Objects;

/**
 * A class, struct or closure type.
 */
public final class RecordType extends Type {

    private final String name;
    private final boolean trivial;

    /**
     * @param name    the printed name, including template arguments of a specialization
     * @param trivial whether default construction and destruction are both trivial
     */
    public RecordType(String name, boolean trivial) {
        this.name = Objects.requireNonNull(name);
        this.trivial = trivial;
    }

    public String getName() {
        return name;
    }

    public boolean isTrivial() {
        return trivial;
    }

    @Override
    public boolean isRecordType() {
        return true;
    }

    @Override
    public RecordType getAsRecordType() {
        return this;
    }

    @Override
    public <R, A> R accept(TypeVisitor<R, A> v, A arg) {
        return v.visit(this, arg);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RecordType)) {
            return false;
        }
        RecordType that = (RecordType) o;
        return trivial == that.trivial && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, trivial);
    }

    @Override
    public String toString() {
        return name;
    }
}
