package org.desugar.ast.type;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public final class FunctionProtoType extends Type {

    private final Type returnType;
    private final List<Type> parameterTypes;
    private final boolean noexcept;

    public FunctionProtoType(Type returnType, List<Type> parameterTypes) {
        this(returnType, parameterTypes, false);
    }

    public FunctionProtoType(Type returnType, List<Type> parameterTypes, boolean noexcept) {
        this.returnType = Objects.requireNonNull(returnType);
        this.parameterTypes = List.copyOf(parameterTypes);
        this.noexcept = noexcept;
    }

    public Type getReturnType() {
        return returnType;
    }

    public List<Type> getParameterTypes() {
        return parameterTypes;
    }

    public boolean isNoexcept() {
        return noexcept;
    }

    @Override
    public Type getCanonicalType() {
        return new FunctionProtoType(returnType.getCanonicalType(),
                                     parameterTypes.stream().map(Type::getCanonicalType).collect(Collectors.toList()),
                                     noexcept);
    }

    @Override
    public boolean isFunctionType() {
        return true;
    }

    @Override
    public <R, A> R accept(TypeVisitor<R, A> v, A arg) {
        return v.visit(this, arg);
    }

    @Override
    public String toString() {
        return returnType + " (" + parameterTypes.stream().map(Type::toString).collect(Collectors.joining(", ")) + ")";
    }
}
