package org.desugar.ast.type;

import java.util.stream.Collectors;

/**
 * Declarator-aware type printer: the variable name is placed where the grammar puts it, so arrays
 * and function pointers keep their parenthesized forms.
 */
public class DefaultTypeNamePrinter implements TypeNamePrinter, TypeVisitor<String, String> {

    public static final DefaultTypeNamePrinter INSTANCE = new DefaultTypeNamePrinter();

    @Override
    public String getName(Type type) {
        return type.accept(this, "");
    }

    @Override
    public String getTypeNameAsParameter(Type type, String name) {
        return type.accept(this, name == null ? "" : name);
    }

    @Override
    public String visit(BuiltinType t, String inner) {
        return join(t.getKind().getSpelling(), inner);
    }

    @Override
    public String visit(RecordType t, String inner) {
        return join(t.getName(), inner);
    }

    @Override
    public String visit(TypedefType t, String inner) {
        return join(t.getName(), inner);
    }

    @Override
    public String visit(PointerType t, String inner) {
        return t.getPointeeType().accept(this, wrap(t.getPointeeType(), "*", inner));
    }

    @Override
    public String visit(ReferenceType t, String inner) {
        return t.getPointeeType().accept(this, wrap(t.getPointeeType(), t.isRValue() ? "&&" : "&", inner));
    }

    @Override
    public String visit(ArrayType t, String inner) {
        return t.getElementType().accept(this, inner + "[" + t.getSize() + "]");
    }

    @Override
    public String visit(FunctionProtoType t, String inner) {
        String params = t.getParameterTypes().stream().map(this::getName).collect(Collectors.joining(", "));
        return t.getReturnType().accept(this, inner + "(" + params + ")" + (t.isNoexcept() ? " noexcept" : ""));
    }

    @Override
    public String visit(QualifiedType t, String inner) {
        String qualifiers = (t.isConstQualified() ? "const" : "")
                            + (t.isConstQualified() && t.isVolatileQualified() ? " " : "")
                            + (t.isVolatileQualified() ? "volatile" : "");

        if (t.getBaseType() instanceof PointerType) {
            // int * const p
            PointerType pointer = (PointerType) t.getBaseType();
            String qualifiedInner = qualifiers + (inner.isEmpty() ? "" : " " + inner);
            return pointer.getPointeeType().accept(this, wrap(pointer.getPointeeType(), "*", qualifiedInner));
        }

        return qualifiers + " " + t.getBaseType().accept(this, inner);
    }

    private static String wrap(Type pointee, String symbol, String inner) {
        Type canonical = pointee.getCanonicalType();
        if (canonical.isArrayType() || canonical.isFunctionType()) {
            return "(" + symbol + inner + ")";
        }

        if (inner.isEmpty()) {
            return symbol;
        }

        if (inner.startsWith("*") || inner.startsWith("&")) {
            return symbol + inner;
        }

        return symbol + " " + inner;
    }

    private static String join(String base, String inner) {
        if (inner.isEmpty()) {
            return base;
        }

        if (inner.startsWith("[")) {
            return base + inner;
        }

        return base + " " + inner;
    }
}
