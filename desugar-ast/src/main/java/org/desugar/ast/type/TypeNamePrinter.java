package org.desugar.ast.type;

/**
 * Turns resolved types into source text. The code generator treats the result as opaque text.
 */
public interface TypeNamePrinter {

    String getName(Type type);

    /**
     * Like {@link #getName(Type)}, dropping top-level cv-qualifiers when {@code unqualified} is set.
     */
    default String getName(Type type, boolean unqualified) {
        if (unqualified && type instanceof QualifiedType) {
            return getName(((QualifiedType) type).getBaseType());
        }
        return getName(type);
    }

    /**
     * A full declarator, e.g. {@code int (&arr)[3]} or {@code void (*fp)(int)}.
     */
    String getTypeNameAsParameter(Type type, String name);
}
