package org.desugar.ast.type;

public interface TypeVisitor<R, A> {

    R visit(BuiltinType t, A arg);

    R visit(RecordType t, A arg);

    R visit(PointerType t, A arg);

    R visit(ReferenceType t, A arg);

    R visit(ArrayType t, A arg);

    R visit(FunctionProtoType t, A arg);

    R visit(QualifiedType t, A arg);

    R visit(TypedefType t, A arg);
}
