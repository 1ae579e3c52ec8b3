package org.desugar.ast.type;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultTypeNamePrinterTest {

    private final TypeNamePrinter printer = DefaultTypeNamePrinter.INSTANCE;

    @Test
    void builtin_withAndWithoutName() {
        assertThat(printer.getName(BuiltinType.INT)).isEqualTo("int");
        assertThat(printer.getTypeNameAsParameter(BuiltinType.UNSIGNED_LONG, "n")).isEqualTo("unsigned long n");
    }

    @Test
    void referenceAndPointer_declarators() {
        assertThat(printer.getTypeNameAsParameter(new ReferenceType(BuiltinType.INT), "e")).isEqualTo("int & e");
        assertThat(printer.getTypeNameAsParameter(new PointerType(BuiltinType.INT), "__begin1"))
            .isEqualTo("int * __begin1");
        assertThat(printer.getName(new PointerType(new RecordType("Singleton", false)))).isEqualTo("Singleton *");
        assertThat(printer.getName(new ReferenceType(BuiltinType.INT, true))).isEqualTo("int &&");
    }

    @Test
    void array_keepsDeclaratorOrder() {
        ArrayType array = new ArrayType(BuiltinType.INT, 3);
        assertThat(printer.getName(array)).isEqualTo("int[3]");
        assertThat(printer.getTypeNameAsParameter(array, "a")).isEqualTo("int a[3]");
        assertThat(printer.getTypeNameAsParameter(new ReferenceType(array), "__range1"))
            .isEqualTo("int (&__range1)[3]");
    }

    @Test
    void functionPointer_parenthesizesName() {
        FunctionProtoType fn = new FunctionProtoType(BuiltinType.VOID, List.of(BuiltinType.INT));
        assertThat(printer.getTypeNameAsParameter(new PointerType(fn), "fp")).isEqualTo("void (*fp)(int)");
        assertThat(printer.getName(new PointerType(fn))).isEqualTo("void (*)(int)");
    }

    @Test
    void qualifiers_andUnqualifiedName() {
        QualifiedType constInt = QualifiedType.constOf(BuiltinType.INT);
        assertThat(printer.getTypeNameAsParameter(new ReferenceType(constInt), "x")).isEqualTo("const int & x");
        assertThat(printer.getName(constInt, true)).isEqualTo("int");
    }

    @Test
    void typedef_printsSugarButCanonicalStripsIt() {
        TypedefType size = new TypedefType("size_t", BuiltinType.UNSIGNED_LONG);
        assertThat(printer.getName(size)).isEqualTo("size_t");
        assertThat(printer.getName(size.getCanonicalType())).isEqualTo("unsigned long");
    }
}
