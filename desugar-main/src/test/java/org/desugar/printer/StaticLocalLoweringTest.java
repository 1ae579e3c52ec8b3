package org.desugar.printer;

import org.desugar.ast.decl.StorageClass;
import org.desugar.ast.decl.VarDecl;
import org.desugar.ast.expr.ConstructExpr;
import org.desugar.ast.expr.InitListExpr;
import org.desugar.ast.type.RecordType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.desugar.test.Ast.at;
import static org.desugar.test.Ast.intLit;
import static org.desugar.test.Ast.lines;
import static org.desugar.test.Ast.load;
import static org.desugar.test.Ast.local;
import static org.desugar.test.Ast.lower;

class StaticLocalLoweringTest {

    private final RecordType singleton = new RecordType("Singleton", false);

    @Test
    void nonTrivialStaticLocal_isGuardedPlacementNew() {
        VarDecl s = local(3, "s", singleton, new ConstructExpr(at(3), singleton, List.of(intLit(2)), false))
            .setStorageClass(StorageClass.STATIC);

        assertThat(lower(s)).isEqualTo(lines(
            "static bool __sB;",
            "static char __s[sizeof(Singleton)];",
            "",
            "if( ! __sB )",
            "{",
            "  new (&__s) Singleton(2);",
            "  __sB = true;",
            "}",
            "",
            "Singleton & s = *reinterpret_cast<Singleton *>(__s);",
            ""));
    }

    @Test
    void initListInitializer_isPrefixedWithTypeName() {
        // static Singleton s{1, 2};
        InitListExpr init = new InitListExpr(at(3), singleton, List.of(intLit(1), intLit(2)));
        VarDecl s = local(3, "s", singleton, init).setStorageClass(StorageClass.STATIC);

        assertThat(lower(s)).contains("  new (&__s) Singleton{1, 2};\n")
                            .doesNotContain("new (&__s) {");
    }

    @Test
    void plainExpressionInitializer_isWrappedInTypeNameCall() {
        VarDecl other = local(2, "other", singleton, null);
        VarDecl s = local(3, "s", singleton, load(other)).setStorageClass(StorageClass.STATIC);

        assertThat(lower(s)).contains("  new (&__s) Singleton(other);\n");
    }

    @Test
    void withoutInitializer_constructsByTypeName() {
        VarDecl s = local(3, "s", singleton, null).setStorageClass(StorageClass.STATIC);

        String source = lower(s);

        assertThat(source).contains("  new (&__s) Singleton;\n");
        assertThat(source.split("new ", -1)).hasSize(2);
    }

    @Test
    void trivialStaticLocal_isLeftAlone() {
        VarDecl pod = local(3, "pod", new RecordType("Pod", true), null).setStorageClass(StorageClass.STATIC);

        assertThat(lower(pod)).isEqualTo("static Pod pod;\n");
    }

    @Test
    void namespaceScopeStatic_isLeftAlone() {
        VarDecl global = new VarDecl(at(1), "g", singleton, null).setStorageClass(StorageClass.STATIC);

        assertThat(lower(global)).isEqualTo("static Singleton g;\n");
    }
}
