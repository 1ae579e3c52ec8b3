package org.desugar.printer;

import org.desugar.ast.decl.VarDecl;
import org.desugar.ast.expr.BinaryOperatorKind;
import org.desugar.ast.expr.CastKind;
import org.desugar.ast.expr.ImplicitCastExpr;
import org.desugar.ast.expr.UnaryOperatorKind;
import org.desugar.ast.stmt.RangeForStmt;
import org.desugar.ast.stmt.Stmt;
import org.desugar.ast.type.ArrayType;
import org.desugar.ast.type.BuiltinType;
import org.desugar.ast.type.PointerType;
import org.desugar.ast.type.ReferenceType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.desugar.test.Ast.at;
import static org.desugar.test.Ast.binary;
import static org.desugar.test.Ast.block;
import static org.desugar.test.Ast.declStmt;
import static org.desugar.test.Ast.intLit;
import static org.desugar.test.Ast.lines;
import static org.desugar.test.Ast.load;
import static org.desugar.test.Ast.local;
import static org.desugar.test.Ast.lower;
import static org.desugar.test.Ast.ref;
import static org.desugar.test.Ast.unary;

class RangeForLoweringTest {

    private final ArrayType intArray = new ArrayType(BuiltinType.INT, 3);
    private final PointerType intPtr = new PointerType(BuiltinType.INT);
    private final VarDecl arr = local(1, "arr", intArray, null);
    private final VarDecl sum = local(1, "sum", BuiltinType.INT, intLit(0));

    private final VarDecl range = local(2, "__range1", new ReferenceType(intArray), ref(arr));
    private final VarDecl begin = local(2, "__begin1", intPtr, decay(range));
    private final VarDecl end = local(2, "__end1", intPtr,
                                      binary(intPtr, BinaryOperatorKind.ADD, decay(range), intLit(3)));

    private static ImplicitCastExpr decay(VarDecl array) {
        return new ImplicitCastExpr(at(2), new PointerType(BuiltinType.INT), CastKind.ARRAY_TO_POINTER_DECAY, ref(array));
    }

    private RangeForStmt rangeFor(VarDecl loopVar, Stmt body) {
        return new RangeForStmt(at(2), declStmt(range), declStmt(begin), declStmt(end),
                                binary(BuiltinType.BOOL, BinaryOperatorKind.NE, load(begin), load(end)),
                                unary(intPtr, UnaryOperatorKind.PRE_INC, ref(begin)),
                                declStmt(loopVar), body);
    }

    @Test
    void arrayLoop_unbracedBody() {
        // for (auto& e : arr) sum += e;
        VarDecl e = local(2, "e", new ReferenceType(BuiltinType.INT), unary(BuiltinType.INT, UnaryOperatorKind.DEREF, load(begin)));
        RangeForStmt loop = rangeFor(e, binary(BuiltinType.INT, BinaryOperatorKind.ADD_ASSIGN, ref(sum), load(e)));

        assertThat(lower(loop)).isEqualTo(lines(
            "{",
            "  int (&__range1)[3] = arr;",
            "  int * __begin1 = __range1;",
            "  int * __end1 = __range1 + 3;",
            "",
            "  for( ; __begin1 != __end1; ++__begin1 )",
            "  {",
            "    int & e = *__begin1;",
            "    sum += e;",
            "  }",
            "}"));
    }

    @Test
    void bracedBody_isMergedIntoLoopScope() {
        VarDecl e = local(2, "e", BuiltinType.INT, unary(BuiltinType.INT, UnaryOperatorKind.DEREF, load(begin)));
        RangeForStmt loop = rangeFor(e, block(binary(BuiltinType.INT, BinaryOperatorKind.ADD_ASSIGN, ref(sum), load(e)),
                                              unary(BuiltinType.INT, UnaryOperatorKind.POST_INC, ref(sum))));

        String source = lower(loop);

        assertThat(source).contains(lines("  {", "    int e = *__begin1;", "    sum += e;", "    sum++;", "  }", "}"));
        assertThat(source).doesNotContain("{\n    {");
    }

    @Test
    void conditionAndIncrement_referenceSynthesizedIterators() {
        VarDecl e = local(2, "e", BuiltinType.INT, unary(BuiltinType.INT, UnaryOperatorKind.DEREF, load(begin)));
        String source = lower(rangeFor(e, block()));

        String loopHeader = source.lines().filter(l -> l.contains("for(")).findFirst().orElseThrow();
        assertThat(loopHeader).contains("__begin1 != __end1").contains("++__begin1").doesNotContain("arr");
    }
}
