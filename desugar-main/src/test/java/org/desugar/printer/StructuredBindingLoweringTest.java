package org.desugar.printer;

import org.desugar.LoweringResult;
import org.desugar.ast.decl.BindingDecl;
import org.desugar.ast.decl.DecompositionDecl;
import org.desugar.ast.decl.FieldDecl;
import org.desugar.ast.decl.FunctionDecl;
import org.desugar.ast.decl.VarDecl;
import org.desugar.ast.expr.ArraySubscriptExpr;
import org.desugar.ast.expr.CallExpr;
import org.desugar.ast.expr.DeclRefExpr;
import org.desugar.ast.expr.ExprWithCleanups;
import org.desugar.ast.expr.MemberExpr;
import org.desugar.ast.type.ArrayType;
import org.desugar.ast.type.BuiltinType;
import org.desugar.ast.type.FunctionProtoType;
import org.desugar.ast.type.RecordType;
import org.desugar.ast.type.ReferenceType;
import org.desugar.diagnostics.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.desugar.test.Ast.at;
import static org.desugar.test.Ast.desugar;
import static org.desugar.test.Ast.intLit;
import static org.desugar.test.Ast.lines;
import static org.desugar.test.Ast.local;
import static org.desugar.test.Ast.lower;
import static org.desugar.test.Ast.ref;

class StructuredBindingLoweringTest {

    private final RecordType point = new RecordType("Point", true);
    private final FieldDecl x = new FieldDecl(at(1), "x", BuiltinType.INT);
    private final FieldDecl y = new FieldDecl(at(1), "y", BuiltinType.INT);

    @Test
    void structBindings_referToHiddenCopy() {
        // auto [a, b] = p;
        VarDecl p = local(4, "p", point, null);
        DecompositionDecl decomposition = new DecompositionDecl(at(5, 3), point, ref(p));
        decomposition.setBindings(List.of(memberBinding("a", decomposition, x), memberBinding("b", decomposition, y)));

        assertThat(lower(decomposition)).isEqualTo(lines(
            "Point __p5 = p;",
            "int& a = __p5.x;",
            "int& b = __p5.y;",
            ""));
    }

    @Test
    void arrayBindings_throughReference() {
        // auto& [first, second] = arr;
        ArrayType pair = new ArrayType(BuiltinType.INT, 2);
        VarDecl arr = local(5, "arr", pair, null);
        DecompositionDecl decomposition = new DecompositionDecl(at(6, 3), new ReferenceType(pair), ref(arr));
        decomposition.setBindings(List.of(elementBinding("first", decomposition, 0), elementBinding("second", decomposition, 1)));

        assertThat(lower(decomposition)).isEqualTo(lines(
            "int (&__arr6)[2] = arr;",
            "int& first = __arr6[0];",
            "int& second = __arr6[1];",
            ""));
    }

    @Test
    void tupleLikeBinding_usesHoldingVariableInitializer() {
        // auto [k] = makeTuple();  with  std::tuple_element<0>::type&& k = get<0>(std::move(__makeTuple7));
        FunctionDecl makeTuple = new FunctionDecl(at(1), "makeTuple", new FunctionProtoType(point, List.of()), List.of());
        FunctionDecl get = new FunctionDecl(at(1), "get", new FunctionProtoType(BuiltinType.INT, List.of(point)), List.of());

        CallExpr init = new CallExpr(at(7), point, ref(makeTuple), List.of());
        DecompositionDecl decomposition = new DecompositionDecl(at(7, 3), point, init);

        CallExpr getCall = new CallExpr(at(7), BuiltinType.INT, ref(get), List.of(new DeclRefExpr(at(7), decomposition)));
        VarDecl holder = local(7, "k", new ReferenceType(BuiltinType.INT, true), getCall);
        decomposition.setBindings(List.of(new BindingDecl(at(7), "k", BuiltinType.INT, ref(holder), holder)));

        assertThat(lower(decomposition)).isEqualTo(lines(
            "Point __makeTuple7 = makeTuple();",
            "int& k = get(__makeTuple7);",
            ""));
    }

    @Test
    void temporaryHoldingInitializer_bindsByValue() {
        FunctionDecl make = new FunctionDecl(at(1), "make", new FunctionProtoType(point, List.of()), List.of());
        FunctionDecl get = new FunctionDecl(at(1), "get", new FunctionProtoType(BuiltinType.INT, List.of(point)), List.of());

        DecompositionDecl decomposition = new DecompositionDecl(at(8, 3), point, new CallExpr(at(8), point, ref(make), List.of()));
        ExprWithCleanups temporary = new ExprWithCleanups(at(8),
            new CallExpr(at(8), BuiltinType.INT, ref(get), List.of(new DeclRefExpr(at(8), decomposition))));
        VarDecl holder = local(8, "v", BuiltinType.INT, temporary);
        decomposition.setBindings(List.of(new BindingDecl(at(8), "v", BuiltinType.INT, ref(holder), holder)));

        assertThat(lower(decomposition)).endsWith("int v = get(__make8);\n");
    }

    @Test
    void missingName_isReportedAndLeavesEmptyBase() {
        DecompositionDecl decomposition = new DecompositionDecl(at(9, 3), point, intLit(0));
        LoweringResult result = desugar().lower(decomposition);

        assertThat(result.getSource()).startsWith("Point __ = 0;");
        assertThat(result.getDiagnostics()).anyMatch(d -> d.getSeverity() == Severity.ERROR);
    }

    private static BindingDecl memberBinding(String name, DecompositionDecl decomposition, FieldDecl field) {
        MemberExpr access = new MemberExpr(at(1), field.getType(), new DeclRefExpr(at(1), decomposition), field, false);
        return new BindingDecl(at(1), name, field.getType(), access, null);
    }

    private static BindingDecl elementBinding(String name, DecompositionDecl decomposition, int index) {
        ArraySubscriptExpr element = new ArraySubscriptExpr(at(1), BuiltinType.INT, new DeclRefExpr(at(1), decomposition), intLit(index));
        return new BindingDecl(at(1), name, BuiltinType.INT, element, null);
    }
}
