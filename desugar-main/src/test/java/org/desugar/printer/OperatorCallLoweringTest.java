package org.desugar.printer;

import org.desugar.ast.TemplateArgument;
import org.desugar.ast.decl.FunctionDecl;
import org.desugar.ast.decl.MethodDecl;
import org.desugar.ast.decl.VarDecl;
import org.desugar.ast.expr.CallExpr;
import org.desugar.ast.expr.CastKind;
import org.desugar.ast.expr.Expr;
import org.desugar.ast.expr.ImplicitCastExpr;
import org.desugar.ast.expr.OperatorCallExpr;
import org.desugar.ast.expr.OverloadedOperator;
import org.desugar.ast.expr.UnaryOperatorKind;
import org.desugar.ast.expr.UnresolvedLookupExpr;
import org.desugar.ast.type.BuiltinType;
import org.desugar.ast.type.FunctionProtoType;
import org.desugar.ast.type.PointerType;
import org.desugar.ast.type.RecordType;
import org.desugar.ast.type.Type;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.desugar.test.Ast.at;
import static org.desugar.test.Ast.intLit;
import static org.desugar.test.Ast.load;
import static org.desugar.test.Ast.local;
import static org.desugar.test.Ast.lower;
import static org.desugar.test.Ast.ref;
import static org.desugar.test.Ast.unary;

class OperatorCallLoweringTest {

    private final RecordType s = new RecordType("S", false);
    private final VarDecl a = local(1, "a", s, null);
    private final VarDecl b = local(1, "b", s, null);

    @Test
    void memberOperator_onTwoNames() {
        MethodDecl assign = method("operator=", s);
        OperatorCallExpr call = operatorCall(OverloadedOperator.EQUAL, assign, ref(a), load(b));

        assertThat(lower(call)).isEqualTo("a.operator=(b)");
    }

    @Test
    void freeOperator_onTwoNames() {
        FunctionDecl plus = new FunctionDecl(at(1), "operator+", new FunctionProtoType(s, List.of(s, s)), List.of());
        OperatorCallExpr call = operatorCall(OverloadedOperator.PLUS, plus, load(a), load(b));

        assertThat(lower(call)).isEqualTo("operator+(a, b)");
    }

    @Test
    void freeOperator_generalForm() {
        FunctionDecl shift = new FunctionDecl(at(1), "operator<<", new FunctionProtoType(s, List.of(s, BuiltinType.INT)), List.of());
        OperatorCallExpr call = operatorCall(OverloadedOperator.LESS_LESS, shift, ref(a), intLit(1));

        assertThat(lower(call)).isEqualTo("operator<<(a, 1)");
    }

    @Test
    void memberOperator_parenthesizesDereferencedObject() {
        VarDecl p = local(1, "p", new PointerType(s), null);
        MethodDecl subscript = method("operator[]", BuiltinType.INT);
        OperatorCallExpr call = operatorCall(OverloadedOperator.SUBSCRIPT, subscript,
                                             unary(s, UnaryOperatorKind.DEREF, load(p)), intLit(2));

        assertThat(lower(call)).isEqualTo("(*p).operator[](2)");
    }

    @Test
    void callOperator_joinsRemainingArguments() {
        MethodDecl invoke = method("operator()", BuiltinType.INT);
        OperatorCallExpr call = operatorCall(OverloadedOperator.CALL, invoke, ref(a), intLit(1), intLit(2));

        assertThat(lower(call)).isEqualTo("a.operator()(1, 2)");
    }

    @Test
    void unresolvedCallee_fallsBackToPlainCall() {
        OperatorCallExpr call = new OperatorCallExpr(at(1), s, OverloadedOperator.PLUS,
                                                     new UnresolvedLookupExpr(at(1), s, "operator+"),
                                                     List.of(load(a), intLit(1)));

        assertThat(lower(call)).isEqualTo("operator+(a, 1)");
    }

    @Test
    void userDefinedLiteral_printsCharacterPack() {
        // 12_km
        FunctionDecl literal = new FunctionDecl(at(1), "operator\"\"_km", new FunctionProtoType(BuiltinType.LONG, List.of()), List.of());
        literal.setTemplateSpecializationArgs(List.of(TemplateArgument.ofPack(List.of(TemplateArgument.ofIntegral('1'),
                                                                                        TemplateArgument.ofIntegral('2')))));
        CallExpr call = new CallExpr(at(1), BuiltinType.LONG, ref(literal), List.of()).setUserDefinedLiteral(true);

        assertThat(lower(call)).isEqualTo("operator\"\"_km<'1', '2'>()");
    }

    @Test
    void userDefinedLiteral_escapesPackCharacters() {
        // a character pack holding a quote and a backslash
        FunctionDecl literal = new FunctionDecl(at(1), "operator\"\"_str", new FunctionProtoType(BuiltinType.INT, List.of()), List.of());
        literal.setTemplateSpecializationArgs(List.of(TemplateArgument.ofPack(List.of(TemplateArgument.ofIntegral('a'),
                                                                                        TemplateArgument.ofIntegral('\''),
                                                                                        TemplateArgument.ofIntegral('\\')))));
        CallExpr call = new CallExpr(at(1), BuiltinType.INT, ref(literal), List.of()).setUserDefinedLiteral(true);

        assertThat(lower(call)).isEqualTo("operator\"\"_str<'a', '\\'', '\\\\'>()");
    }

    private MethodDecl method(String name, Type returnType) {
        return new MethodDecl(at(1), MethodDecl.Kind.METHOD, name, new FunctionProtoType(returnType, List.of(s)), List.of());
    }

    private OperatorCallExpr operatorCall(OverloadedOperator operator, FunctionDecl callee, Expr... args) {
        ImplicitCastExpr decayed = new ImplicitCastExpr(at(1), new PointerType(callee.getType()),
                                                        CastKind.FUNCTION_TO_POINTER_DECAY, ref(callee));
        return new OperatorCallExpr(at(1), callee.getReturnType(), operator, decayed, List.of(args));
    }
}
