package org.desugar.printer;

import org.desugar.LoweringResult;
import org.desugar.ast.TemplateArgument;
import org.desugar.ast.decl.FunctionDecl;
import org.desugar.ast.decl.VarDecl;
import org.desugar.ast.expr.ArrayInitIndexExpr;
import org.desugar.ast.expr.ArrayInitLoopExpr;
import org.desugar.ast.expr.ArraySubscriptExpr;
import org.desugar.ast.expr.CharLiteralExpr;
import org.desugar.ast.expr.CharacterKind;
import org.desugar.ast.expr.ConditionalOperator;
import org.desugar.ast.expr.ConstructExpr;
import org.desugar.ast.expr.DeclRefExpr;
import org.desugar.ast.expr.DeleteExpr;
import org.desugar.ast.expr.FloatingLiteralExpr;
import org.desugar.ast.expr.IntegerLiteralExpr;
import org.desugar.ast.expr.NewExpr;
import org.desugar.ast.expr.OpaqueValueExpr;
import org.desugar.ast.expr.ParenExpr;
import org.desugar.ast.expr.SizeOfAlignOfExpr;
import org.desugar.ast.expr.StringLiteralExpr;
import org.desugar.ast.expr.UnsupportedExpr;
import org.desugar.ast.type.ArrayType;
import org.desugar.ast.type.BuiltinType;
import org.desugar.ast.type.FunctionProtoType;
import org.desugar.ast.type.PointerType;
import org.desugar.ast.type.RecordType;
import org.desugar.diagnostics.Diagnostic;
import org.desugar.diagnostics.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.desugar.test.Ast.at;
import static org.desugar.test.Ast.desugar;
import static org.desugar.test.Ast.intLit;
import static org.desugar.test.Ast.load;
import static org.desugar.test.Ast.local;
import static org.desugar.test.Ast.lower;
import static org.desugar.test.Ast.ref;

class ExpressionLoweringTest {

    private final VarDecl i = local(1, "i", BuiltinType.INT, null);
    private final VarDecl p = local(1, "p", new PointerType(BuiltinType.INT), null);

    @Test
    void numericLiterals_carryTypeSuffix() {
        assertThat(lower(new IntegerLiteralExpr(at(1), BuiltinType.UNSIGNED_LONG, 5))).isEqualTo("5ul");
        assertThat(lower(intLit(42))).isEqualTo("42");
        assertThat(lower(new FloatingLiteralExpr(at(1), BuiltinType.FLOAT, "1.5"))).isEqualTo("1.5f");
    }

    @Test
    void charLiterals_escapeNonPrintables() {
        assertThat(lower(new CharLiteralExpr(at(1), BuiltinType.CHAR, CharacterKind.ASCII, '\n'))).isEqualTo("'\\n'");
        assertThat(lower(new CharLiteralExpr(at(1), BuiltinType.CHAR, CharacterKind.ASCII, 1))).isEqualTo("'\\x1'");
        assertThat(lower(new CharLiteralExpr(at(1), BuiltinType.CHAR, CharacterKind.ASCII, '\''))).isEqualTo("'\\''");
        assertThat(lower(new CharLiteralExpr(at(1), BuiltinType.of(BuiltinType.Kind.WCHAR), CharacterKind.WIDE, 'a'))).isEqualTo("L'a'");
    }

    @Test
    void stringLiteral_isEscaped() {
        StringLiteralExpr literal = new StringLiteralExpr(at(1), new ArrayType(BuiltinType.CHAR, 10), CharacterKind.UTF8,
                                                          "say \"hi\"\n");
        assertThat(lower(literal)).isEqualTo("u8\"say \\\"hi\\\"\\n\"");
    }

    @Test
    void sizeof_parenthesizesOperandOnce() {
        assertThat(lower(SizeOfAlignOfExpr.ofType(at(1), SizeOfAlignOfExpr.Kind.SIZEOF, BuiltinType.INT)))
            .isEqualTo("sizeof(int)");
        assertThat(lower(SizeOfAlignOfExpr.ofExpr(at(1), SizeOfAlignOfExpr.Kind.SIZEOF, load(i))))
            .isEqualTo("sizeof(i)");
        assertThat(lower(SizeOfAlignOfExpr.ofExpr(at(1), SizeOfAlignOfExpr.Kind.ALIGNOF, new ParenExpr(at(1), load(i)))))
            .isEqualTo("alignof(i)");
    }

    @Test
    void conditional_andSubscript() {
        VarDecl flag = local(1, "flag", BuiltinType.BOOL, null);
        assertThat(lower(new ConditionalOperator(at(1), BuiltinType.INT, load(flag), intLit(1), intLit(2))))
            .isEqualTo("flag ? 1 : 2");
        assertThat(lower(new ArraySubscriptExpr(at(1), BuiltinType.INT, load(p), intLit(0)))).isEqualTo("p[0]");
    }

    @Test
    void newAndDelete() {
        PointerType intPtr = new PointerType(BuiltinType.INT);
        RecordType s = new RecordType("S", false);

        assertThat(lower(new NewExpr(at(1), intPtr, List.of(), BuiltinType.INT, null, intLit(3))))
            .isEqualTo("new int{3}");
        assertThat(lower(new NewExpr(at(1), intPtr, List.of(), BuiltinType.INT, intLit(4), null)))
            .isEqualTo("new int[4]");
        assertThat(lower(new NewExpr(at(1), new PointerType(s), List.of(load(p)), s, null,
                                     new ConstructExpr(at(1), s, List.of(intLit(1)), false))))
            .isEqualTo("new (p) S(1)");
        assertThat(lower(new DeleteExpr(at(1), true, load(p)))).isEqualTo("delete[] p");
    }

    @Test
    void construct_listInitializationUsesBraces() {
        RecordType point = new RecordType("Point", true);
        assertThat(lower(new ConstructExpr(at(1), point, List.of(intLit(1), intLit(2)), true))).isEqualTo("Point{1, 2}");
        assertThat(lower(new ConstructExpr(at(1), point, List.of(), false))).isEqualTo("Point()");
    }

    @Test
    void declRef_printsQualifierAndTemplateArguments() {
        FunctionDecl get = new FunctionDecl(at(1), "get", new FunctionProtoType(BuiltinType.INT, List.of()), List.of());
        DeclRefExpr ref = new DeclRefExpr(at(1), get)
            .setQualifier("std::")
            .setTemplateArguments(List.of(TemplateArgument.ofIntegral(0), TemplateArgument.ofType(BuiltinType.INT)));

        assertThat(lower(ref)).isEqualTo("std::get<0, int>");
    }

    @Test
    void arrayInitLoop_printsOneElementPerIndex() {
        VarDecl src = local(1, "src", new ArrayType(BuiltinType.INT, 3), null);
        OpaqueValueExpr common = new OpaqueValueExpr(at(1), ref(src));
        ArraySubscriptExpr element = new ArraySubscriptExpr(at(1), BuiltinType.INT, common, new ArrayInitIndexExpr(at(1)));

        assertThat(lower(new ArrayInitLoopExpr(at(1), new ArrayType(BuiltinType.INT, 3), common, element, 3)))
            .isEqualTo("{src[0], src[1], src[2]}");
    }

    @Test
    void arrayInitIndex_outsideLoop_isReportedAsError() {
        LoweringResult result = desugar().lower(new ArrayInitIndexExpr(at(7, 3)));

        assertThat(result.isComplete()).isFalse();
        assertThat(result.getSource()).isEqualTo("/* [TODO] unsupported: ArrayInitIndexExpr */");
        assertThat(result.getDiagnostics())
            .extracting(Diagnostic::getSeverity)
            .containsExactly(Severity.ERROR, Severity.WARNING);
    }

    @Test
    void unsupportedExpression_leavesPlaceholderAndWarning() {
        LoweringResult result = desugar().lower(new UnsupportedExpr(at(2, 5), BuiltinType.INT, "CoawaitExpr"));

        assertThat(result.getSource()).isEqualTo("/* [TODO] unsupported: CoawaitExpr */");
        assertThat(result.isComplete()).isFalse();
        assertThat(result.getDiagnostics()).hasSize(1);
        assertThat(result.getDiagnostics().get(0).toString()).isEqualTo("2:5: warning: unsupported construct: CoawaitExpr");
    }
}
