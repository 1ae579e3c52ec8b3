package org.desugar.benchmark;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import com.github.javaparser.Position;
import com.github.javaparser.printer.configuration.Indentation.IndentType;
import org.desugar.Desugar;
import org.desugar.DesugarConfiguration;
import org.desugar.LoweringResult;
import org.desugar.ast.decl.Decl;
import org.desugar.ast.decl.FunctionDecl;
import org.desugar.ast.decl.MethodDecl;
import org.desugar.ast.decl.RecordDecl;
import org.desugar.ast.decl.TranslationUnitDecl;
import org.desugar.ast.decl.VarDecl;
import org.desugar.ast.expr.BinaryOperator;
import org.desugar.ast.expr.BinaryOperatorKind;
import org.desugar.ast.expr.CastKind;
import org.desugar.ast.expr.DeclRefExpr;
import org.desugar.ast.expr.Expr;
import org.desugar.ast.expr.ImplicitCastExpr;
import org.desugar.ast.expr.IntegerLiteralExpr;
import org.desugar.ast.expr.LambdaCapture;
import org.desugar.ast.expr.LambdaExpr;
import org.desugar.ast.stmt.CompoundStmt;
import org.desugar.ast.stmt.DeclStmt;
import org.desugar.ast.stmt.ReturnStmt;
import org.desugar.ast.stmt.Stmt;
import org.desugar.ast.stmt.WhileStmt;
import org.desugar.ast.type.BuiltinType;
import org.desugar.ast.type.FunctionProtoType;
import org.openjdk.jmh.annotations.*;

/**
 * Measures lowering of a synthetic translation unit. Every function holds a loop and a capturing
 * closure, so the run exercises statement printing as well as closure hoisting.
 */
@BenchmarkMode({Mode.AverageTime, Mode.Throughput})
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2)
@Warmup(iterations = 5, time = 2)
@Measurement(iterations = 5, time = 2)
public class LoweringBenchmark {

    @State(Scope.Benchmark)
    public static class TranslationUnitState {

        @Param({"10", "100"})
        int functions;

        Desugar desugar;
        TranslationUnitDecl translationUnit;

        @Setup(Level.Trial)
        public void build() {
            desugar = Desugar.builder()
                    .configuration(new DesugarConfiguration(2, IndentType.SPACES, "\n", false))
                    .build();

            List<Decl> decls = new ArrayList<>();
            for (int i = 0; i < functions; i++) {
                decls.add(function(i * 10 + 1));
            }
            translationUnit = new TranslationUnitDecl(decls);
        }
    }

    @Benchmark
    public LoweringResult lowerTranslationUnit(TranslationUnitState state) {
        return state.desugar.lower(state.translationUnit);
    }

    // int f_<line>() { int sum = 0; while (sum < 10) sum += 1; auto l = [sum] { return sum + 1; }; return sum; }
    private static FunctionDecl function(int line) {
        VarDecl sum = new VarDecl(new Position(line + 1, 5), "sum", BuiltinType.INT, literal(line + 1, 0)).setLocal(true);

        Stmt loop = new WhileStmt(new Position(line + 2, 5),
                                  new BinaryOperator(new Position(line + 2, 12), BuiltinType.BOOL, BinaryOperatorKind.LT,
                                                     load(sum, line + 2), literal(line + 2, 10)),
                                  new BinaryOperator(new Position(line + 3, 9), BuiltinType.INT, BinaryOperatorKind.ADD_ASSIGN,
                                                     new DeclRefExpr(new Position(line + 3, 9), sum), literal(line + 3, 1)));

        RecordDecl closure = new RecordDecl(new Position(line + 4, 14), RecordDecl.TagKind.CLASS,
                                            "__lambda_" + (line + 4) + "_14", false);
        MethodDecl callOperator = new MethodDecl(new Position(line + 4, 14), MethodDecl.Kind.METHOD, "operator()",
                                                 new FunctionProtoType(BuiltinType.INT, List.of()), List.of());
        callOperator.setConst(true);
        callOperator.setInline(true);
        callOperator.setBody(new CompoundStmt(new Position(line + 4, 20), List.of(new ReturnStmt(
                new Position(line + 4, 22),
                new BinaryOperator(new Position(line + 4, 29), BuiltinType.INT, BinaryOperatorKind.ADD,
                                   load(sum, line + 4), literal(line + 4, 1))))));
        closure.setLambda(callOperator, null, null, false);

        LambdaExpr lambda = new LambdaExpr(new Position(line + 4, 14), closure,
                                           List.of(LambdaCapture.byCopy(sum)), List.of(load(sum, line + 4)));
        VarDecl l = new VarDecl(new Position(line + 4, 5), "l", closure.getTypeForDecl(), lambda).setLocal(true);

        CompoundStmt body = new CompoundStmt(new Position(line, 10), List.of(
                new DeclStmt(new Position(line + 1, 5), List.of(sum)),
                loop,
                new DeclStmt(new Position(line + 4, 5), List.of(l)),
                new ReturnStmt(new Position(line + 5, 5), load(sum, line + 5))));

        return new FunctionDecl(new Position(line, 1), "f_" + line, new FunctionProtoType(BuiltinType.INT, List.of()), List.of())
                .setBody(body);
    }

    private static Expr load(VarDecl decl, int line) {
        return new ImplicitCastExpr(new Position(line, 1), decl.getType(), CastKind.LVALUE_TO_RVALUE,
                                    new DeclRefExpr(new Position(line, 1), decl));
    }

    private static IntegerLiteralExpr literal(int line, long value) {
        return new IntegerLiteralExpr(new Position(line, 1), BuiltinType.INT, value);
    }
}
