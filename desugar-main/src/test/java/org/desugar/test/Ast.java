package org.desugar.test;

import com.github.javaparser.Position;
import com.github.javaparser.printer.configuration.Indentation.IndentType;
import org.desugar.Desugar;
import org.desugar.DesugarConfiguration;
import org.desugar.ast.Node;
import org.desugar.ast.decl.Decl;
import org.desugar.ast.decl.ParmVarDecl;
import org.desugar.ast.decl.RecordDecl;
import org.desugar.ast.decl.ValueDecl;
import org.desugar.ast.decl.VarDecl;
import org.desugar.ast.expr.BinaryOperator;
import org.desugar.ast.expr.BinaryOperatorKind;
import org.desugar.ast.expr.CastKind;
import org.desugar.ast.expr.DeclRefExpr;
import org.desugar.ast.expr.Expr;
import org.desugar.ast.expr.ImplicitCastExpr;
import org.desugar.ast.expr.IntegerLiteralExpr;
import org.desugar.ast.expr.UnaryOperator;
import org.desugar.ast.expr.UnaryOperatorKind;
import org.desugar.ast.stmt.CompoundStmt;
import org.desugar.ast.stmt.DeclStmt;
import org.desugar.ast.stmt.Stmt;
import org.desugar.ast.type.BuiltinType;
import org.desugar.ast.type.Type;

import java.util.List;

/**
 * Shorthands for building resolved trees in tests.
 */
public final class Ast {

    public static final DesugarConfiguration CONFIGURATION = new DesugarConfiguration(2, IndentType.SPACES, "\n", false);

    private Ast() {
    }

    public static Desugar desugar() {
        return Desugar.builder().configuration(CONFIGURATION).build();
    }

    public static String lower(Node node) {
        return desugar().lower(node).getSource();
    }

    public static Position at(int line, int column) {
        return new Position(line, column);
    }

    public static Position at(int line) {
        return new Position(line, 1);
    }

    public static IntegerLiteralExpr intLit(long value) {
        return new IntegerLiteralExpr(at(1), BuiltinType.INT, value);
    }

    public static VarDecl local(int line, String name, Type type, Expr init) {
        return new VarDecl(at(line), name, type, init).setLocal(true);
    }

    public static ParmVarDecl param(String name, Type type) {
        return new ParmVarDecl(at(1), name, type);
    }

    /**
     * An empty closure class written at the given location, named the way the analyzer names it.
     */
    public static RecordDecl closureClass(int line, int column) {
        return new RecordDecl(at(line, column), RecordDecl.TagKind.CLASS, "__lambda_" + line + "_" + column, false);
    }

    public static DeclRefExpr ref(ValueDecl decl) {
        return new DeclRefExpr(at(1), decl);
    }

    /**
     * A reference read as a value, as the analyzer presents variables used in expressions.
     */
    public static ImplicitCastExpr load(ValueDecl decl) {
        DeclRefExpr ref = ref(decl);
        return new ImplicitCastExpr(at(1), ref.getType(), CastKind.LVALUE_TO_RVALUE, ref);
    }

    public static DeclStmt declStmt(Decl... decls) {
        return new DeclStmt(at(1), List.of(decls));
    }

    public static CompoundStmt block(Stmt... stmts) {
        return new CompoundStmt(at(1), List.of(stmts));
    }

    public static BinaryOperator binary(Type type, BinaryOperatorKind kind, Expr lhs, Expr rhs) {
        return new BinaryOperator(at(1), type, kind, lhs, rhs);
    }

    public static UnaryOperator unary(Type type, UnaryOperatorKind kind, Expr sub) {
        return new UnaryOperator(at(1), type, kind, sub);
    }

    /**
     * Joins lines with the default line separator of the generator.
     */
    public static String lines(String... lines) {
        return String.join("\n", lines);
    }
}
