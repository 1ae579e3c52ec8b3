package org.desugar.ast.visitor;

import org.desugar.ast.decl.AccessSpecDecl;
import org.desugar.ast.decl.BindingDecl;
import org.desugar.ast.decl.DecompositionDecl;
import org.desugar.ast.decl.FieldDecl;
import org.desugar.ast.decl.FunctionDecl;
import org.desugar.ast.decl.MethodDecl;
import org.desugar.ast.decl.ParmVarDecl;
import org.desugar.ast.decl.RecordDecl;
import org.desugar.ast.decl.StaticAssertDecl;
import org.desugar.ast.decl.TranslationUnitDecl;
import org.desugar.ast.decl.TypeAliasDecl;
import org.desugar.ast.decl.TypedefDecl;
import org.desugar.ast.decl.UnsupportedDecl;
import org.desugar.ast.decl.UsingDecl;
import org.desugar.ast.decl.VarDecl;
import org.desugar.ast.expr.ArrayInitIndexExpr;
import org.desugar.ast.expr.ArrayInitLoopExpr;
import org.desugar.ast.expr.ArraySubscriptExpr;
import org.desugar.ast.expr.BinaryOperator;
import org.desugar.ast.expr.BindTemporaryExpr;
import org.desugar.ast.expr.BoolLiteralExpr;
import org.desugar.ast.expr.CStyleCastExpr;
import org.desugar.ast.expr.CallExpr;
import org.desugar.ast.expr.CharLiteralExpr;
import org.desugar.ast.expr.ConditionalOperator;
import org.desugar.ast.expr.ConstructExpr;
import org.desugar.ast.expr.DeclRefExpr;
import org.desugar.ast.expr.DefaultArgExpr;
import org.desugar.ast.expr.DefaultInitExpr;
import org.desugar.ast.expr.DeleteExpr;
import org.desugar.ast.expr.ExprWithCleanups;
import org.desugar.ast.expr.FloatingLiteralExpr;
import org.desugar.ast.expr.FunctionalCastExpr;
import org.desugar.ast.expr.GnuNullExpr;
import org.desugar.ast.expr.ImplicitCastExpr;
import org.desugar.ast.expr.InitListExpr;
import org.desugar.ast.expr.IntegerLiteralExpr;
import org.desugar.ast.expr.LambdaExpr;
import org.desugar.ast.expr.MaterializeTemporaryExpr;
import org.desugar.ast.expr.MemberCallExpr;
import org.desugar.ast.expr.MemberExpr;
import org.desugar.ast.expr.NamedCastExpr;
import org.desugar.ast.expr.NewExpr;
import org.desugar.ast.expr.NullPtrLiteralExpr;
import org.desugar.ast.expr.OpaqueValueExpr;
import org.desugar.ast.expr.OperatorCallExpr;
import org.desugar.ast.expr.ParenExpr;
import org.desugar.ast.expr.PredefinedExpr;
import org.desugar.ast.expr.SizeOfAlignOfExpr;
import org.desugar.ast.expr.StdInitializerListExpr;
import org.desugar.ast.expr.StringLiteralExpr;
import org.desugar.ast.expr.SubstNonTypeTemplateParmExpr;
import org.desugar.ast.expr.ThisExpr;
import org.desugar.ast.expr.TypeidExpr;
import org.desugar.ast.expr.UnaryOperator;
import org.desugar.ast.expr.UnresolvedLookupExpr;
import org.desugar.ast.expr.UnsupportedExpr;
import org.desugar.ast.stmt.BreakStmt;
import org.desugar.ast.stmt.CaseStmt;
import org.desugar.ast.stmt.CompoundStmt;
import org.desugar.ast.stmt.ContinueStmt;
import org.desugar.ast.stmt.DeclStmt;
import org.desugar.ast.stmt.DefaultStmt;
import org.desugar.ast.stmt.DoStmt;
import org.desugar.ast.stmt.ForStmt;
import org.desugar.ast.stmt.IfStmt;
import org.desugar.ast.stmt.NullStmt;
import org.desugar.ast.stmt.RangeForStmt;
import org.desugar.ast.stmt.ReturnStmt;
import org.desugar.ast.stmt.SwitchStmt;
import org.desugar.ast.stmt.UnsupportedStmt;
import org.desugar.ast.stmt.WhileStmt;

/**
 * One method per concrete node kind. Adding a node kind without adding it here, and to every
 * implementation, does not compile.
 *
 * @param <A> the argument passed down the traversal
 */
public interface VoidVisitor<A> {

    // statements

    void visit(BreakStmt n, A arg);

    void visit(CaseStmt n, A arg);

    void visit(CompoundStmt n, A arg);

    void visit(ContinueStmt n, A arg);

    void visit(DeclStmt n, A arg);

    void visit(DefaultStmt n, A arg);

    void visit(DoStmt n, A arg);

    void visit(ForStmt n, A arg);

    void visit(IfStmt n, A arg);

    void visit(NullStmt n, A arg);

    void visit(RangeForStmt n, A arg);

    void visit(ReturnStmt n, A arg);

    void visit(SwitchStmt n, A arg);

    void visit(UnsupportedStmt n, A arg);

    void visit(WhileStmt n, A arg);

    // expressions

    void visit(ArrayInitIndexExpr n, A arg);

    void visit(ArrayInitLoopExpr n, A arg);

    void visit(ArraySubscriptExpr n, A arg);

    void visit(BinaryOperator n, A arg);

    void visit(BindTemporaryExpr n, A arg);

    void visit(BoolLiteralExpr n, A arg);

    void visit(CStyleCastExpr n, A arg);

    void visit(CallExpr n, A arg);

    void visit(CharLiteralExpr n, A arg);

    void visit(ConditionalOperator n, A arg);

    void visit(ConstructExpr n, A arg);

    void visit(DeclRefExpr n, A arg);

    void visit(DefaultArgExpr n, A arg);

    void visit(DefaultInitExpr n, A arg);

    void visit(DeleteExpr n, A arg);

    void visit(ExprWithCleanups n, A arg);

    void visit(FloatingLiteralExpr n, A arg);

    void visit(FunctionalCastExpr n, A arg);

    void visit(GnuNullExpr n, A arg);

    void visit(ImplicitCastExpr n, A arg);

    void visit(InitListExpr n, A arg);

    void visit(IntegerLiteralExpr n, A arg);

    void visit(LambdaExpr n, A arg);

    void visit(MaterializeTemporaryExpr n, A arg);

    void visit(MemberCallExpr n, A arg);

    void visit(MemberExpr n, A arg);

    void visit(NamedCastExpr n, A arg);

    void visit(NewExpr n, A arg);

    void visit(NullPtrLiteralExpr n, A arg);

    void visit(OpaqueValueExpr n, A arg);

    void visit(OperatorCallExpr n, A arg);

    void visit(ParenExpr n, A arg);

    void visit(PredefinedExpr n, A arg);

    void visit(SizeOfAlignOfExpr n, A arg);

    void visit(StdInitializerListExpr n, A arg);

    void visit(StringLiteralExpr n, A arg);

    void visit(SubstNonTypeTemplateParmExpr n, A arg);

    void visit(ThisExpr n, A arg);

    void visit(TypeidExpr n, A arg);

    void visit(UnaryOperator n, A arg);

    void visit(UnresolvedLookupExpr n, A arg);

    void visit(UnsupportedExpr n, A arg);

    // declarations

    void visit(AccessSpecDecl n, A arg);

    void visit(BindingDecl n, A arg);

    void visit(DecompositionDecl n, A arg);

    void visit(FieldDecl n, A arg);

    void visit(FunctionDecl n, A arg);

    void visit(MethodDecl n, A arg);

    void visit(ParmVarDecl n, A arg);

    void visit(RecordDecl n, A arg);

    void visit(StaticAssertDecl n, A arg);

    void visit(TranslationUnitDecl n, A arg);

    void visit(TypeAliasDecl n, A arg);

    void visit(TypedefDecl n, A arg);

    void visit(UnsupportedDecl n, A arg);

    void visit(UsingDecl n, A arg);

    void visit(VarDecl n, A arg);
}
