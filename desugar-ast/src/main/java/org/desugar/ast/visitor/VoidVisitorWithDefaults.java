package org.desugar.ast.visitor;

import org.desugar.ast.Node;
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
 * A {@link VoidVisitor} routing every kind to {@link #defaultAction(Node, Object)}. Subclasses
 * override the kinds they care about.
 */
public abstract class VoidVisitorWithDefaults<A> implements VoidVisitor<A> {

    public void defaultAction(Node n, A arg) {
        // nothing
    }

    @Override
    public void visit(BreakStmt n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(CaseStmt n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(CompoundStmt n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(ContinueStmt n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(DeclStmt n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(DefaultStmt n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(DoStmt n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(ForStmt n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(IfStmt n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(NullStmt n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(RangeForStmt n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(ReturnStmt n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(SwitchStmt n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(UnsupportedStmt n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(WhileStmt n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(ArrayInitIndexExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(ArrayInitLoopExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(ArraySubscriptExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(BinaryOperator n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(BindTemporaryExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(BoolLiteralExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(CStyleCastExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(CallExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(CharLiteralExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(ConditionalOperator n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(ConstructExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(DeclRefExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(DefaultArgExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(DefaultInitExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(DeleteExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(ExprWithCleanups n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(FloatingLiteralExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(FunctionalCastExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(GnuNullExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(ImplicitCastExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(InitListExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(IntegerLiteralExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(LambdaExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(MaterializeTemporaryExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(MemberCallExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(MemberExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(NamedCastExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(NewExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(NullPtrLiteralExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(OpaqueValueExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(OperatorCallExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(ParenExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(PredefinedExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(SizeOfAlignOfExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(StdInitializerListExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(StringLiteralExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(SubstNonTypeTemplateParmExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(ThisExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(TypeidExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(UnaryOperator n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(UnresolvedLookupExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(UnsupportedExpr n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(AccessSpecDecl n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(BindingDecl n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(DecompositionDecl n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(FieldDecl n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(FunctionDecl n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(MethodDecl n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(ParmVarDecl n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(RecordDecl n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(StaticAssertDecl n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(TranslationUnitDecl n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(TypeAliasDecl n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(TypedefDecl n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(UnsupportedDecl n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(UsingDecl n, A arg) {
        defaultAction(n, arg);
    }

    @Override
    public void visit(VarDecl n, A arg) {
        defaultAction(n, arg);
    }
}
