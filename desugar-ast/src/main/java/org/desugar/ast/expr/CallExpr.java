package org.desugar.ast.expr;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.decl.FunctionDecl;
import org.desugar.ast.type.Type;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.List;

public class CallExpr extends Expr {

    private final Expr callee;
    private final List<Expr> args;
    private boolean userDefinedLiteral;

    public CallExpr(Position begin, Type type, Expr callee, List<Expr> args) {
        super(begin, type);
        this.callee = callee;
        this.args = List.copyOf(args);
    }

    public Expr getCallee() {
        return callee;
    }

    public List<Expr> getArgs() {
        return args;
    }

    public int getNumArgs() {
        return args.size();
    }

    public Expr getArg(int i) {
        return args.get(i);
    }

    /**
     * True for a call of a literal operator, as in {@code 12_km}.
     */
    public boolean isUserDefinedLiteral() {
        return userDefinedLiteral;
    }

    public CallExpr setUserDefinedLiteral(boolean userDefinedLiteral) {
        this.userDefinedLiteral = userDefinedLiteral;
        return this;
    }

    /**
     * The function called when the callee names one directly, otherwise null.
     */
    public FunctionDecl getDirectCallee() {
        Expr c = callee.ignoreImpCasts();
        if (c instanceof DeclRefExpr && ((DeclRefExpr) c).getDecl() instanceof FunctionDecl) {
            return (FunctionDecl) ((DeclRefExpr) c).getDecl();
        }
        if (c instanceof MemberExpr && ((MemberExpr) c).getMemberDecl() instanceof FunctionDecl) {
            return (FunctionDecl) ((MemberExpr) c).getMemberDecl();
        }
        return null;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(callee, args);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
