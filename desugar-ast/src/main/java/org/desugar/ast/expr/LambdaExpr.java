package org.desugar.ast.expr;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.decl.MethodDecl;
import org.desugar.ast.decl.RecordDecl;
import org.desugar.ast.visitor.VoidVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A closure expression. The front end has already synthesized its class: the call operator, the
 * conversion to function pointer and the static invoker live on {@link #getLambdaClass()}.
 * {@link #getCaptureInits()} holds one initializer per capture, in capture order.
 */
public class LambdaExpr extends Expr {

    private final RecordDecl lambdaClass;
    private final List<LambdaCapture> captures;
    private final List<Expr> captureInits;

    public LambdaExpr(Position begin, RecordDecl lambdaClass, List<LambdaCapture> captures, List<Expr> captureInits) {
        super(begin, lambdaClass.getTypeForDecl());
        if (captures.size() != captureInits.size()) {
            throw new IllegalArgumentException("one initializer per capture expected");
        }
        this.lambdaClass = lambdaClass;
        this.captures = List.copyOf(captures);
        this.captureInits = Collections.unmodifiableList(new ArrayList<>(captureInits));
    }

    public RecordDecl getLambdaClass() {
        return lambdaClass;
    }

    public MethodDecl getCallOperator() {
        return lambdaClass.getLambdaCallOperator();
    }

    public boolean isGenericLambda() {
        return lambdaClass.isGenericLambda();
    }

    public List<LambdaCapture> getCaptures() {
        return captures;
    }

    public int getCaptureSize() {
        return captures.size();
    }

    public List<Expr> getCaptureInits() {
        return captureInits;
    }

    @Override
    public List<Node> getChildNodes() {
        return childrenOf(captureInits);
    }

    @Override
    public <A> void accept(VoidVisitor<A> v, A arg) {
        v.visit(this, arg);
    }
}
