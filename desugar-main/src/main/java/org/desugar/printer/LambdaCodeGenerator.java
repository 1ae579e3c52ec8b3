package org.desugar.printer;

import org.desugar.ast.expr.ThisExpr;
import org.desugar.lambda.LambdaStack;

/**
 * Prints the members of a closure class. The enclosing object is reached through the captured
 * {@code __this}.
 */
public class LambdaCodeGenerator extends CodeGenerator {

    public LambdaCodeGenerator(OutputBuffer out, LambdaStack lambdaStack, LoweringContext context) {
        super(out, lambdaStack, context);
    }

    @Override
    protected CodeGenerator withBuffer(OutputBuffer buffer) {
        return new LambdaCodeGenerator(buffer, lambdaStack, context);
    }

    @Override
    public void visit(ThisExpr n, Void arg) {
        out.append("__this");
    }
}
