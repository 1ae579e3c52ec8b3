package org.desugar.printer;

import org.desugar.ast.expr.ArrayInitIndexExpr;
import org.desugar.lambda.LambdaStack;

/**
 * Prints one element initializer of an array init loop with the loop index filled in.
 */
public class ArrayInitCodeGenerator extends CodeGenerator {

    private final long index;

    public ArrayInitCodeGenerator(OutputBuffer out, LambdaStack lambdaStack, LoweringContext context, long index) {
        super(out, lambdaStack, context);
        this.index = index;
    }

    @Override
    protected CodeGenerator withBuffer(OutputBuffer buffer) {
        return new ArrayInitCodeGenerator(buffer, lambdaStack, context, index);
    }

    @Override
    public void visit(ArrayInitIndexExpr n, Void arg) {
        out.append(String.valueOf(index));
    }
}
