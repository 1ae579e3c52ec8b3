package org.desugar.printer;

import org.desugar.ast.expr.DeclRefExpr;
import org.desugar.lambda.LambdaStack;

/**
 * Prints the access path of a binding. References to the decomposed object itself, which has no
 * name of its own, are replaced by the hidden variable.
 */
public class StructuredBindingsCodeGenerator extends CodeGenerator {

    private final String tmpVarName;

    public StructuredBindingsCodeGenerator(OutputBuffer out, LambdaStack lambdaStack, LoweringContext context, String tmpVarName) {
        super(out, lambdaStack, context);
        this.tmpVarName = tmpVarName;
    }

    @Override
    protected CodeGenerator withBuffer(OutputBuffer buffer) {
        return new StructuredBindingsCodeGenerator(buffer, lambdaStack, context, tmpVarName);
    }

    @Override
    public void visit(DeclRefExpr n, Void arg) {
        String name = n.getName();

        out.append(name);

        // a qualified reference to the unnamed object ends with the scope operator
        if (name.isEmpty() || name.endsWith("::")) {
            out.append(tmpVarName);
        }
    }
}
