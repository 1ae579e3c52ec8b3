package org.desugar.util;

import com.github.javaparser.Position;
import org.desugar.ast.Node;
import org.desugar.ast.decl.RecordDecl;
import org.desugar.ast.expr.LambdaExpr;

/**
 * Names of the entities the generator introduces. All of them are derived from the original name
 * and the source location, so repeated runs over the same tree produce the same text.
 */
public final class NameUtils {

    private static final String INTERNAL_PREFIX = "__";

    private NameUtils() {
    }

    public static String buildInternalVarName(String name) {
        return INTERNAL_PREFIX + name;
    }

    public static String buildInternalVarName(String name, Position position) {
        if (position == null) {
            return buildInternalVarName(name);
        }
        return INTERNAL_PREFIX + name + position.line;
    }

    public static String buildInternalVarName(String name, Node at) {
        return buildInternalVarName(name, at.getBegin().orElse(null));
    }

    public static String buildLambdaName(Position position) {
        if (position == null) {
            return INTERNAL_PREFIX + "lambda";
        }
        return INTERNAL_PREFIX + "lambda_" + position.line + "_" + position.column;
    }

    public static String getLambdaName(LambdaExpr lambda) {
        return getLambdaName(lambda.getLambdaClass());
    }

    /**
     * The name of a closure class, derived from where the closure was written.
     */
    public static String getLambdaName(RecordDecl lambdaClass) {
        return buildLambdaName(lambdaClass.getBegin().orElse(null));
    }

    public static String buildFunctionPointerAliasName(Node decl) {
        return "FuncPtr_" + decl.getBegin().map(p -> String.valueOf(p.line)).orElse("");
    }

    public static String buildGuardName(String internalVarName) {
        return internalVarName + "B";
    }
}
