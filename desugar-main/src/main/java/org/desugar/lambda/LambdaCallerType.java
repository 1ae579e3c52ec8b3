package org.desugar.lambda;

/**
 * The construct that opened a {@link LambdaContext}.
 */
public enum LambdaCallerType {
    CALL_EXPR,
    VAR_DECL,
    RETURN_STMT,
    BINARY_OPERATOR,
    MEMBER_CALL_EXPR,
    OPERATOR_CALL_EXPR,
    /** The header of an {@code if}, {@code switch} or loop. */
    CONTROL_STMT,
    LAMBDA_EXPR;

    /**
     * Whether closure classes met below a context of this type are placed in front of it.
     */
    public boolean anchorsPlacement() {
        return this != LAMBDA_EXPR;
    }

    /**
     * Whether a closure object is constructed at its use site, with the initializer list printed
     * there, instead of being declared right after its class.
     */
    public boolean keepsInitsAtUseSite() {
        return this == CALL_EXPR || this == VAR_DECL;
    }
}
