package org.desugar.ast.expr;

public enum CastKind {
    DEPENDENT,
    NO_OP,
    LVALUE_TO_RVALUE,
    ARRAY_TO_POINTER_DECAY,
    FUNCTION_TO_POINTER_DECAY,
    NULL_TO_POINTER,
    INTEGRAL_CAST,
    INTEGRAL_TO_BOOLEAN,
    INTEGRAL_TO_FLOATING,
    INTEGRAL_TO_POINTER,
    POINTER_TO_INTEGRAL,
    POINTER_TO_BOOLEAN,
    FLOATING_TO_INTEGRAL,
    FLOATING_TO_BOOLEAN,
    FLOATING_CAST,
    DERIVED_TO_BASE,
    UNCHECKED_DERIVED_TO_BASE,
    BASE_TO_DERIVED,
    BIT_CAST,
    TO_VOID,
    CONSTRUCTOR_CONVERSION,
    USER_DEFINED_CONVERSION;

    /**
     * Whether an implicit cast of this kind changes the value or its static type in a way a reader
     * should see. Decays, lvalue-to-rvalue conversions and no-ops are not.
     */
    public boolean isSemanticallyMeaningful() {
        switch (this) {
            case INTEGRAL_CAST:
            case INTEGRAL_TO_BOOLEAN:
            case INTEGRAL_TO_FLOATING:
            case FLOATING_TO_INTEGRAL:
            case FLOATING_TO_BOOLEAN:
            case FLOATING_CAST:
            case POINTER_TO_BOOLEAN:
            case DERIVED_TO_BASE:
            case UNCHECKED_DERIVED_TO_BASE:
            case BIT_CAST:
                return true;
            default:
                return false;
        }
    }

    public boolean isDerivedToBase() {
        return this == DERIVED_TO_BASE || this == UNCHECKED_DERIVED_TO_BASE;
    }

    /**
     * Conversions that reinterpret the bits of the operand.
     */
    public boolean isReinterpreting() {
        return this == BIT_CAST || this == INTEGRAL_TO_POINTER || this == POINTER_TO_INTEGRAL;
    }
}
