package org.desugar;

/**
 * Root of all exceptions raised while lowering a tree.
 */
public class DesugarException extends RuntimeException {

    public DesugarException(String message) {
        super(message);
    }

    public DesugarException(String message, Throwable cause) {
        super(message, cause);
    }

    public DesugarException(Throwable cause) {
        super(cause);
    }
}
