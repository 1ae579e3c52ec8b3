package org.desugar;

/**
 * An internal error of the generator itself, such as unbalanced scopes.
 */
public class LoweringException extends DesugarException {

    private final String nodeDescription;

    public LoweringException(String message, String nodeDescription) {
        super(message);
        this.nodeDescription = nodeDescription;
    }

    public LoweringException(String message, String nodeDescription, Throwable cause) {
        super(message, cause);
        this.nodeDescription = nodeDescription;
    }

    /**
     * The node being lowered when the error happened, or null when unknown.
     */
    public String getNodeDescription() {
        return nodeDescription;
    }
}
