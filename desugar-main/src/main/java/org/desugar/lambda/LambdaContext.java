package org.desugar.lambda;

import org.desugar.printer.OutputBuffer;

/**
 * One entry of the {@link LambdaStack}. Class definitions of closures met while the context is
 * active are written to the side buffer; {@link #finish()} moves them in front of the construct
 * that opened the context.
 */
public class LambdaContext {

    private final LambdaCallerType callerType;
    private final OutputBuffer target;
    private final int insertPosition;
    private final OutputBuffer sideBuffer;
    private final StringBuilder inits = new StringBuilder();

    LambdaContext(LambdaCallerType callerType, OutputBuffer target, int insertPosition) {
        this.callerType = callerType;
        this.target = target;
        this.insertPosition = insertPosition;
        this.sideBuffer = target.newChild();
    }

    public LambdaCallerType getCallerType() {
        return callerType;
    }

    /**
     * Where class definitions go while this context is active.
     */
    public OutputBuffer getBuffer() {
        return sideBuffer;
    }

    public OutputBuffer getTarget() {
        return target;
    }

    public int getInsertPosition() {
        return insertPosition;
    }

    public String getInits() {
        return inits.toString();
    }

    public void appendInits(String text) {
        inits.append(text);
    }

    /**
     * Writes the pending use-site initializer list to {@code out} and clears it.
     */
    public void insertInits(OutputBuffer out) {
        out.append(inits.toString());
        inits.setLength(0);
    }

    void finish() {
        if (!sideBuffer.isEmpty()) {
            target.insertAt(insertPosition, sideBuffer.getString());
        }
    }
}
