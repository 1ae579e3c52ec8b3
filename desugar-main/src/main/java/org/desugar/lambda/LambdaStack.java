package org.desugar.lambda;

import org.desugar.LoweringException;
import org.desugar.printer.OutputBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Stack of active {@link LambdaContext}s of one generator pass. Entries are opened with
 * {@link #push(LambdaCallerType, OutputBuffer)} in a try-with-resources block so they are
 * popped, and their hoisted classes merged, on every exit path.
 */
public class LambdaStack {

    private static final Logger LOGGER = LoggerFactory.getLogger(LambdaStack.class);

    private final Deque<LambdaContext> contexts = new ArrayDeque<>();

    /**
     * Opens a context. Its target is the side buffer of the outermost active context that anchors
     * placement, or {@code ambient} when there is none.
     */
    public LambdaScope push(LambdaCallerType callerType, OutputBuffer ambient) {
        return push(callerType, ambient, ambient.length());
    }

    /**
     * Opens a context whose classes go to {@code ambientPosition} when they are written to
     * {@code ambient} directly. Below an anchoring context they go to the end of its side buffer.
     */
    public LambdaScope push(LambdaCallerType callerType, OutputBuffer ambient, int ambientPosition) {
        OutputBuffer target = destination(ambient);
        int insertPosition = target == ambient ? ambientPosition : target.length();
        LambdaContext context = new LambdaContext(callerType, target, insertPosition);
        contexts.addLast(context);
        LOGGER.debug("push {} at {}, depth {}", callerType, context.getInsertPosition(), contexts.size());
        return new LambdaScope(this, context);
    }

    private OutputBuffer destination(OutputBuffer ambient) {
        // outermost first
        for (LambdaContext context : contexts) {
            if (context.getCallerType().anchorsPlacement()) {
                return context.getBuffer();
            }
        }
        return ambient;
    }

    void pop(LambdaContext expected) {
        LambdaContext top = contexts.peekLast();
        if (top != expected) {
            throw new LoweringException("lambda contexts closed out of order", null);
        }
        contexts.removeLast();
        LOGGER.debug("pop {}, depth {}", top.getCallerType(), contexts.size());
        top.finish();
    }

    public LambdaContext back() {
        LambdaContext top = contexts.peekLast();
        if (top == null) {
            throw new LoweringException("no active lambda context", null);
        }
        return top;
    }

    public boolean isEmpty() {
        return contexts.isEmpty();
    }

    public int size() {
        return contexts.size();
    }

    /**
     * Iterates from the outermost to the innermost context.
     */
    public Iterator<LambdaContext> iterator() {
        return contexts.iterator();
    }
}
