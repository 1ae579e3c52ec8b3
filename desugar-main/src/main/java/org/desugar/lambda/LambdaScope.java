package org.desugar.lambda;

/**
 * Handle of a pushed {@link LambdaContext}; closing it pops the context.
 */
public final class LambdaScope implements AutoCloseable {

    private final LambdaStack stack;
    private final LambdaContext context;
    private boolean closed;

    LambdaScope(LambdaStack stack, LambdaContext context) {
        this.stack = stack;
        this.context = context;
    }

    public LambdaContext getContext() {
        return context;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            stack.pop(context);
        }
    }
}
