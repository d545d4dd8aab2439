package analysis.pointer.graph;

import ir.FunctionId;

/**
 * A function analyzed in a particular calling context
 */
public final class ContextualCall {

    private final FunctionId function;
    private final CallContext context;
    private final int memoizedHashCode;

    /**
     * Create a function and context pair
     *
     * @param function analyzed function
     * @param context context the function is called in
     */
    public ContextualCall(FunctionId function, CallContext context) {
        assert function != null;
        assert context != null;
        this.function = function;
        this.context = context;
        this.memoizedHashCode = function.hashCode() * 31 + context.hashCode();
    }

    public FunctionId getFunction() {
        return function;
    }

    public CallContext getContext() {
        return context;
    }

    @Override
    public int hashCode() {
        return memoizedHashCode;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ContextualCall)) {
            return false;
        }
        ContextualCall other = (ContextualCall) obj;
        return function.equals(other.function) && context.equals(other.context);
    }

    @Override
    public String toString() {
        return function + " in " + context;
    }
}
