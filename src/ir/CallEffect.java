package ir;

import java.util.Collections;
import java.util.List;

/**
 * Call terminating a basic block, <code>destination = callee(args)</code>
 */
public final class CallEffect {

    private final FunctionId callee;
    private final List<Operand> args;
    private final Place destination;
    private final SourceLocation location;
    /**
     * Local implementations that may be dispatched to if the callee itself has no body
     */
    private final List<FunctionId> candidates;

    /**
     * Create a call effect
     *
     * @param callee called function
     * @param args arguments in order, argument i binds parameter local i+1
     * @param destination place receiving the return value
     * @param location source location of the call
     * @param candidates possible dispatch targets for an abstract callee, may be empty
     */
    public CallEffect(FunctionId callee, List<Operand> args, Place destination, SourceLocation location,
                      List<FunctionId> candidates) {
        this.callee = callee;
        this.args = Collections.unmodifiableList(args);
        this.destination = destination;
        this.location = location;
        this.candidates = Collections.unmodifiableList(candidates);
    }

    public FunctionId getCallee() {
        return callee;
    }

    public List<Operand> getArgs() {
        return args;
    }

    public Place getDestination() {
        return destination;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public List<FunctionId> getCandidates() {
        return candidates;
    }

    @Override
    public String toString() {
        return destination + " = " + callee + args;
    }
}
