package analysis.pointer.graph;

import ir.SourceLocation;

/**
 * Program location of an effect (a drop or the effect that created a flow edge) in the context it was analyzed in
 */
public final class ContextualSite {

    private final GlobalBasicBlock block;
    private final SourceLocation location;
    private final CallContext context;
    private final int memoizedHashCode;

    /**
     * Create a site
     *
     * @param block block containing the effect
     * @param location source location of the effect
     * @param context context of the enclosing function
     */
    public ContextualSite(GlobalBasicBlock block, SourceLocation location, CallContext context) {
        this.block = block;
        this.location = location;
        this.context = context;
        this.memoizedHashCode = computeHashCode();
    }

    private int computeHashCode() {
        return (block.hashCode() * 31 + location.hashCode()) * 31 + context.hashCode();
    }

    public GlobalBasicBlock getBlock() {
        return block;
    }

    public SourceLocation getLocation() {
        return location;
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
        if (!(obj instanceof ContextualSite)) {
            return false;
        }
        ContextualSite other = (ContextualSite) obj;
        return block.equals(other.block) && location.equals(other.location) && context.equals(other.context);
    }

    @Override
    public String toString() {
        return block + " (" + location + ") in " + context;
    }
}
