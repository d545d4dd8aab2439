package analysis.pointer.graph;

import ir.AccessPath;

/**
 * Dictionary key of a {@link ProjectionNode}: a local of a contextual call and an access path on it
 */
public final class ProjectionKey {

    private final ContextualCall call;
    private final int local;
    private final AccessPath path;
    private final int memoizedHashCode;

    /**
     * Create a key
     *
     * @param call function and context owning the local
     * @param local index of the local
     * @param path projections applied to the local
     */
    public ProjectionKey(ContextualCall call, int local, AccessPath path) {
        this.call = call;
        this.local = local;
        this.path = path;
        this.memoizedHashCode = computeHashCode();
    }

    private int computeHashCode() {
        return (call.hashCode() * 31 + local) * 31 + path.hashCode();
    }

    public ContextualCall getCall() {
        return call;
    }

    public int getLocal() {
        return local;
    }

    public AccessPath getPath() {
        return path;
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
        if (!(obj instanceof ProjectionKey)) {
            return false;
        }
        ProjectionKey other = (ProjectionKey) obj;
        return local == other.local && path.equals(other.path) && call.equals(other.call);
    }

    @Override
    public String toString() {
        if (path.isEmpty()) {
            return "_" + local + " of " + call;
        }
        return "(_" + local + path + ") of " + call;
    }
}
