package analysis.pointer.graph;

/**
 * Edge of the pointer flow graph: whatever the source node points to, the target node may point to
 */
public final class FlowEdge {

    private final int source;
    private final int target;
    /**
     * Effect that created the edge
     */
    private final ContextualSite site;
    private final boolean sourceDeref;
    private final boolean targetDeref;

    /**
     * Create a flow edge
     *
     * @param source id of the source node
     * @param target id of the target node
     * @param site effect that created the edge
     * @param sourceDeref whether the source is dereferenced by the effect
     * @param targetDeref whether the target is dereferenced by the effect
     */
    public FlowEdge(int source, int target, ContextualSite site, boolean sourceDeref, boolean targetDeref) {
        this.source = source;
        this.target = target;
        this.site = site;
        this.sourceDeref = sourceDeref;
        this.targetDeref = targetDeref;
    }

    public int getSource() {
        return source;
    }

    public int getTarget() {
        return target;
    }

    public ContextualSite getSite() {
        return site;
    }

    public boolean isSourceDeref() {
        return sourceDeref;
    }

    public boolean isTargetDeref() {
        return targetDeref;
    }

    /**
     * Does either end of this edge dereference
     *
     * @return true if the edge must be checked for use after free
     */
    public boolean isDeref() {
        return sourceDeref || targetDeref;
    }

    @Override
    public int hashCode() {
        return source * 31 + target;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof FlowEdge)) {
            return false;
        }
        FlowEdge other = (FlowEdge) obj;
        return source == other.source && target == other.target;
    }

    @Override
    public String toString() {
        return source + (sourceDeref ? "*" : "") + " -> " + target + (targetDeref ? "*" : "");
    }
}
