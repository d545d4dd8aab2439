package analysis.pointer.graph;

/**
 * Flow edge with a dereferencing end, recorded for the use-after-free check
 */
public final class DerefEdge {

    private final int from;
    private final int to;
    private final boolean fromDeref;
    private final boolean toDeref;

    /**
     * Record a dereferencing edge
     *
     * @param from id of the source node
     * @param to id of the target node
     * @param fromDeref whether the source is dereferenced
     * @param toDeref whether the target is dereferenced
     */
    public DerefEdge(int from, int to, boolean fromDeref, boolean toDeref) {
        this.from = from;
        this.to = to;
        this.fromDeref = fromDeref;
        this.toDeref = toDeref;
    }

    public int getFrom() {
        return from;
    }

    public int getTo() {
        return to;
    }

    public boolean isFromDeref() {
        return fromDeref;
    }

    public boolean isToDeref() {
        return toDeref;
    }

    @Override
    public int hashCode() {
        return ((from * 31 + to) * 2 + (fromDeref ? 1 : 0)) * 2 + (toDeref ? 1 : 0);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof DerefEdge)) {
            return false;
        }
        DerefEdge other = (DerefEdge) obj;
        return from == other.from && to == other.to && fromDeref == other.fromDeref && toDeref == other.toDeref;
    }

    @Override
    public String toString() {
        return "deref(" + from + (fromDeref ? "*" : "") + " -> " + to + (toDeref ? "*" : "") + ")";
    }
}
