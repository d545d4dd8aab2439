package analysis.pointer.engine;

import com.ibm.wala.util.intset.IntSet;

/**
 * Pending addition to the points-to set of a node
 */
public final class PointsToDelta {

    private final int node;
    /**
     * Never modified once the delta has been created
     */
    private final IntSet pointsTo;

    /**
     * Create a pending addition
     *
     * @param node id of the node to add to
     * @param pointsTo abstract objects to add
     */
    public PointsToDelta(int node, IntSet pointsTo) {
        this.node = node;
        this.pointsTo = pointsTo;
    }

    public int getNode() {
        return node;
    }

    public IntSet getPointsTo() {
        return pointsTo;
    }

    @Override
    public String toString() {
        return node + " += " + pointsTo;
    }
}
