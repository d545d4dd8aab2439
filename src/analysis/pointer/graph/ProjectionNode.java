package analysis.pointer.graph;

import ir.AccessPath;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.ibm.wala.util.intset.IntSet;
import com.ibm.wala.util.intset.MutableIntSet;
import com.ibm.wala.util.intset.MutableSparseIntSet;

/**
 * Cell of the pointer flow graph: an access path on a local of a contextual call. The id of a node that has drop
 * sites doubles as the id of the abstract object dropped there.
 */
public final class ProjectionNode {

    private final int id;
    private final ProjectionKey key;
    /**
     * Abstract objects (ids of their dropping nodes) this cell may point to
     */
    private final MutableIntSet pointsTo = MutableSparseIntSet.makeEmpty();
    private final List<ContextualSite> dropSites = new ArrayList<>();
    /**
     * Outgoing edges keyed by target node id
     */
    private final Map<Integer, FlowEdge> edges = new LinkedHashMap<>();

    /**
     * Create a node, should only be called by {@link PointerFlowGraph}
     *
     * @param id unique id of the node
     * @param key key of the node
     */
    ProjectionNode(int id, ProjectionKey key) {
        this.id = id;
        this.key = key;
    }

    public int getId() {
        return id;
    }

    public ProjectionKey getKey() {
        return key;
    }

    public ContextualCall getCall() {
        return key.getCall();
    }

    public int getLocal() {
        return key.getLocal();
    }

    public AccessPath getPath() {
        return key.getPath();
    }

    /**
     * Abstract objects this node may point to
     *
     * @return read-only view of the points-to set
     */
    public IntSet getPointsTo() {
        return pointsTo;
    }

    /**
     * Add to the points-to set of this node
     *
     * @param delta objects to add
     * @return true if the set changed
     */
    boolean addAllToPointsTo(IntSet delta) {
        return pointsTo.addAll(delta);
    }

    /**
     * Record a drop of this cell
     *
     * @param site where the drop happens
     * @return true if this is the first drop recorded for this cell
     */
    public boolean addDropSite(ContextualSite site) {
        dropSites.add(site);
        return dropSites.size() == 1;
    }

    public List<ContextualSite> getDropSites() {
        return Collections.unmodifiableList(dropSites);
    }

    public boolean hasDropSites() {
        return !dropSites.isEmpty();
    }

    public Collection<FlowEdge> getEdges() {
        return Collections.unmodifiableCollection(edges.values());
    }

    /**
     * Get the edge to the given node
     *
     * @param target id of the target
     * @return the edge or null if there is none
     */
    public FlowEdge getEdge(int target) {
        return edges.get(target);
    }

    /**
     * Add an outgoing edge, should only be called by {@link PointerFlowGraph}
     *
     * @param e edge with this node as the source
     * @return true if there was no edge to the same target
     */
    boolean addEdge(FlowEdge e) {
        assert e.getSource() == id;
        if (edges.containsKey(e.getTarget())) {
            return false;
        }
        edges.put(e.getTarget(), e);
        return true;
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ProjectionNode)) {
            return false;
        }
        return id == ((ProjectionNode) obj).id;
    }

    @Override
    public String toString() {
        return "#" + id + " " + key;
    }
}
