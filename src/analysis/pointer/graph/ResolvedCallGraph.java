package analysis.pointer.graph;

import ir.FunctionId;

import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.ibm.wala.util.graph.impl.SlowSparseNumberedGraph;
import com.ibm.wala.util.graph.traverse.DFS;

/**
 * Context-insensitive call graph over the functions with local IR, built while the reachable contextual calls are
 * expanded. Each edge remembers the calling blocks.
 */
public final class ResolvedCallGraph {

    private final SlowSparseNumberedGraph<FunctionId> graph = SlowSparseNumberedGraph.make();
    /**
     * Callees resolved at each calling block
     */
    private final Map<GlobalBasicBlock, Set<FunctionId>> calleesAtSite = new HashMap<>();
    /**
     * Calling blocks within each function
     */
    private final Map<FunctionId, Set<GlobalBasicBlock>> callSitesInFunction = new HashMap<>();
    /**
     * Memoized transitive callees, cleared whenever an edge is added
     */
    private final Map<FunctionId, Set<FunctionId>> reachableCache = new HashMap<>();

    /**
     * Add a function even if it has no calls
     *
     * @param f function to add
     */
    public void addFunction(FunctionId f) {
        if (!graph.containsNode(f)) {
            graph.addNode(f);
        }
    }

    /**
     * Record that the given block calls the given function
     *
     * @param site calling block
     * @param callee function with local IR called from the block
     * @return true if the call was not already recorded
     */
    public boolean addCall(GlobalBasicBlock site, FunctionId callee) {
        addFunction(site.getFunction());
        addFunction(callee);

        Set<FunctionId> callees = calleesAtSite.get(site);
        if (callees == null) {
            callees = new LinkedHashSet<>();
            calleesAtSite.put(site, callees);
        }
        if (!callees.add(callee)) {
            return false;
        }

        Set<GlobalBasicBlock> sites = callSitesInFunction.get(site.getFunction());
        if (sites == null) {
            sites = new LinkedHashSet<>();
            callSitesInFunction.put(site.getFunction(), sites);
        }
        sites.add(site);

        if (!graph.hasEdge(site.getFunction(), callee)) {
            graph.addEdge(site.getFunction(), callee);
        }
        reachableCache.clear();
        return true;
    }

    /**
     * Functions called from a block
     *
     * @param site calling block
     * @return resolved callees, empty if the block makes no resolved call
     */
    public Set<FunctionId> getCallees(GlobalBasicBlock site) {
        Set<FunctionId> callees = calleesAtSite.get(site);
        if (callees == null) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(callees);
    }

    /**
     * Blocks of a function that make resolved calls
     *
     * @param f calling function
     * @return calling blocks
     */
    public Set<GlobalBasicBlock> getCallSites(FunctionId f) {
        Set<GlobalBasicBlock> sites = callSitesInFunction.get(f);
        if (sites == null) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(sites);
    }

    /**
     * Can a call to <code>from</code> (transitively) lead to a call to <code>to</code>. Every function reaches itself.
     *
     * @param from caller
     * @param to callee
     * @return true if there is a path in the call graph
     */
    public boolean canReach(FunctionId from, FunctionId to) {
        if (from.equals(to)) {
            return true;
        }
        if (!graph.containsNode(from) || !graph.containsNode(to)) {
            return false;
        }
        Set<FunctionId> reachable = reachableCache.get(from);
        if (reachable == null) {
            reachable = DFS.getReachableNodes(graph, Collections.singleton(from));
            reachableCache.put(from, reachable);
        }
        return reachable.contains(to);
    }

    /**
     * Functions with no recorded callers
     *
     * @return roots of the graph
     */
    public Set<FunctionId> getRoots() {
        Set<FunctionId> roots = new LinkedHashSet<>();
        for (FunctionId f : graph) {
            if (graph.getPredNodeCount(f) == 0) {
                roots.add(f);
            }
        }
        return roots;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (FunctionId f : graph) {
            sb.append(f).append(" -> ");
            Iterator<FunctionId> iter = graph.getSuccNodes(f);
            while (iter.hasNext()) {
                sb.append(iter.next());
                if (iter.hasNext()) {
                    sb.append(", ");
                }
            }
            sb.append("\n");
        }
        return sb.toString();
    }
}
