package analysis.pointer.engine;

import ir.AccessPath;

import java.util.ArrayList;
import java.util.List;

import util.Logger;
import analysis.AnalysisContext;
import analysis.pointer.graph.ContextualCall;
import analysis.pointer.graph.FlowEdge;
import analysis.pointer.graph.PointerFlowGraph;
import analysis.pointer.graph.ProjectionNode;

import com.ibm.wala.util.intset.IntIterator;
import com.ibm.wala.util.intset.IntSet;
import com.ibm.wala.util.intset.MutableIntSet;
import com.ibm.wala.util.intset.MutableSparseIntSet;

/**
 * Single-threaded worklist solver. Each new fact about a node is pushed along its flow edges, down to the deeper
 * access paths of the same local, and across to the matching access paths of the locals its prefixes flow to.
 */
public class PointsToAnalysisSingleThreaded extends PointsToAnalysis {

    /**
     * Number of items taken off the worklist in the last run
     */
    private long processed;
    /**
     * Number of items that changed a points-to set in the last run
     */
    private long changed;
    /**
     * Number of nodes created by diffusion in the last run
     */
    private int materialized;

    @Override
    public PointerFlowGraph solve(AnalysisContext ctxt) {
        long start = System.currentTimeMillis();
        PointerFlowGraph g = ctxt.getPointerFlowGraph();
        Worklist worklist = ctxt.getWorklist();
        processed = 0;
        changed = 0;
        materialized = 0;

        PointsToDelta item;
        while ((item = worklist.poll()) != null) {
            processed++;
            ProjectionNode n = g.getNode(item.getNode());
            IntSet delta = difference(item.getPointsTo(), n.getPointsTo());
            if (delta.isEmpty()) {
                continue;
            }
            changed++;
            g.addToPointsTo(n, delta);
            if (listener != null) {
                listener.pointsToChanged(n, delta);
            }

            // along the edges
            for (FlowEdge e : n.getEdges()) {
                worklist.add(e.getTarget(), delta);
            }

            List<ProjectionNode> siblings = new ArrayList<>(g.getNodesForLocal(n.getCall(), n.getLocal()));
            for (ProjectionNode s : siblings) {
                if (s == n) {
                    continue;
                }
                if (n.getPath().isStrictPrefixOf(s.getPath())) {
                    // down to deeper paths of the same local
                    worklist.add(s.getId(), delta);
                }
                else if (s.getPath().isStrictPrefixOf(n.getPath())) {
                    // across to the same suffix of whatever the prefix flows to
                    AccessPath suffix = n.getPath().suffixAfter(s.getPath());
                    for (FlowEdge e : s.getEdges()) {
                        ProjectionNode neighbor = g.getNode(e.getTarget());
                        AccessPath p = neighbor.getPath().append(suffix);
                        if (p.length() > PointerFlowGraph.MAX_PATH_LENGTH) {
                            continue;
                        }
                        ProjectionNode target = materialize(g, worklist, neighbor.getCall(), neighbor.getLocal(), p);
                        worklist.add(target.getId(), delta);
                    }
                }
            }
        }

        if (Logger.isEnabled("worklist")) {
            Logger.debug("worklist", "processed " + processed + " items, " + changed + " changed a node, "
                                            + materialized + " nodes created by diffusion");
        }
        Logger.println("Points-to fixed point for " + ctxt.getEntry() + " reached in "
                                        + (System.currentTimeMillis() - start) + "ms");
        return g;
    }

    /**
     * Find or create a node reached by diffusion. A new node starts with what its existing prefixes point to, as it
     * would have if it had existed when they were updated.
     */
    private ProjectionNode materialize(PointerFlowGraph g, Worklist worklist, ContextualCall call, int local,
                                       AccessPath path) {
        ProjectionNode existing = g.lookup(call, local, path);
        if (existing != null) {
            return existing;
        }
        ProjectionNode created = g.getOrCreate(call, local, path);
        materialized++;
        for (ProjectionNode prefix : g.getNodesForLocal(call, local)) {
            if (prefix.getPath().isStrictPrefixOf(path)) {
                worklist.addCopy(created.getId(), prefix.getPointsTo());
            }
        }
        return created;
    }

    /**
     * Elements of <code>incoming</code> not in <code>current</code>
     */
    private static IntSet difference(IntSet incoming, IntSet current) {
        MutableIntSet delta = MutableSparseIntSet.makeEmpty();
        IntIterator iter = incoming.intIterator();
        while (iter.hasNext()) {
            int o = iter.next();
            if (!current.contains(o)) {
                delta.add(o);
            }
        }
        return delta;
    }

    public long getNumProcessed() {
        return processed;
    }

    public long getNumChanged() {
        return changed;
    }

    public int getNumMaterialized() {
        return materialized;
    }
}
