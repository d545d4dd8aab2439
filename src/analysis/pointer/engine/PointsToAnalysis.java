package analysis.pointer.engine;

import analysis.AnalysisContext;
import analysis.pointer.graph.PointerFlowGraph;
import analysis.pointer.graph.ProjectionNode;

import com.ibm.wala.util.intset.IntSet;

/**
 * Points-to analysis engine
 */
public abstract class PointsToAnalysis {

    /**
     * Notified whenever a points-to set grows
     */
    public interface PointsToListener {
        /**
         * Called after <code>delta</code> has been added to the points-to set of <code>n</code>
         *
         * @param n node whose set grew
         * @param delta objects that were new to the set
         */
        void pointsToChanged(ProjectionNode n, IntSet delta);
    }

    /**
     * Listener for changes, may be null
     */
    protected PointsToListener listener;

    /**
     * Register a listener for changes to points-to sets
     *
     * @param listener listener to notify
     */
    public void setListener(PointsToListener listener) {
        this.listener = listener;
    }

    /**
     * Drain the worklist of the analysis context until a fixed point is reached
     *
     * @param ctxt analysis state whose graph has been populated by call graph expansion
     * @return the converged pointer flow graph
     */
    public abstract PointerFlowGraph solve(AnalysisContext ctxt);
}
