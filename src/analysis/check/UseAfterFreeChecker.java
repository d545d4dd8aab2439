package analysis.check;

import java.util.ArrayList;
import java.util.List;

import analysis.pointer.graph.ContextualSite;
import analysis.pointer.graph.DerefEdge;
import analysis.pointer.graph.FlowEdge;
import analysis.pointer.graph.PointerFlowGraph;
import analysis.pointer.graph.ProjectionNode;
import analysis.reachability.BasicBlockReachability;

import com.ibm.wala.util.intset.IntIterator;

/**
 * Reports dereferences of objects that may already have been dropped. For each dereferencing end of a flow edge,
 * every object the end points to is checked for a drop site that can reach the edge's block.
 */
public class UseAfterFreeChecker {

    private final PointerFlowGraph g;
    private final BasicBlockReachability reachability;

    /**
     * Create a checker over a converged graph
     *
     * @param g pointer flow graph at its fixed point
     * @param reachability block reachability over the expanded call graph
     */
    public UseAfterFreeChecker(PointerFlowGraph g, BasicBlockReachability reachability) {
        this.g = g;
        this.reachability = reachability;
    }

    /**
     * Run the check
     *
     * @return raw findings in deref edge order
     */
    public List<UafInfo> check() {
        List<UafInfo> infos = new ArrayList<>();
        for (DerefEdge d : g.getDerefEdges()) {
            FlowEdge e = g.getNode(d.getFrom()).getEdge(d.getTo());
            if (e == null) {
                throw new IllegalStateException("Deref edge " + d + " has no flow edge");
            }
            if (d.isFromDeref()) {
                checkNode(d.getFrom(), e.getSite(), infos);
            }
            if (d.isToDeref()) {
                checkNode(d.getTo(), e.getSite(), infos);
            }
        }
        return infos;
    }

    private void checkNode(int derefNode, ContextualSite derefSite, List<UafInfo> infos) {
        IntIterator iter = g.getNode(derefNode).getPointsTo().intIterator();
        while (iter.hasNext()) {
            int obj = iter.next();
            ProjectionNode owner = g.getNode(obj);
            for (ContextualSite dropSite : owner.getDropSites()) {
                if (dropSite.getBlock().equals(derefSite.getBlock())) {
                    continue;
                }
                if (reachability.canReach(dropSite.getBlock(), derefSite.getBlock())) {
                    infos.add(new UafInfo(derefNode, derefSite, obj, dropSite));
                }
            }
        }
    }
}
