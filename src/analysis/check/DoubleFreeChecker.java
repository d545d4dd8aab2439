package analysis.check;

import java.util.ArrayList;
import java.util.List;

import analysis.pointer.graph.ContextualSite;
import analysis.pointer.graph.PointerFlowGraph;
import analysis.pointer.graph.ProjectionNode;
import analysis.reachability.BasicBlockReachability;

import com.ibm.wala.util.intset.IntIterator;
import com.ibm.wala.util.intset.IntSet;

/**
 * Reports pairs of drops of aliasing objects where one drop can reach the other. Only objects whose dropping node
 * points to more than one object are candidates.
 */
public class DoubleFreeChecker {

    private final PointerFlowGraph g;
    private final BasicBlockReachability reachability;

    /**
     * Create a checker over a converged graph
     *
     * @param g pointer flow graph at its fixed point
     * @param reachability block reachability over the expanded call graph
     */
    public DoubleFreeChecker(PointerFlowGraph g, BasicBlockReachability reachability) {
        this.g = g;
        this.reachability = reachability;
    }

    /**
     * Run the check
     *
     * @return raw findings
     */
    public List<DfInfo> check() {
        List<DfInfo> infos = new ArrayList<>();
        IntIterator candidates = g.getMultiDropObjects().intIterator();
        while (candidates.hasNext()) {
            int first = candidates.next();
            ProjectionNode firstNode = g.getNode(first);
            IntSet pointsTo = firstNode.getPointsTo();
            if (pointsTo.size() <= 1) {
                continue;
            }

            IntIterator others = pointsTo.intIterator();
            while (others.hasNext()) {
                int then = others.next();
                if (then == first) {
                    continue;
                }
                ProjectionNode thenNode = g.getNode(then);
                for (ContextualSite s1 : firstNode.getDropSites()) {
                    for (ContextualSite s2 : thenNode.getDropSites()) {
                        if (reachability.canReach(s1.getBlock(), s2.getBlock())) {
                            infos.add(new DfInfo(first, s1, then, s2));
                        }
                        if (reachability.canReach(s2.getBlock(), s1.getBlock())) {
                            infos.add(new DfInfo(then, s2, first, s1));
                        }
                    }
                }
            }
        }
        return infos;
    }
}
