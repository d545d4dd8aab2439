package analysis.reachability;

import ir.BasicBlock;
import ir.FunctionBody;
import ir.FunctionId;
import ir.Program;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import analysis.pointer.graph.GlobalBasicBlock;
import analysis.pointer.graph.ResolvedCallGraph;

import com.ibm.wala.util.intset.IntIterator;
import com.ibm.wala.util.intset.IntSet;
import com.ibm.wala.util.intset.MutableIntSet;
import com.ibm.wala.util.intset.MutableSparseIntSet;

/**
 * Answers whether control can get from one basic block to another. Within a function this follows successor edges.
 * Across functions it follows the resolved call graph: from a block, through a call site it can reach, into the
 * callee's entry block, and so on. Returns to callers are not followed.
 */
public class BasicBlockReachability {

    private final Program program;
    private final ResolvedCallGraph callGraph;
    /**
     * Memoized intraprocedural closure: blocks of the same function reachable from a block (including itself)
     */
    private final Map<GlobalBasicBlock, IntSet> reachableWithin = new HashMap<>();

    /**
     * Create a reachability oracle
     *
     * @param program function table
     * @param callGraph fully expanded call graph
     */
    public BasicBlockReachability(Program program, ResolvedCallGraph callGraph) {
        this.program = program;
        this.callGraph = callGraph;
    }

    /**
     * Can execution starting at <code>from</code> get to <code>to</code>. Every block reaches itself.
     *
     * @param from source block
     * @param to destination block
     * @return true if a path exists
     */
    public boolean canReach(GlobalBasicBlock from, GlobalBasicBlock to) {
        return canReach(from, to, new HashSet<GlobalBasicBlock>());
    }

    private boolean canReach(GlobalBasicBlock from, GlobalBasicBlock to, Set<GlobalBasicBlock> visited) {
        if (from.getFunction().equals(to.getFunction())) {
            return getReachableWithin(from).contains(to.getBlock());
        }
        if (!callGraph.canReach(from.getFunction(), to.getFunction())) {
            return false;
        }

        IntSet within = getReachableWithin(from);
        for (GlobalBasicBlock site : callGraph.getCallSites(from.getFunction())) {
            if (!within.contains(site.getBlock())) {
                continue;
            }
            for (FunctionId callee : callGraph.getCallees(site)) {
                GlobalBasicBlock entry = new GlobalBasicBlock(callee, program.requireBody(callee).getEntryBlock());
                if (!visited.add(entry)) {
                    continue;
                }
                if (canReach(entry, to, visited)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Blocks of the same function reachable from the given block
     *
     * @param from starting block
     * @return indices of the reachable blocks, including <code>from</code>
     */
    public IntSet getReachableWithin(GlobalBasicBlock from) {
        IntSet result = reachableWithin.get(from);
        if (result == null) {
            result = computeReachableWithin(program.requireBody(from.getFunction()), from.getBlock());
            reachableWithin.put(from, result);
        }
        return result;
    }

    private static IntSet computeReachableWithin(FunctionBody body, int start) {
        MutableIntSet visited = MutableSparseIntSet.makeEmpty();
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(start);
        visited.add(start);
        while (!stack.isEmpty()) {
            BasicBlock bb = body.getBlock(stack.pop());
            IntIterator iter = bb.getSuccessors().intIterator();
            while (iter.hasNext()) {
                int succ = iter.next();
                if (visited.add(succ)) {
                    stack.push(succ);
                }
            }
        }
        return visited;
    }
}
