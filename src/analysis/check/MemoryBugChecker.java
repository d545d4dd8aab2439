package analysis.check;

import java.util.List;

import util.Logger;
import analysis.AnalysisContext;
import analysis.reachability.BasicBlockReachability;

/**
 * Runs the use-after-free and double-free checks on a converged analysis context
 */
public final class MemoryBugChecker {

    private MemoryBugChecker() {
        // static methods only
    }

    /**
     * Run both checks
     *
     * @param ctxt analysis state after the points-to fixed point
     * @return raw findings
     */
    public static CheckInfo check(AnalysisContext ctxt) {
        BasicBlockReachability reachability = new BasicBlockReachability(ctxt.getProgram(), ctxt.getCallGraph());
        List<UafInfo> uaf = new UseAfterFreeChecker(ctxt.getPointerFlowGraph(), reachability).check();
        List<DfInfo> df = new DoubleFreeChecker(ctxt.getPointerFlowGraph(), reachability).check();
        if (Logger.isEnabled("check")) {
            for (UafInfo i : uaf) {
                Logger.debug("check", i.toString());
            }
            for (DfInfo i : df) {
                Logger.debug("check", i.toString());
            }
        }
        return new CheckInfo(uaf, df);
    }
}
