package analysis;

import ir.FunctionBody;
import ir.FunctionId;
import ir.Program;

import java.io.File;
import java.util.Collection;

import results.DfResult;
import results.MemoryCheckResult;
import results.ResultMerger;
import results.UafResult;
import signatures.LibrarySignatures;
import util.Logger;
import analysis.check.CheckInfo;
import analysis.check.DfInfo;
import analysis.check.MemoryBugChecker;
import analysis.check.UafInfo;
import analysis.pointer.engine.PointsToAnalysis;
import analysis.pointer.engine.PointsToAnalysisSingleThreaded;
import analysis.pointer.graph.PointerFlowGraph;
import analysis.pointer.graph.ProjectionNode;
import analysis.pointer.registrar.CallGraphExpander;

/**
 * Runs the whole pipeline: for each entry point, expand the call graph, solve the pointer flow graph and check it,
 * then merge the findings of all entry points.
 */
public class MemoryCheck {

    private final Program program;
    private final LibrarySignatures signatures;
    /**
     * Directory to write the converged graph of each entry to, null to not write it
     */
    private String dotDirectory;

    /**
     * Create a checker for a program
     *
     * @param program function table
     * @param signatures models of calls to functions without local IR
     */
    public MemoryCheck(Program program, LibrarySignatures signatures) {
        this.program = program;
        this.signatures = signatures;
    }

    /**
     * Write a graphviz file of the converged graph of every entry point
     *
     * @param dotDirectory directory to put the files in, null to disable
     */
    public void setDotDirectory(String dotDirectory) {
        this.dotDirectory = dotDirectory;
    }

    /**
     * Analyze and check the given entry points
     *
     * @param entries entry functions
     * @return merged findings
     */
    public MemoryCheckResult run(Collection<FunctionId> entries) {
        ResultMerger<UafResult> uaf = new ResultMerger<>();
        ResultMerger<DfResult> df = new ResultMerger<>();
        for (FunctionId entry : entries) {
            AnalysisContext ctxt = analyzeEntry(entry, new PointsToAnalysisSingleThreaded());
            CheckInfo info = MemoryBugChecker.check(ctxt);
            Logger.println(entry + ": " + info.getUafInfos().size() + " raw use-after-free and "
                                            + info.getDfInfos().size() + " raw double-free findings");
            addResults(ctxt, info, uaf, df);
        }
        return new MemoryCheckResult(uaf, df);
    }

    /**
     * Build and solve the pointer flow graph for one entry point
     *
     * @param entry entry function, must have local IR
     * @param engine solver to use
     * @return converged analysis state
     */
    public AnalysisContext analyzeEntry(FunctionId entry, PointsToAnalysis engine) {
        AnalysisContext ctxt = new AnalysisContext(program, entry, signatures);
        new CallGraphExpander(ctxt).run();
        PointerFlowGraph g = engine.solve(ctxt);

        if (Logger.isEnabled("pfg")) {
            Logger.debug("pfg", "pointer flow graph for " + entry + ":\n" + g.dump(program));
        }
        if (dotDirectory != null) {
            String name = entry.getDottedName().replaceAll("[^A-Za-z0-9_.-]", "_") + "_pfg";
            g.dumpPointerFlowGraphToFile(new File(dotDirectory, name).getPath(), program);
        }
        return ctxt;
    }

    /**
     * Convert raw findings to located, named results and merge them
     *
     * @param ctxt analysis state the findings were computed from
     * @param info raw findings
     * @param uaf merger for use-after-free results
     * @param df merger for double-free results
     */
    public static void addResults(AnalysisContext ctxt, CheckInfo info, ResultMerger<UafResult> uaf,
                                  ResultMerger<DfResult> df) {
        for (UafInfo i : info.getUafInfos()) {
            uaf.add(new UafResult(i.getDerefSite().getLocation(), varName(ctxt, i.getDerefNode()),
                                  i.getDropSite().getLocation(), varName(ctxt, i.getDropObject())));
        }
        for (DfInfo i : info.getDfInfos()) {
            df.add(new DfResult(i.getFirstDropSite().getLocation(), varName(ctxt, i.getFirstDropObject()),
                                i.getThenDropSite().getLocation(), varName(ctxt, i.getThenDropObject())));
        }
    }

    /**
     * Source name of the local a node is for
     */
    private static String varName(AnalysisContext ctxt, int node) {
        ProjectionNode n = ctxt.getPointerFlowGraph().getNode(node);
        FunctionBody body = ctxt.getProgram().requireBody(n.getCall().getFunction());
        return body.getLocalName(n.getLocal());
    }
}
