package analysis;

import ir.BasicBlock;
import ir.CallEffect;
import ir.FunctionBody;
import ir.FunctionId;
import ir.Program;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import util.Logger;
import analysis.pointer.graph.GlobalBasicBlock;
import analysis.pointer.graph.ResolvedCallGraph;

/**
 * Chooses the functions analysis starts from
 */
public final class EntryPoints {

    private EntryPoints() {
        // static methods only
    }

    /**
     * Choose entry points. Explicit entries are dotted path suffixes matched against every function with local IR.
     * Without explicit entries, the functions nobody locally calls are used, or the functions named
     * <code>main</code> if every function is called from somewhere.
     *
     * @param program function table
     * @param entries explicit entry suffixes, empty to detect entries automatically
     * @return entry functions in name order
     */
    public static Set<FunctionId> select(Program program, Collection<String> entries) {
        Set<FunctionId> selected = new TreeSet<>();
        if (!entries.isEmpty()) {
            for (FunctionId f : program.getFunctionIds()) {
                for (String e : entries) {
                    if (f.matchesSuffix(e)) {
                        selected.add(f);
                    }
                }
            }
            if (selected.isEmpty()) {
                Logger.warn("No function matches the entries " + entries);
            }
        }
        else {
            selected.addAll(buildLocalCallGraph(program).getRoots());
            if (selected.isEmpty()) {
                for (FunctionId f : program.getFunctionIds()) {
                    if (f.getSimpleName().equals("main")) {
                        selected.add(f);
                    }
                }
            }
        }
        Logger.debug("entries", "entries: " + selected);
        return selected;
    }

    /**
     * Call graph over all functions with local IR, including calls through dispatch candidates
     *
     * @param program function table
     * @return context-insensitive call graph
     */
    public static ResolvedCallGraph buildLocalCallGraph(Program program) {
        ResolvedCallGraph cg = new ResolvedCallGraph();
        for (FunctionId f : program.getFunctionIds()) {
            cg.addFunction(f);
            FunctionBody body = program.requireBody(f);
            for (BasicBlock bb : body.getBlocks()) {
                CallEffect call = bb.getCall();
                if (call == null) {
                    continue;
                }
                List<FunctionId> callees = new ArrayList<>();
                callees.add(call.getCallee());
                callees.addAll(call.getCandidates());
                for (FunctionId callee : callees) {
                    if (program.hasBody(callee)) {
                        cg.addCall(new GlobalBasicBlock(f, bb.getId()), callee);
                    }
                }
            }
        }
        return cg;
    }
}
