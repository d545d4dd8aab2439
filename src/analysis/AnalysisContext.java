package analysis;

import ir.FunctionId;
import ir.Program;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import signatures.LibrarySignatures;
import analysis.pointer.engine.Worklist;
import analysis.pointer.graph.ContextualCall;
import analysis.pointer.graph.PointerFlowGraph;
import analysis.pointer.graph.ResolvedCallGraph;

/**
 * State of the analysis of one entry point, passed through expansion, propagation and checking. Each entry point gets
 * a fresh context, only the {@link Program} is shared.
 */
public final class AnalysisContext {

    private final Program program;
    private final FunctionId entry;
    private final LibrarySignatures signatures;
    private final Worklist worklist = new Worklist();
    private final PointerFlowGraph pfg = new PointerFlowGraph(worklist);
    private final ResolvedCallGraph callGraph = new ResolvedCallGraph();
    /**
     * Contextual calls that have been expanded
     */
    private final Set<ContextualCall> reachable = new LinkedHashSet<>();

    /**
     * Create the state for analyzing one entry point
     *
     * @param program function table
     * @param entry entry function
     * @param signatures models of calls to functions without local IR
     */
    public AnalysisContext(Program program, FunctionId entry, LibrarySignatures signatures) {
        this.program = program;
        this.entry = entry;
        this.signatures = signatures;
    }

    public Program getProgram() {
        return program;
    }

    public FunctionId getEntry() {
        return entry;
    }

    public LibrarySignatures getSignatures() {
        return signatures;
    }

    public Worklist getWorklist() {
        return worklist;
    }

    public PointerFlowGraph getPointerFlowGraph() {
        return pfg;
    }

    public ResolvedCallGraph getCallGraph() {
        return callGraph;
    }

    /**
     * Mark a contextual call as expanded
     *
     * @param call contextual call
     * @return true if it had not been expanded before
     */
    public boolean addReachable(ContextualCall call) {
        return reachable.add(call);
    }

    public Set<ContextualCall> getReachable() {
        return Collections.unmodifiableSet(reachable);
    }
}
