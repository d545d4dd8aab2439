package analysis.pointer.registrar;

import ir.AccessPath;
import ir.Assignment;
import ir.BasicBlock;
import ir.CallEffect;
import ir.DropEffect;
import ir.FunctionBody;
import ir.FunctionId;
import ir.OpKind;
import ir.Operand;
import ir.Place;
import ir.Program;
import ir.TypeDescriptor;

import java.util.ArrayList;
import java.util.List;

import signatures.LibrarySignatures;
import util.Logger;
import util.WorkQueue;
import analysis.AnalysisContext;
import analysis.pointer.graph.CallContext;
import analysis.pointer.graph.ContextualCall;
import analysis.pointer.graph.ContextualSite;
import analysis.pointer.graph.GlobalBasicBlock;
import analysis.pointer.graph.PointerFlowGraph;
import analysis.pointer.graph.ProjectionNode;

import com.ibm.wala.util.intset.SparseIntSet;

/**
 * Breadth-first discovery of the contextual calls reachable from an entry point. Each contextual call is expanded
 * once: its drops seed abstract objects, and its assignments and calls add edges to the pointer flow graph.
 */
public class CallGraphExpander {

    private final AnalysisContext ctxt;
    private final Program program;
    private final PointerFlowGraph pfg;
    private final LibrarySignatures signatures;

    /**
     * Create an expander that populates the graph of the given analysis context
     *
     * @param ctxt analysis state for one entry point
     */
    public CallGraphExpander(AnalysisContext ctxt) {
        this.ctxt = ctxt;
        this.program = ctxt.getProgram();
        this.pfg = ctxt.getPointerFlowGraph();
        this.signatures = ctxt.getSignatures();
    }

    /**
     * Expand every contextual call reachable from the entry point of the analysis context
     */
    public void run() {
        long start = System.currentTimeMillis();
        WorkQueue<ContextualCall> q = new WorkQueue<>();
        q.add(new ContextualCall(ctxt.getEntry(), CallContext.entry()));

        ContextualCall call;
        while ((call = q.poll()) != null) {
            if (!ctxt.addReachable(call)) {
                continue;
            }
            Logger.debug("reachable", "reachable call: " + call);
            expand(call, q);
        }

        Logger.println("Expanded " + ctxt.getReachable().size() + " contextual calls from " + ctxt.getEntry()
                                        + " into " + pfg.numNodes() + " nodes and " + pfg.numEdges() + " edges in "
                                        + (System.currentTimeMillis() - start) + "ms");
    }

    /**
     * Add the drops, assignments and calls of one contextual call to the graph
     *
     * @param call contextual call to expand
     * @param q queue that newly discovered callees are added to
     */
    private void expand(ContextualCall call, WorkQueue<ContextualCall> q) {
        FunctionBody body = program.requireBody(call.getFunction());
        ctxt.getCallGraph().addFunction(call.getFunction());

        for (BasicBlock bb : body.getBlocks()) {
            GlobalBasicBlock gbb = new GlobalBasicBlock(call.getFunction(), bb.getId());
            for (Assignment a : bb.getAssignments()) {
                registerAssignment(call, body, gbb, a);
            }
            if (bb.getDrop() != null) {
                registerDrop(call, body, gbb, bb.getDrop());
            }
            if (bb.getCall() != null) {
                registerCall(call, body, gbb, bb.getCall(), q);
            }
        }
    }

    /**
     * Record a drop site. The first drop of a cell creates the abstract object identified by the cell.
     */
    private void registerDrop(ContextualCall call, FunctionBody body, GlobalBasicBlock gbb, DropEffect drop) {
        Place p = drop.getPlace();
        if (!body.isDropExpected(p)) {
            Logger.debug("body", "drop of " + p + " at " + gbb + " but the local is not marked as needing a drop");
        }
        ProjectionNode n = pfg.getOrCreate(call, p.getLocal(), p.getPath());
        ContextualSite site = new ContextualSite(gbb, drop.getLocation(), call.getContext());
        if (n.addDropSite(site)) {
            ctxt.getWorklist().add(n.getId(), SparseIntSet.singleton(n.getId()));
        }
        Logger.debug("body", "drop " + p + " at " + gbb + " is object " + n.getId());
    }

    private void registerAssignment(ContextualCall call, FunctionBody body, GlobalBasicBlock gbb, Assignment a) {
        switch (a.getOp()) {
        case CONSTANT:
            Logger.debug("assign", "ignored constant assign " + a + " at " + gbb);
            return;
        case COPY:
            TypeDescriptor type = body.typeOf(a.getRight(), a.getRightType());
            if (!qualifies(OpKind.COPY, type, a.getRight().getPath())) {
                Logger.debug("assign", "ignored copy of non-pointer " + a + " at " + gbb);
                return;
            }
            break;
        case MOVE:
        case REF:
        case ADDRESS_OF:
            break;
        default:
            throw new RuntimeException("Unhandled op kind " + a.getOp());
        }

        Place right = a.getRight();
        Place left = a.getLeft();
        ProjectionNode from = pfg.getOrCreate(call, right.getLocal(), right.getPath());
        ProjectionNode to = pfg.getOrCreate(call, left.getLocal(), left.getPath());
        pfg.addEdge(from, to, new ContextualSite(gbb, a.getLocation(), call.getContext()));
        Logger.debug("assign", a + " at " + gbb);
    }

    private void registerCall(ContextualCall call, FunctionBody body, GlobalBasicBlock gbb, CallEffect ce,
                              WorkQueue<ContextualCall> q) {
        ContextualSite site = new ContextualSite(gbb, ce.getLocation(), call.getContext());
        FunctionId callee = ce.getCallee();
        if (program.hasBody(callee)) {
            bindCallee(call, body, gbb, site, ce, callee, q);
            return;
        }

        switch (signatures.getPolicy(callee)) {
        case IGNORE:
            Logger.debug("call", "ignored call to " + callee + " at " + gbb);
            return;
        case PASS_THROUGH:
            Logger.debug("call", "pass-through call to " + callee + " at " + gbb);
            return;
        case ARGS_TO_RETURN:
            List<FunctionId> targets = new ArrayList<>();
            for (FunctionId candidate : ce.getCandidates()) {
                if (program.hasBody(candidate)) {
                    targets.add(candidate);
                }
            }
            if (!targets.isEmpty()) {
                for (FunctionId target : targets) {
                    Logger.debug("call", "dispatching " + callee + " to " + target + " at " + gbb);
                    bindCallee(call, body, gbb, site, ce, target, q);
                }
                return;
            }
            addArgsToReturnEdges(call, body, gbb, site, ce);
            return;
        default:
            throw new RuntimeException("Unhandled policy for " + callee);
        }
    }

    /**
     * Enqueue the callee in the context of this call site, and bind arguments to parameters and the return value to
     * the destination
     */
    private void bindCallee(ContextualCall call, FunctionBody body, GlobalBasicBlock gbb, ContextualSite site,
                            CallEffect ce, FunctionId callee, WorkQueue<ContextualCall> q) {
        ContextualCall calleeCall = new ContextualCall(callee, CallContext.from(gbb));
        q.add(calleeCall);
        ctxt.getCallGraph().addCall(gbb, callee);
        Logger.debug("call", "call to " + calleeCall + " at " + gbb);

        List<Operand> args = ce.getArgs();
        for (int i = 0; i < args.size(); i++) {
            Operand arg = args.get(i);
            if (!qualifies(arg, body)) {
                Logger.debug("call", "ignored arg " + i + " of call to " + callee + " at " + gbb + ": " + arg);
                continue;
            }
            Place p = arg.getPlace();
            ProjectionNode from = pfg.getOrCreate(call, p.getLocal(), p.getPath());
            ProjectionNode param = pfg.getOrCreate(calleeCall, i + 1, AccessPath.EMPTY);
            // passing an argument counts as a dereference of both ends
            pfg.addEdge(from, param, site, true, true);
        }

        Place dest = ce.getDestination();
        if (dest != null && !body.getLocalType(dest.getLocal()).isUnit()) {
            ProjectionNode ret = pfg.getOrCreate(calleeCall, 0, AccessPath.EMPTY);
            ProjectionNode to = pfg.getOrCreate(call, dest.getLocal(), dest.getPath());
            pfg.addEdge(ret, to, site);
        }
    }

    /**
     * Model a call with no IR: the result may be any qualifying argument
     */
    private void addArgsToReturnEdges(ContextualCall call, FunctionBody body, GlobalBasicBlock gbb,
                                      ContextualSite site, CallEffect ce) {
        Place dest = ce.getDestination();
        if (dest == null || body.getLocalType(dest.getLocal()).isUnit()) {
            return;
        }
        ProjectionNode to = pfg.getOrCreate(call, dest.getLocal(), dest.getPath());
        for (Operand arg : ce.getArgs()) {
            if (!qualifies(arg, body)) {
                continue;
            }
            Place p = arg.getPlace();
            pfg.addEdge(pfg.getOrCreate(call, p.getLocal(), p.getPath()), to, site);
        }
        Logger.debug("call", "external call to " + ce.getCallee() + " at " + gbb + " connects args to " + dest);
    }

    private static boolean qualifies(Operand arg, FunctionBody body) {
        if (arg.getKind() == OpKind.CONSTANT) {
            return false;
        }
        Place p = arg.getPlace();
        return qualifies(arg.getKind(), body.typeOf(p, arg.getType()), p.getPath());
    }

    /**
     * Does a value of the given kind carry points-to facts. Moves and borrows always do, copies only when the copied
     * value is a pointer or is read through a dereference.
     *
     * @param op kind of the value
     * @param type static type of the read place
     * @param path access path of the read place
     * @return true if an edge should be added for the value
     */
    public static boolean qualifies(OpKind op, TypeDescriptor type, AccessPath path) {
        switch (op) {
        case MOVE:
        case REF:
        case ADDRESS_OF:
            return true;
        case COPY:
            return type.isPointer() || path.containsDeref();
        case CONSTANT:
            return false;
        default:
            throw new RuntimeException("Unhandled op kind " + op);
        }
    }
}
