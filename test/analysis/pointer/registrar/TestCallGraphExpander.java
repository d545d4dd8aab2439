package analysis.pointer.registrar;

import static ir.ProgramBuilder.BOX;
import static ir.ProgramBuilder.INT;
import static ir.ProgramBuilder.REF;
import static ir.ProgramBuilder.copy;
import static ir.ProgramBuilder.move;
import static ir.ProgramBuilder.place;
import ir.AccessPath;
import ir.FunctionId;
import ir.OpKind;
import ir.Place;
import ir.ProgramBuilder;
import ir.ProgramBuilder.FunctionBuilder;
import ir.Projection;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.util.Arrays;
import java.util.Collections;

import junit.framework.TestCase;
import signatures.LibrarySignatures;
import util.Logger;
import analysis.AnalysisContext;
import analysis.pointer.graph.CallContext;
import analysis.pointer.graph.ContextualCall;
import analysis.pointer.graph.GlobalBasicBlock;
import analysis.pointer.graph.PointerFlowGraph;
import analysis.pointer.graph.ProjectionNode;

public class TestCallGraphExpander extends TestCase {

    private static final FunctionId MAIN = new FunctionId("demo::main");
    private static final ContextualCall MAIN_CALL = new ContextualCall(MAIN, CallContext.entry());

    private static AnalysisContext expand(ProgramBuilder pb) {
        AnalysisContext ctxt = new AnalysisContext(pb.build(), MAIN, new LibrarySignatures());
        new CallGraphExpander(ctxt).run();
        return ctxt;
    }

    private static ProjectionNode node(AnalysisContext ctxt, ContextualCall call, Place p) {
        return ctxt.getPointerFlowGraph().lookup(call, p.getLocal(), p.getPath());
    }

    public void testQualifies() {
        assertTrue(CallGraphExpander.qualifies(OpKind.MOVE, INT, AccessPath.EMPTY));
        assertTrue(CallGraphExpander.qualifies(OpKind.REF, INT, AccessPath.EMPTY));
        assertTrue(CallGraphExpander.qualifies(OpKind.ADDRESS_OF, INT, AccessPath.EMPTY));
        assertTrue(CallGraphExpander.qualifies(OpKind.COPY, REF, AccessPath.EMPTY));
        assertTrue(CallGraphExpander.qualifies(OpKind.COPY, INT, AccessPath.of(Projection.DEREF)));
        assertFalse(CallGraphExpander.qualifies(OpKind.COPY, INT, AccessPath.of(Projection.field(0))));
        assertFalse(CallGraphExpander.qualifies(OpKind.CONSTANT, REF, AccessPath.EMPTY));
    }

    public void testAssignmentEdges() {
        ProgramBuilder pb = new ProgramBuilder();
        pb.function("demo::main")
          .local(1, "a", INT)
          .local(2, "b", INT)
          .local(3, "p", REF)
          .local(4, "q", REF)
          .block(0)
          .assign(Place.local(2), OpKind.COPY, Place.local(1), 1)
          .assign(Place.local(3), OpKind.REF, Place.local(1), 2)
          .assign(Place.local(4), OpKind.COPY, Place.local(3), 3)
          .assign(Place.local(2), OpKind.CONSTANT, null, 4);
        AnalysisContext ctxt = expand(pb);
        PointerFlowGraph g = ctxt.getPointerFlowGraph();

        // copy of an integer adds no edge
        assertNull(node(ctxt, MAIN_CALL, Place.local(2)));
        assertTrue(g.hasEdge(node(ctxt, MAIN_CALL, Place.local(1)), node(ctxt, MAIN_CALL, Place.local(3))));
        assertTrue(g.hasEdge(node(ctxt, MAIN_CALL, Place.local(3)), node(ctxt, MAIN_CALL, Place.local(4))));
        assertEquals(2, g.numEdges());
        assertTrue(g.getDerefEdges().isEmpty());
        assertEquals(1, ctxt.getReachable().size());
    }

    public void testDropSeedsObject() {
        ProgramBuilder pb = new ProgramBuilder();
        pb.function("demo::main").local(1, "x", BOX).block(0, 1).drop(Place.local(1), 1);
        pb.function("demo::main").block(1).drop(Place.local(1), 2);
        AnalysisContext ctxt = expand(pb);

        ProjectionNode x = node(ctxt, MAIN_CALL, Place.local(1));
        assertEquals(2, x.getDropSites().size());
        // only the first drop seeds the object
        assertEquals(1, ctxt.getWorklist().size());
        assertEquals(x.getId(), ctxt.getWorklist().poll().getNode());
    }

    public void testCallBindsParametersAndReturn() {
        ProgramBuilder pb = new ProgramBuilder();
        pb.function("demo::main")
          .local(1, "x", BOX)
          .local(2, "r", BOX)
          .block(0)
          .call("demo::id", Place.local(2), 1, move(1));
        FunctionBuilder id = pb.function("demo::id");
        id.local(0, null, BOX).local(1, "v", BOX).block(0).assign(Place.local(0), OpKind.MOVE, Place.local(1), 5);
        AnalysisContext ctxt = expand(pb);
        PointerFlowGraph g = ctxt.getPointerFlowGraph();

        ContextualCall idCall = new ContextualCall(id.getId(), CallContext.from(new GlobalBasicBlock(MAIN, 0)));
        assertTrue(ctxt.getReachable().contains(idCall));
        ProjectionNode arg = node(ctxt, MAIN_CALL, Place.local(1));
        ProjectionNode param = node(ctxt, idCall, Place.local(1));
        ProjectionNode ret = node(ctxt, idCall, Place.local(0));
        ProjectionNode dest = node(ctxt, MAIN_CALL, Place.local(2));
        assertTrue(g.hasEdge(arg, param));
        assertTrue(g.hasEdge(param, ret));
        assertTrue(g.hasEdge(ret, dest));
        // argument passing counts as a dereference at both ends
        assertEquals(1, g.getDerefEdges().size());
        assertTrue(ctxt.getCallGraph().getCallees(new GlobalBasicBlock(MAIN, 0)).contains(id.getId()));
    }

    public void testUnitDestinationNotBound() {
        ProgramBuilder pb = new ProgramBuilder();
        pb.function("demo::main").local(1, "x", BOX).block(0).call("demo::consume", Place.local(0), 1, move(1));
        pb.function("demo::consume").local(1, "v", BOX).block(0).drop(Place.local(1), 7);
        AnalysisContext ctxt = expand(pb);
        assertNull(node(ctxt, MAIN_CALL, Place.local(0)));
        assertEquals(1, ctxt.getPointerFlowGraph().numEdges());
    }

    public void testExternalCalls() {
        ProgramBuilder pb = new ProgramBuilder();
        pb.function("demo::main")
          .local(1, "x", BOX)
          .local(2, "y", BOX)
          .local(3, "r", REF)
          .local(4, "n", INT)
          .block(0, 1)
          .call("alloc::vec::Vec::push", Place.local(2), 1, move(1), copy(Place.local(4), INT));
        pb.function("demo::main").block(1, 2).call("core::clone::Clone::clone", Place.local(2), 2, copy(Place.local(3), REF));
        pb.function("demo::main").block(2).call("core::ops::deref::Deref::deref", Place.local(3), 3, copy(Place.local(3), REF));
        AnalysisContext ctxt = expand(pb);
        PointerFlowGraph g = ctxt.getPointerFlowGraph();

        // only the moved box flows to the result of the unknown call
        assertTrue(g.hasEdge(node(ctxt, MAIN_CALL, Place.local(1)), node(ctxt, MAIN_CALL, Place.local(2))));
        assertNull(node(ctxt, MAIN_CALL, Place.local(4)));
        // clone and deref add nothing
        assertEquals(1, g.numEdges());
        assertEquals(1, ctxt.getReachable().size());
    }

    public void testDispatchCandidates() {
        ProgramBuilder pb = new ProgramBuilder();
        pb.function("demo::main")
          .local(1, "x", BOX)
          .local(2, "r", BOX)
          .block(0)
          .dispatch("demo::Shape::area", Arrays.asList("demo::Circle::area", "demo::Square::area"), Place.local(2), 1,
                    move(1));
        pb.function("demo::Circle::area").local(1, "self", BOX).block(0);
        AnalysisContext ctxt = expand(pb);

        // the candidate with a body is bound, the other is skipped
        assertEquals(2, ctxt.getReachable().size());
        assertEquals(1, ctxt.getCallGraph().getCallees(new GlobalBasicBlock(MAIN, 0)).size());
    }

    public void testContextsOfRecursiveCall() {
        ProgramBuilder pb = new ProgramBuilder();
        pb.function("demo::main").local(1, "x", BOX).block(0).call("demo::rec", Place.local(0), 1, move(1));
        pb.function("demo::rec").local(1, "v", BOX).block(0).call("demo::rec", Place.local(0), 2, move(1));
        AnalysisContext ctxt = expand(pb);

        // rec is reached from main's call site and from its own, then the contexts repeat
        assertEquals(3, ctxt.getReachable().size());
    }

    public void testDerefCopyRecordsDerefEdge() {
        ProgramBuilder pb = new ProgramBuilder();
        pb.function("demo::main")
          .local(1, "p", REF)
          .local(2, "y", INT)
          .block(0)
          .assign(Place.local(2), OpKind.COPY, place(1, Projection.DEREF), 1);
        AnalysisContext ctxt = expand(pb);
        PointerFlowGraph g = ctxt.getPointerFlowGraph();
        assertEquals(1, g.getDerefEdges().size());
        assertTrue(g.getDerefEdges().iterator().next().isFromDeref());
        assertFalse(g.getDerefEdges().iterator().next().isToDeref());
    }

    public void testUnexpectedDropIsLogged() throws UnsupportedEncodingException {
        ProgramBuilder pb = new ProgramBuilder();
        pb.function("demo::main").local(1, "x", BOX).local(2, "p", REF).block(0, 1).drop(Place.local(1), 1);
        pb.function("demo::main").block(1).drop(Place.local(2), 2);

        PrintStream err = System.err;
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        System.setErr(new PrintStream(buf, true, "UTF-8"));
        try {
            Logger.init(true, Collections.singleton("body"));
            expand(pb);
        }
        finally {
            Logger.init(false, Collections.<String> emptySet());
            System.setErr(err);
        }
        String log = buf.toString("UTF-8");
        assertTrue(log.contains("drop of _2 at demo::main@bb1 but the local is not marked as needing a drop"));
        assertFalse(log.contains("drop of _1 "));
    }
}
