package analysis.reachability;

import static ir.ProgramBuilder.BOX;
import static ir.ProgramBuilder.move;
import ir.FunctionId;
import ir.Place;
import ir.Program;
import ir.ProgramBuilder;
import junit.framework.TestCase;
import analysis.EntryPoints;
import analysis.pointer.graph.GlobalBasicBlock;

public class TestBasicBlockReachability extends TestCase {

    private static final FunctionId MAIN = new FunctionId("demo::main");
    private static final FunctionId F = new FunctionId("demo::f");
    private static final FunctionId G = new FunctionId("demo::g");

    private static BasicBlockReachability reachability(ProgramBuilder pb) {
        Program p = pb.build();
        return new BasicBlockReachability(p, EntryPoints.buildLocalCallGraph(p));
    }

    private static GlobalBasicBlock bb(FunctionId f, int block) {
        return new GlobalBasicBlock(f, block);
    }

    public void testWithinFunction() {
        ProgramBuilder pb = new ProgramBuilder();
        pb.function("demo::main").block(0, 1, 3);
        pb.function("demo::main").block(1, 2);
        pb.function("demo::main").block(2);
        pb.function("demo::main").block(3);
        BasicBlockReachability r = reachability(pb);

        assertTrue(r.canReach(bb(MAIN, 0), bb(MAIN, 2)));
        assertTrue(r.canReach(bb(MAIN, 1), bb(MAIN, 1)));
        assertFalse(r.canReach(bb(MAIN, 2), bb(MAIN, 0)));
        assertFalse(r.canReach(bb(MAIN, 1), bb(MAIN, 3)));
        assertEquals(4, r.getReachableWithin(bb(MAIN, 0)).size());
        assertEquals(1, r.getReachableWithin(bb(MAIN, 3)).size());
    }

    public void testLoop() {
        ProgramBuilder pb = new ProgramBuilder();
        pb.function("demo::main").block(0, 1);
        pb.function("demo::main").block(1, 0, 2);
        pb.function("demo::main").block(2);
        BasicBlockReachability r = reachability(pb);

        assertTrue(r.canReach(bb(MAIN, 1), bb(MAIN, 0)));
        assertFalse(r.canReach(bb(MAIN, 2), bb(MAIN, 1)));
    }

    /**
     * main bb0 calls f, f bb0 calls g, g has two blocks
     */
    private static ProgramBuilder callChain() {
        ProgramBuilder pb = new ProgramBuilder();
        pb.function("demo::main").local(1, "x", BOX).block(0, 1).call("demo::f", Place.local(0), 1, move(1));
        pb.function("demo::main").block(1);
        pb.function("demo::f").local(1, "v", BOX).block(0, 1).call("demo::g", Place.local(0), 2, move(1));
        pb.function("demo::f").block(1);
        pb.function("demo::g").local(1, "w", BOX).block(0, 1);
        pb.function("demo::g").block(1).drop(Place.local(1), 3);
        return pb;
    }

    public void testIntoCallees() {
        BasicBlockReachability r = reachability(callChain());
        assertTrue(r.canReach(bb(MAIN, 0), bb(F, 1)));
        assertTrue(r.canReach(bb(MAIN, 0), bb(G, 1)));
        assertTrue(r.canReach(bb(F, 0), bb(G, 0)));
    }

    public void testNotAfterTheCall() {
        BasicBlockReachability r = reachability(callChain());
        // the call is in bb0, so nothing after it reaches the callee
        assertFalse(r.canReach(bb(MAIN, 1), bb(F, 0)));
        assertFalse(r.canReach(bb(F, 1), bb(G, 1)));
    }

    public void testReturnsAreNotFollowed() {
        BasicBlockReachability r = reachability(callChain());
        assertFalse(r.canReach(bb(G, 1), bb(F, 1)));
        assertFalse(r.canReach(bb(F, 0), bb(MAIN, 1)));
        // same function: only the local answer counts
        assertFalse(r.canReach(bb(MAIN, 1), bb(MAIN, 0)));
    }

    public void testRecursion() {
        ProgramBuilder pb = new ProgramBuilder();
        pb.function("demo::main").local(1, "x", BOX).block(0).call("demo::f", Place.local(0), 1, move(1));
        pb.function("demo::f").local(1, "v", BOX).block(0, 1).call("demo::f", Place.local(0), 2, move(1));
        pb.function("demo::f").block(1);
        pb.function("demo::g").block(0);
        BasicBlockReachability r = reachability(pb);

        assertTrue(r.canReach(bb(MAIN, 0), bb(F, 1)));
        assertFalse(r.canReach(bb(MAIN, 0), bb(G, 0)));
    }
}
