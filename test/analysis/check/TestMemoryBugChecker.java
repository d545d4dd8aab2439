package analysis.check;

import static ir.ProgramBuilder.BOX;
import static ir.ProgramBuilder.INT;
import static ir.ProgramBuilder.REF;
import static ir.ProgramBuilder.copy;
import static ir.ProgramBuilder.move;
import static ir.ProgramBuilder.place;
import ir.FunctionId;
import ir.OpKind;
import ir.Place;
import ir.ProgramBuilder;
import ir.Projection;
import junit.framework.TestCase;
import signatures.LibrarySignatures;
import analysis.AnalysisContext;
import analysis.MemoryCheck;
import analysis.pointer.engine.PointsToAnalysisSingleThreaded;
import analysis.pointer.graph.GlobalBasicBlock;

public class TestMemoryBugChecker extends TestCase {

    private static final FunctionId MAIN = new FunctionId("demo::main");

    private static CheckInfo check(ProgramBuilder pb) {
        MemoryCheck mc = new MemoryCheck(pb.build(), new LibrarySignatures());
        AnalysisContext ctxt = mc.analyzeEntry(MAIN, new PointsToAnalysisSingleThreaded());
        return MemoryBugChecker.check(ctxt);
    }

    /**
     * bb0: p = &x; bb1: drop x; bb2: y = *p, or with the last two swapped
     */
    private static ProgramBuilder borrowThenDrop(boolean dropFirst) {
        ProgramBuilder pb = new ProgramBuilder();
        pb.function("demo::main")
          .local(1, "x", BOX)
          .local(2, "p", REF)
          .local(3, "y", INT)
          .block(0, 1)
          .assign(Place.local(2), OpKind.REF, Place.local(1), 2);
        if (dropFirst) {
            pb.function("demo::main").block(1, 2).drop(Place.local(1), 3);
            pb.function("demo::main").block(2).assign(Place.local(3), OpKind.COPY, place(2, Projection.DEREF), 4);
        }
        else {
            pb.function("demo::main")
              .block(1, 2)
              .assign(Place.local(3), OpKind.COPY, place(2, Projection.DEREF), 4);
            pb.function("demo::main").block(2).drop(Place.local(1), 3);
        }
        return pb;
    }

    public void testUseAfterDrop() {
        CheckInfo info = check(borrowThenDrop(true));
        assertEquals(1, info.getUafInfos().size());
        assertTrue(info.getDfInfos().isEmpty());

        UafInfo uaf = info.getUafInfos().get(0);
        assertEquals(new GlobalBasicBlock(MAIN, 2), uaf.getDerefSite().getBlock());
        assertEquals(new GlobalBasicBlock(MAIN, 1), uaf.getDropSite().getBlock());
        assertEquals(4, uaf.getDerefSite().getLocation().getStartLine());
        assertEquals(3, uaf.getDropSite().getLocation().getStartLine());
    }

    public void testUseBeforeDrop() {
        assertTrue(check(borrowThenDrop(false)).isEmpty());
    }

    public void testUseAndDropInSameBlock() {
        ProgramBuilder pb = new ProgramBuilder();
        pb.function("demo::main")
          .local(1, "x", BOX)
          .local(2, "p", REF)
          .local(3, "y", INT)
          .block(0, 1)
          .assign(Place.local(2), OpKind.REF, Place.local(1), 2);
        pb.function("demo::main")
          .block(1, 1)
          .assign(Place.local(3), OpKind.COPY, place(2, Projection.DEREF), 3)
          .drop(Place.local(1), 4);
        assertTrue(check(pb).isEmpty());
    }

    /**
     * bb0 branches to bb1 and bb2, both drop x and move x into z, bb3 drops z
     */
    public void testDoubleDropThroughMove() {
        ProgramBuilder pb = new ProgramBuilder();
        pb.function("demo::main").local(1, "x", BOX).local(2, "z", BOX).block(0, 1, 2);
        pb.function("demo::main")
          .block(1, 3)
          .assign(Place.local(2), OpKind.MOVE, Place.local(1), 1)
          .drop(Place.local(1), 2);
        pb.function("demo::main")
          .block(2, 3)
          .assign(Place.local(2), OpKind.MOVE, Place.local(1), 3)
          .drop(Place.local(1), 4);
        pb.function("demo::main").block(3).drop(Place.local(2), 5);
        CheckInfo info = check(pb);

        assertTrue(info.getUafInfos().isEmpty());
        assertEquals(2, info.getDfInfos().size());
        boolean fromB1 = false;
        boolean fromB2 = false;
        for (DfInfo df : info.getDfInfos()) {
            assertEquals(new GlobalBasicBlock(MAIN, 3), df.getThenDropSite().getBlock());
            fromB1 |= df.getFirstDropSite().getBlock().getBlock() == 1;
            fromB2 |= df.getFirstDropSite().getBlock().getBlock() == 2;
        }
        assertTrue(fromB1 && fromB2);
    }

    public void testDropsOnSeparateBranches() {
        ProgramBuilder pb = new ProgramBuilder();
        pb.function("demo::main").local(1, "x", BOX).local(2, "z", BOX).block(0, 1, 2);
        pb.function("demo::main")
          .block(1)
          .assign(Place.local(2), OpKind.MOVE, Place.local(1), 1)
          .drop(Place.local(2), 2);
        pb.function("demo::main").block(2).drop(Place.local(1), 3);
        assertTrue(check(pb).isEmpty());
    }

    public void testUseInCallee() {
        ProgramBuilder pb = new ProgramBuilder();
        pb.function("demo::main")
          .local(1, "x", BOX)
          .local(2, "p", REF)
          .block(0, 1)
          .assign(Place.local(2), OpKind.REF, Place.local(1), 1);
        pb.function("demo::main").block(1, 2).drop(Place.local(1), 2);
        pb.function("demo::main").block(2).call("demo::read", Place.local(0), 3, copy(Place.local(2), REF));
        pb.function("demo::read")
          .local(1, "v", REF)
          .local(2, "n", INT)
          .block(0)
          .assign(Place.local(2), OpKind.COPY, place(1, Projection.DEREF), 10);

        boolean inCallee = false;
        for (UafInfo uaf : check(pb).getUafInfos()) {
            assertEquals(new GlobalBasicBlock(MAIN, 1), uaf.getDropSite().getBlock());
            if (uaf.getDerefSite().getBlock().getFunction().equals(new FunctionId("demo::read"))) {
                inCallee = true;
                assertEquals(10, uaf.getDerefSite().getLocation().getStartLine());
            }
        }
        assertTrue(inCallee);
    }

    public void testDroppedThenPassedToCallee() {
        ProgramBuilder pb = new ProgramBuilder();
        pb.function("demo::main").local(1, "x", BOX).block(0, 1).drop(Place.local(1), 2);
        pb.function("demo::main").block(1).call("demo::consume", Place.local(0), 3, move(1));
        pb.function("demo::consume").local(1, "v", BOX).block(0).drop(Place.local(1), 10);
        CheckInfo info = check(pb);

        // v points to its own object and to x's, and the drop of x reaches the drop of v through the call
        assertEquals(1, info.getDfInfos().size());
        DfInfo df = info.getDfInfos().get(0);
        assertEquals(2, df.getFirstDropSite().getLocation().getStartLine());
        assertEquals(10, df.getThenDropSite().getLocation().getStartLine());
        // passing the dropped x is a use
        assertFalse(info.getUafInfos().isEmpty());
        for (UafInfo uaf : info.getUafInfos()) {
            assertEquals(3, uaf.getDerefSite().getLocation().getStartLine());
        }
    }

    public void testReturnsAreNotFollowed() {
        ProgramBuilder pb = new ProgramBuilder();
        pb.function("demo::main").local(1, "x", BOX).block(0, 1).call("demo::consume", Place.local(0), 1, move(1));
        pb.function("demo::main").block(1).drop(Place.local(1), 2);
        pb.function("demo::consume").local(1, "v", BOX).block(0).drop(Place.local(1), 10);
        assertTrue(check(pb).isEmpty());
    }

    public void testNoDropsNoFindings() {
        ProgramBuilder pb = new ProgramBuilder();
        pb.function("demo::main")
          .local(1, "x", BOX)
          .local(2, "p", REF)
          .local(3, "y", INT)
          .block(0, 1)
          .assign(Place.local(2), OpKind.REF, Place.local(1), 1);
        pb.function("demo::main").block(1).assign(Place.local(3), OpKind.COPY, place(2, Projection.DEREF), 2);
        assertTrue(check(pb).isEmpty());
    }
}
