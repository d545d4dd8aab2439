package analysis.pointer.engine;

import static ir.ProgramBuilder.BOX;
import static ir.ProgramBuilder.REF;
import static ir.ProgramBuilder.place;
import ir.AccessPath;
import ir.FunctionId;
import ir.OpKind;
import ir.Place;
import ir.ProgramBuilder;
import ir.Projection;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import junit.framework.TestCase;
import signatures.LibrarySignatures;
import analysis.AnalysisContext;
import analysis.pointer.engine.PointsToAnalysis.PointsToListener;
import analysis.pointer.graph.CallContext;
import analysis.pointer.graph.ContextualCall;
import analysis.pointer.graph.PointerFlowGraph;
import analysis.pointer.graph.ProjectionNode;
import analysis.pointer.registrar.CallGraphExpander;

import com.ibm.wala.util.intset.IntSet;
import com.ibm.wala.util.intset.MutableIntSet;
import com.ibm.wala.util.intset.MutableSparseIntSet;

public class TestPointsToAnalysis extends TestCase {

    private static final FunctionId MAIN = new FunctionId("demo::main");
    private static final ContextualCall MAIN_CALL = new ContextualCall(MAIN, CallContext.entry());

    private static AnalysisContext expand(ProgramBuilder pb) {
        AnalysisContext ctxt = new AnalysisContext(pb.build(), MAIN, new LibrarySignatures());
        new CallGraphExpander(ctxt).run();
        return ctxt;
    }

    private static IntSet pointsTo(PointerFlowGraph g, Place p) {
        ProjectionNode n = g.lookup(MAIN_CALL, p.getLocal(), p.getPath());
        assertNotNull("no node for " + p, n);
        return n.getPointsTo();
    }

    private static int object(PointerFlowGraph g, Place p) {
        return g.lookup(MAIN_CALL, p.getLocal(), p.getPath()).getId();
    }

    /**
     * x is moved through y into z and the pointer r borrows z, then the struct s takes r
     */
    private static ProgramBuilder chain() {
        ProgramBuilder pb = new ProgramBuilder();
        pb.function("demo::main")
          .local(1, "x", BOX)
          .local(2, "y", BOX)
          .local(3, "z", BOX)
          .local(4, "r", REF)
          .local(5, "s", BOX)
          .local(6, "t", BOX)
          .local(7, "u", BOX)
          .block(0, 1)
          .assign(Place.local(2), OpKind.MOVE, Place.local(1), 1)
          .assign(Place.local(3), OpKind.MOVE, Place.local(2), 2)
          .assign(Place.local(4), OpKind.REF, Place.local(3), 3)
          .assign(place(5, Projection.field(0)), OpKind.MOVE, Place.local(4), 4)
          .assign(Place.local(6), OpKind.MOVE, Place.local(5), 5)
          .assign(Place.local(7), OpKind.COPY, place(6, Projection.field(0), Projection.DEREF), 6);
        pb.function("demo::main").block(1, 2).drop(Place.local(1), 7);
        pb.function("demo::main").block(2).drop(place(5, Projection.field(1)), 8);
        return pb;
    }

    public void testPropagationAlongEdges() {
        AnalysisContext ctxt = expand(chain());
        PointerFlowGraph g = new PointsToAnalysisSingleThreaded().solve(ctxt);

        int ox = object(g, Place.local(1));
        assertTrue(pointsTo(g, Place.local(1)).contains(ox));
        assertTrue(pointsTo(g, Place.local(2)).contains(ox));
        assertTrue(pointsTo(g, Place.local(3)).contains(ox));
        assertTrue(pointsTo(g, Place.local(4)).contains(ox));
        assertTrue(pointsTo(g, place(5, Projection.field(0))).contains(ox));
        assertTrue(ctxt.getWorklist().isEmpty());
    }

    public void testSubLevelDiffusion() {
        AnalysisContext ctxt = expand(chain());
        PointerFlowGraph g = new PointsToAnalysisSingleThreaded().solve(ctxt);

        int ox = object(g, Place.local(1));
        // s.0 reaches t.0 through the edge from s to t, and t.0.* inherits from t.0
        assertTrue(pointsTo(g, place(6, Projection.field(0))).contains(ox));
        assertTrue(pointsTo(g, place(6, Projection.field(0), Projection.DEREF)).contains(ox));
        assertTrue(pointsTo(g, Place.local(7)).contains(ox));
    }

    public void testSameLevelDiffusion() {
        AnalysisContext ctxt = expand(chain());
        PointsToAnalysisSingleThreaded engine = new PointsToAnalysisSingleThreaded();
        PointerFlowGraph g = engine.solve(ctxt);

        // the object dropped as s.1 travels with s to t.1, which has to be created
        int os1 = object(g, place(5, Projection.field(1)));
        assertTrue(pointsTo(g, place(6, Projection.field(1))).contains(os1));
        assertFalse(pointsTo(g, Place.local(7)).contains(os1));
        assertTrue(engine.getNumMaterialized() > 0);
    }

    public void testNoObjectsWithoutDrops() {
        ProgramBuilder pb = new ProgramBuilder();
        pb.function("demo::main")
          .local(1, "x", BOX)
          .local(2, "y", BOX)
          .block(0)
          .assign(Place.local(2), OpKind.MOVE, Place.local(1), 1);
        AnalysisContext ctxt = expand(pb);
        PointsToAnalysisSingleThreaded engine = new PointsToAnalysisSingleThreaded();
        PointerFlowGraph g = engine.solve(ctxt);
        assertTrue(pointsTo(g, Place.local(2)).isEmpty());
        assertEquals(0, engine.getNumProcessed());
    }

    public void testDeltasAreMonotoneAndDisjoint() {
        AnalysisContext ctxt = expand(chain());
        final Map<Integer, MutableIntSet> seen = new HashMap<>();
        final int[] calls = { 0 };
        PointsToAnalysisSingleThreaded engine = new PointsToAnalysisSingleThreaded();
        engine.setListener(new PointsToListener() {
            @Override
            public void pointsToChanged(ProjectionNode n, IntSet delta) {
                calls[0]++;
                assertFalse(delta.isEmpty());
                MutableIntSet s = seen.get(n.getId());
                if (s == null) {
                    s = MutableSparseIntSet.makeEmpty();
                    seen.put(n.getId(), s);
                }
                assertTrue("object reported twice for " + n, s.intersection(delta).isEmpty());
                s.addAll(delta);
                assertTrue(s.sameValue(n.getPointsTo()));
            }
        });
        PointerFlowGraph g = engine.solve(ctxt);

        for (ProjectionNode n : g) {
            IntSet s = seen.get(n.getId());
            if (s == null) {
                assertTrue(n.getPointsTo().isEmpty());
            }
            else {
                assertTrue(s.sameValue(n.getPointsTo()));
            }
        }
        assertEquals(engine.getNumChanged(), calls[0]);
    }

    public void testOrderDoesNotMatter() {
        AnalysisContext expected = expand(chain());
        PointerFlowGraph g1 = new PointsToAnalysisSingleThreaded().solve(expected);

        for (long seed = 0; seed < 5; seed++) {
            AnalysisContext ctxt = expand(chain());
            List<PointsToDelta> items = ctxt.getWorklist().drain();
            Collections.shuffle(items, new Random(seed));
            for (PointsToDelta item : items) {
                ctxt.getWorklist().add(item);
            }
            PointerFlowGraph g2 = new PointsToAnalysisSingleThreaded().solve(ctxt);

            assertEquals(g1.numNodes(), g2.numNodes());
            for (ProjectionNode n : g1) {
                ProjectionNode m = g2.lookup(n.getCall(), n.getLocal(), n.getPath());
                assertNotNull(m);
                assertTrue("seed " + seed + " differs at " + n, n.getPointsTo().sameValue(m.getPointsTo()));
            }
        }
    }

    public void testCyclicFieldFlowTerminates() {
        ProgramBuilder pb = new ProgramBuilder();
        pb.function("demo::main")
          .local(1, "a", BOX)
          .local(2, "b", BOX)
          .block(0, 1)
          .assign(place(1, Projection.field(0)), OpKind.MOVE, Place.local(1), 1)
          .assign(Place.local(2), OpKind.MOVE, Place.local(1), 2);
        pb.function("demo::main").block(1).drop(place(1, Projection.field(0)), 3);
        AnalysisContext ctxt = expand(pb);
        PointerFlowGraph g = new PointsToAnalysisSingleThreaded().solve(ctxt);

        int o = object(g, place(1, Projection.field(0)));
        for (ProjectionNode n : g) {
            assertTrue(n.getPath().length() <= PointerFlowGraph.MAX_PATH_LENGTH);
        }
        assertTrue(pointsTo(g, place(2, Projection.field(0))).contains(o));
        assertEquals(AccessPath.of(Projection.field(0)), g.getNode(o).getPath());
    }
}
