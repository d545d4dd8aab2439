package results;

import ir.SourceLocation;

import java.util.List;

import junit.framework.TestCase;

public class TestResultMerger extends TestCase {

    private static final SourceLocation USE = new SourceLocation("src/main.rs", 8, 5, 8, 11);
    private static final SourceLocation DROP = new SourceLocation("src/main.rs", 7, 5, 7, 12);
    private static final SourceLocation OTHER_DROP = new SourceLocation("src/lib.rs", 3, 1, 3, 2);

    public void testNamedReplacesNameless() {
        ResultMerger<UafResult> m = new ResultMerger<>();
        m.add(new UafResult(USE, null, DROP, null));
        m.add(new UafResult(USE, "p", DROP, "x"));

        List<UafResult> results = m.getResults();
        assertEquals(1, results.size());
        assertEquals("p", results.get(0).getDerefVarName());
    }

    public void testNamelessAfterNamedIsDropped() {
        ResultMerger<UafResult> m = new ResultMerger<>();
        m.add(new UafResult(USE, "p", DROP, "x"));
        m.add(new UafResult(USE, null, DROP, null));
        assertEquals(1, m.getResults().size());
        assertEquals("x", m.getResults().get(0).getDropVarName());
    }

    public void testDistinctNamesAccumulate() {
        ResultMerger<UafResult> m = new ResultMerger<>();
        m.add(new UafResult(USE, "p", DROP, "x"));
        m.add(new UafResult(USE, "q", DROP, "x"));
        m.add(new UafResult(USE, "p", DROP, "x"));
        assertEquals(2, m.getResults().size());
        assertEquals(1, m.getGrouped().size());
    }

    public void testPartialNamesCount() {
        ResultMerger<DfResult> m = new ResultMerger<>();
        m.add(new DfResult(DROP, null, OTHER_DROP, null));
        m.add(new DfResult(DROP, null, OTHER_DROP, "z"));
        assertEquals(1, m.getResults().size());
        assertEquals("z", m.getResults().get(0).getThenDropVarName());
    }

    public void testLocationPairsAreSeparate() {
        ResultMerger<DfResult> m = new ResultMerger<>();
        m.add(new DfResult(DROP, "x", OTHER_DROP, "z"));
        m.add(new DfResult(OTHER_DROP, "z", DROP, "x"));
        m.add(new DfResult(DROP, null, USE, null));
        assertEquals(3, m.getResults().size());
        assertEquals(3, m.getGrouped().size());
        // first-seen order
        assertEquals(DROP, m.getResults().get(0).getFirstDropLocation());
        assertEquals(OTHER_DROP, m.getResults().get(1).getFirstDropLocation());
    }
}
