package results;

import ir.SourceLocation;

import java.io.BufferedWriter;
import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Writer;
import java.util.Collections;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Merged findings of a whole run
 */
public final class MemoryCheckResult {

    private final List<UafResult> uafResults;
    private final List<DfResult> dfResults;

    /**
     * Collect the merged findings
     *
     * @param uaf merged use-after-free findings
     * @param df merged double-free findings
     */
    public MemoryCheckResult(ResultMerger<UafResult> uaf, ResultMerger<DfResult> df) {
        this.uafResults = Collections.unmodifiableList(uaf.getResults());
        this.dfResults = Collections.unmodifiableList(df.getResults());
    }

    public List<UafResult> getUafResults() {
        return uafResults;
    }

    public List<DfResult> getDfResults() {
        return dfResults;
    }

    /**
     * Were any bugs found
     *
     * @return true if there are no findings of either kind
     */
    public boolean isEmpty() {
        return uafResults.isEmpty() && dfResults.isEmpty();
    }

    /**
     * Serialize as <code>{"uaf": [...], "df": [...]}</code>
     *
     * @return JSON form of the results
     */
    public JSONObject toJSON() {
        JSONArray uaf = new JSONArray();
        for (UafResult r : uafResults) {
            uaf.put(JSONUtil.toJSON(r));
        }
        JSONArray df = new JSONArray();
        for (DfResult r : dfResults) {
            df.put(JSONUtil.toJSON(r));
        }
        JSONObject json = new JSONObject();
        json.put("uaf", uaf);
        json.put("df", df);
        return json;
    }

    /**
     * Write the JSON form of the results to a file
     *
     * @param filename name of the output file
     * @throws IOException file could not be written
     */
    public void writeJSONToFile(String filename) throws IOException {
        try (Writer out = new BufferedWriter(new FileWriter(filename))) {
            toJSON().write(out, 2, 0);
        }
    }

    /**
     * Print the results as plain text warnings
     *
     * @param out stream to print to
     */
    public void print(PrintStream out) {
        for (UafResult r : uafResults) {
            out.println("warning: use after free memory bug may exists");
            printLocation(out, r.getDropLocation(), "first drop here", r.getDropVarName());
            printLocation(out, r.getDerefLocation(), "then dereference here", r.getDerefVarName());
        }
        for (DfResult r : dfResults) {
            out.println("warning: double free memory bug may exists");
            printLocation(out, r.getFirstDropLocation(), "first drop here", r.getFirstDropVarName());
            printLocation(out, r.getThenDropLocation(), "then drop here", r.getThenDropVarName());
        }
    }

    private static void printLocation(PrintStream out, SourceLocation loc, String problem, String varName) {
        String text = varName == null ? problem + "." : problem + ", relative variable: " + varName;
        out.println("  --> " + loc.getFile() + ":" + loc.getStartLine() + ":" + loc.getStartColumn() + ": " + text);
    }

    @Override
    public String toString() {
        return uafResults.size() + " use-after-free and " + dfResults.size() + " double-free findings";
    }
}
