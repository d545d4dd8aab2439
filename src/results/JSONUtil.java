package results;

import ir.SourceLocation;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Serialization of findings
 */
public class JSONUtil {

    /**
     * Serialize a source location as <code>{"file", "line": [start, end], "column": [start, end]}</code>
     *
     * @param loc location to serialize
     * @return {@link JSONObject} containing the serialized form
     */
    public static JSONObject toJSON(SourceLocation loc) {
        JSONObject json = new JSONObject();
        try {
            json.put("file", loc.getFile());
            json.put("line", new JSONArray().put(loc.getStartLine()).put(loc.getEndLine()));
            json.put("column", new JSONArray().put(loc.getStartColumn()).put(loc.getEndColumn()));
        }
        catch (JSONException e) {
            System.err.println("Serialization error in " + loc + ", message: " + e.getMessage());
        }
        return json;
    }

    /**
     * Serialize a use-after-free result
     *
     * @param r result to serialize
     * @return {@link JSONObject} containing the serialized form
     */
    public static JSONObject toJSON(UafResult r) {
        JSONObject json = new JSONObject();
        try {
            json.put("kind", "use-after-free");
            json.put("drop", toJSON(r.getDropLocation()));
            json.put("dropVar", nameOrNull(r.getDropVarName()));
            json.put("deref", toJSON(r.getDerefLocation()));
            json.put("derefVar", nameOrNull(r.getDerefVarName()));
        }
        catch (JSONException e) {
            System.err.println("Serialization error in " + r + ", message: " + e.getMessage());
        }
        return json;
    }

    /**
     * Serialize a double-free result
     *
     * @param r result to serialize
     * @return {@link JSONObject} containing the serialized form
     */
    public static JSONObject toJSON(DfResult r) {
        JSONObject json = new JSONObject();
        try {
            json.put("kind", "double-free");
            json.put("firstDrop", toJSON(r.getFirstDropLocation()));
            json.put("firstDropVar", nameOrNull(r.getFirstDropVarName()));
            json.put("thenDrop", toJSON(r.getThenDropLocation()));
            json.put("thenDropVar", nameOrNull(r.getThenDropVarName()));
        }
        catch (JSONException e) {
            System.err.println("Serialization error in " + r + ", message: " + e.getMessage());
        }
        return json;
    }

    private static Object nameOrNull(String name) {
        return name == null ? JSONObject.NULL : name;
    }
}
