package ir;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import util.Logger;

import com.ibm.wala.util.intset.IntIterator;
import com.ibm.wala.util.intset.IntSetUtil;

/**
 * Reads the JSON documents written by the front end. Only the function table is indexed up front, each body is
 * converted to {@link FunctionBody} when it is first requested.
 */
public final class IRReader {

    private IRReader() {
        // static methods only
    }

    /**
     * Read and index the given IR documents
     *
     * @param files paths of JSON files, later files override functions of the same name
     * @return provider over all functions in the files
     * @throws IOException file could not be read
     * @throws JSONException file is not a well-formed IR document
     */
    public static IRProvider read(Collection<String> files) throws IOException, JSONException {
        Map<FunctionId, JSONObject> functions = new LinkedHashMap<>();
        for (String file : files) {
            Path p = Paths.get(file);
            try (Reader r = Files.newBufferedReader(p, StandardCharsets.UTF_8)) {
                index(new JSONObject(new JSONTokener(r)), functions);
            }
        }
        return new JSONProvider(functions);
    }

    /**
     * Index an IR document that is already in memory
     *
     * @param document parsed IR document
     * @return provider over the functions of the document
     * @throws JSONException document is missing its function table
     */
    public static IRProvider fromJSON(JSONObject document) throws JSONException {
        Map<FunctionId, JSONObject> functions = new LinkedHashMap<>();
        index(document, functions);
        return new JSONProvider(functions);
    }

    private static void index(JSONObject document, Map<FunctionId, JSONObject> functions) throws JSONException {
        JSONArray fns = document.getJSONArray("functions");
        for (int i = 0; i < fns.length(); i++) {
            JSONObject fn = fns.getJSONObject(i);
            FunctionId id = new FunctionId(fn.getString("id"));
            if (functions.put(id, fn) != null) {
                Logger.warn("Duplicate IR for " + id + ", using the last one");
            }
        }
    }

    /**
     * Convert the JSON for a single function
     *
     * @param id function identifier
     * @param fn JSON object for the function
     * @return function body
     * @throws JSONException required keys are missing
     */
    static FunctionBody parseBody(FunctionId id, JSONObject fn) throws JSONException {
        String file = fn.optString("file", SourceLocation.UNKNOWN.getFile());

        SortedMap<Integer, LocalInfo> locals = new TreeMap<>();
        JSONArray ls = fn.optJSONArray("locals");
        if (ls != null) {
            for (int i = 0; i < ls.length(); i++) {
                JSONObject l = ls.getJSONObject(i);
                int index = l.getInt("index");
                String name = l.isNull("name") ? null : l.optString("name", null);
                locals.put(index, new LocalInfo(index, parseType(l.optJSONObject("type")), l.optBoolean("needsDrop"),
                                                name));
            }
        }

        SortedMap<Integer, BasicBlock> blocks = new TreeMap<>();
        JSONArray bs = fn.getJSONArray("blocks");
        if (bs.length() == 0) {
            throw new JSONException("Function " + id + " has no basic blocks");
        }
        for (int i = 0; i < bs.length(); i++) {
            BasicBlock bb = parseBlock(id, bs.getJSONObject(i), file);
            blocks.put(bb.getId(), bb);
        }
        for (BasicBlock bb : blocks.values()) {
            IntIterator iter = bb.getSuccessors().intIterator();
            while (iter.hasNext()) {
                int succ = iter.next();
                if (!blocks.containsKey(succ)) {
                    throw new JSONException("Function " + id + " bb" + bb.getId() + " has unknown successor bb"
                            + succ);
                }
            }
        }
        return new FunctionBody(id, locals, blocks);
    }

    private static BasicBlock parseBlock(FunctionId fn, JSONObject b, String file) throws JSONException {
        int id = b.getInt("id");
        JSONArray succs = b.optJSONArray("successors");
        int[] s = new int[succs == null ? 0 : succs.length()];
        for (int i = 0; i < s.length; i++) {
            s[i] = succs.getInt(i);
        }

        List<Assignment> assignments = new ArrayList<>();
        JSONArray as = b.optJSONArray("assignments");
        if (as != null) {
            for (int i = 0; i < as.length(); i++) {
                JSONObject a = as.getJSONObject(i);
                try {
                    assignments.add(parseAssignment(a, file));
                }
                catch (UnsupportedConstructException e) {
                    Logger.debug("assign", "unhandled assign in " + fn + " bb" + id + ": " + e.getMessage());
                }
            }
        }

        if (b.has("call") && b.has("drop")) {
            throw new JSONException("Function " + fn + " bb" + id + " has both a call and a drop terminator");
        }

        CallEffect call = null;
        JSONObject c = b.optJSONObject("call");
        if (c != null) {
            call = parseCall(fn, id, c, file);
        }

        DropEffect drop = null;
        JSONObject d = b.optJSONObject("drop");
        if (d != null) {
            try {
                drop = new DropEffect(parsePlace(d.getJSONObject("place")), parseLocation(d.optJSONObject("location"),
                                                                                         file));
            }
            catch (UnsupportedConstructException e) {
                Logger.debug("body", "unhandled drop in " + fn + " bb" + id + ": " + e.getMessage());
            }
        }
        return new BasicBlock(id, IntSetUtil.make(s), b.optBoolean("cleanup"), assignments, call, drop);
    }

    private static Assignment parseAssignment(JSONObject a, String file) throws JSONException,
                                                                       UnsupportedConstructException {
        String opName = a.getString("op");
        OpKind op = OpKind.fromString(opName);
        if (op == null) {
            throw new UnsupportedConstructException("effect kind " + opName);
        }
        Place left = parsePlace(a.getJSONObject("left"));
        SourceLocation loc = parseLocation(a.optJSONObject("location"), file);
        if (op == OpKind.CONSTANT) {
            return new Assignment(left, op, null, null, loc);
        }
        Place right = parsePlace(a.getJSONObject("right"));
        TypeDescriptor rightType = a.has("rightType") ? parseType(a.getJSONObject("rightType")) : null;
        return new Assignment(left, op, right, rightType, loc);
    }

    private static CallEffect parseCall(FunctionId fn, int block, JSONObject c, String file) throws JSONException {
        FunctionId callee = new FunctionId(c.getString("callee"));
        List<Operand> args = new ArrayList<>();
        JSONArray as = c.optJSONArray("args");
        if (as != null) {
            for (int i = 0; i < as.length(); i++) {
                args.add(parseOperand(fn, block, as.getJSONObject(i)));
            }
        }

        Place dest = null;
        JSONObject d = c.optJSONObject("destination");
        if (d != null) {
            try {
                dest = parsePlace(d);
            }
            catch (UnsupportedConstructException e) {
                Logger.debug("call", "unhandled call destination in " + fn + " bb" + block + ": " + e.getMessage());
            }
        }

        List<FunctionId> candidates = new ArrayList<>();
        JSONArray cs = c.optJSONArray("candidates");
        if (cs != null) {
            for (int i = 0; i < cs.length(); i++) {
                candidates.add(new FunctionId(cs.getString(i)));
            }
        }
        return new CallEffect(callee, args, dest, parseLocation(c.optJSONObject("location"), file), candidates);
    }

    /**
     * Unsupported operands are replaced by constants so that argument positions stay aligned with parameters
     */
    private static Operand parseOperand(FunctionId fn, int block, JSONObject o) throws JSONException {
        String kindName = o.getString("kind");
        OpKind kind = OpKind.fromString(kindName);
        if (kind == OpKind.CONSTANT) {
            return Operand.constant();
        }
        if (kind != OpKind.COPY && kind != OpKind.MOVE) {
            Logger.debug("call", "unhandled operand kind " + kindName + " in " + fn + " bb" + block);
            return Operand.constant();
        }
        try {
            TypeDescriptor type = o.has("type") ? parseType(o.getJSONObject("type")) : null;
            return new Operand(kind, parsePlace(o.getJSONObject("place")), type);
        }
        catch (UnsupportedConstructException e) {
            Logger.debug("call", "unhandled operand in " + fn + " bb" + block + ": " + e.getMessage());
            return Operand.constant();
        }
    }

    static Place parsePlace(JSONObject p) throws JSONException, UnsupportedConstructException {
        int local = p.getInt("local");
        JSONArray proj = p.optJSONArray("projection");
        if (proj == null || proj.length() == 0) {
            return Place.local(local);
        }
        List<Projection> l = new ArrayList<>(proj.length());
        for (int i = 0; i < proj.length(); i++) {
            JSONObject elem = proj.getJSONObject(i);
            String kind = elem.getString("kind");
            switch (kind) {
            case "deref":
                l.add(Projection.DEREF);
                break;
            case "field":
                l.add(Projection.field(elem.getInt("index")));
                break;
            case "index":
            case "constant_index":
            case "subslice":
                l.add(Projection.INDEX);
                break;
            case "downcast":
                l.add(Projection.downcast(elem.getInt("variant")));
                break;
            default:
                throw new UnsupportedConstructException("projection kind " + kind);
            }
        }
        return new Place(local, AccessPath.of(l));
    }

    static TypeDescriptor parseType(JSONObject t) throws JSONException {
        if (t == null) {
            return TypeDescriptor.UNKNOWN;
        }
        String name = t.optString("name", "?");
        switch (t.optString("kind", "other")) {
        case "unit":
            return TypeDescriptor.UNIT;
        case "ref":
            return new TypeDescriptor(name, TypeDescriptor.Kind.REFERENCE);
        case "raw":
            return new TypeDescriptor(name, TypeDescriptor.Kind.RAW_POINTER);
        default:
            return new TypeDescriptor(name, TypeDescriptor.Kind.OTHER);
        }
    }

    static SourceLocation parseLocation(JSONObject loc, String defaultFile) {
        if (loc == null) {
            return new SourceLocation(defaultFile, 0, 0, 0, 0);
        }
        int startLine = loc.optInt("startLine");
        int startColumn = loc.optInt("startColumn");
        return new SourceLocation(loc.optString("file", defaultFile), startLine, startColumn,
                                  loc.optInt("endLine", startLine), loc.optInt("endColumn", startColumn));
    }

    /**
     * Provider over an indexed set of JSON function objects
     */
    private static final class JSONProvider implements IRProvider {

        private final Map<FunctionId, JSONObject> functions;

        JSONProvider(Map<FunctionId, JSONObject> functions) {
            this.functions = functions;
        }

        @Override
        public Set<FunctionId> getFunctionIds() {
            return Collections.unmodifiableSet(functions.keySet());
        }

        @Override
        public FunctionBody loadBody(FunctionId id) {
            JSONObject fn = functions.get(id);
            if (fn == null) {
                return null;
            }
            FunctionBody body = parseBody(id, fn);
            if (Logger.isEnabled("body")) {
                for (BasicBlock bb : body.getBlocks()) {
                    Logger.debug("body", id + " " + bb + " " + bb.getAssignments()
                                                    + (bb.getCall() == null ? "" : " " + bb.getCall())
                                                    + (bb.getDrop() == null ? "" : " " + bb.getDrop()));
                }
            }
            return body;
        }
    }

    /**
     * IR construct the analysis does not model
     */
    static class UnsupportedConstructException extends Exception {
        private static final long serialVersionUID = -6208415011683211367L;

        public UnsupportedConstructException(String m) {
            super(m);
        }
    }
}
