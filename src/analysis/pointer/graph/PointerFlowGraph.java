package analysis.pointer.graph;

import ir.AccessPath;
import ir.FunctionBody;
import ir.Program;

import java.io.BufferedWriter;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import analysis.pointer.engine.Worklist;

import com.ibm.wala.util.collections.Pair;
import com.ibm.wala.util.intset.IntSet;
import com.ibm.wala.util.intset.MutableIntSet;
import com.ibm.wala.util.intset.MutableSparseIntSet;

/**
 * Pointer flow graph. Nodes are kept in an arena indexed by id, with a dictionary from {@link ProjectionKey} to node
 * and an index from each local of a contextual call to the nodes for its access paths.
 */
public final class PointerFlowGraph implements Iterable<ProjectionNode> {

    /**
     * Access paths longer than this are never materialized by diffusion
     */
    public static final int MAX_PATH_LENGTH = 8;

    /**
     * Worklist new edges schedule existing points-to facts on
     */
    private final Worklist worklist;
    /**
     * Nodes indexed by id
     */
    private final List<ProjectionNode> nodes = new ArrayList<>();
    private final Map<ProjectionKey, ProjectionNode> dictionary = new HashMap<>();
    /**
     * Nodes of each local of each contextual call, in creation order
     */
    private final Map<Pair<ContextualCall, Integer>, List<ProjectionNode>> nodesForLocal = new HashMap<>();
    private final Set<DerefEdge> derefEdges = new LinkedHashSet<>();
    /**
     * Abstract objects whose dropping node points to more than one object
     */
    private final MutableIntSet multiDropObjects = MutableSparseIntSet.makeEmpty();
    private int numEdges = 0;

    /**
     * Create an empty graph
     *
     * @param worklist queue that additions caused by new edges are put on
     */
    public PointerFlowGraph(Worklist worklist) {
        this.worklist = worklist;
    }

    /**
     * Find or create the node for an access path on a local
     *
     * @param call function and context owning the local
     * @param local index of the local
     * @param path projections applied to the local
     * @return the unique node for the key
     */
    public ProjectionNode getOrCreate(ContextualCall call, int local, AccessPath path) {
        ProjectionKey key = new ProjectionKey(call, local, path);
        ProjectionNode n = dictionary.get(key);
        if (n == null) {
            n = new ProjectionNode(nodes.size(), key);
            nodes.add(n);
            dictionary.put(key, n);
            Pair<ContextualCall, Integer> l = Pair.make(call, local);
            List<ProjectionNode> siblings = nodesForLocal.get(l);
            if (siblings == null) {
                siblings = new ArrayList<>();
                nodesForLocal.put(l, siblings);
            }
            siblings.add(n);
        }
        return n;
    }

    /**
     * Find the node for an access path on a local without creating it
     *
     * @param call function and context owning the local
     * @param local index of the local
     * @param path projections applied to the local
     * @return the node or null if it was never created
     */
    public ProjectionNode lookup(ContextualCall call, int local, AccessPath path) {
        return dictionary.get(new ProjectionKey(call, local, path));
    }

    /**
     * Get a node by id
     *
     * @param id node id (or abstract object id)
     * @return the node
     * @throws IllegalStateException if no node was created with this id
     */
    public ProjectionNode getNode(int id) {
        if (id < 0 || id >= nodes.size()) {
            throw new IllegalStateException("No projection node with id " + id);
        }
        return nodes.get(id);
    }

    /**
     * Get all nodes for access paths on the given local
     *
     * @param call function and context owning the local
     * @param local index of the local
     * @return nodes in creation order, the list grows as nodes are created
     */
    public List<ProjectionNode> getNodesForLocal(ContextualCall call, int local) {
        List<ProjectionNode> l = nodesForLocal.get(Pair.make(call, local));
        if (l == null) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(l);
    }

    /**
     * Add an edge, recording it as a deref edge when either end's access path dereferences. If the edge is new and
     * the source already points to something, that is scheduled on the target.
     *
     * @param from source node
     * @param to target node
     * @param site effect creating the edge
     * @return true if the edge was not already present
     */
    public boolean addEdge(ProjectionNode from, ProjectionNode to, ContextualSite site) {
        return addEdge(from, to, site, from.getPath().containsDeref(), to.getPath().containsDeref());
    }

    /**
     * Add an edge with explicit dereference flags
     *
     * @param from source node
     * @param to target node
     * @param site effect creating the edge
     * @param fromDeref whether the source end dereferences
     * @param toDeref whether the target end dereferences
     * @return true if the edge was not already present
     */
    public boolean addEdge(ProjectionNode from, ProjectionNode to, ContextualSite site, boolean fromDeref,
                           boolean toDeref) {
        FlowEdge e = new FlowEdge(from.getId(), to.getId(), site, fromDeref, toDeref);
        if (!from.addEdge(e)) {
            return false;
        }
        numEdges++;
        if (e.isDeref()) {
            derefEdges.add(new DerefEdge(from.getId(), to.getId(), fromDeref, toDeref));
        }
        worklist.addCopy(to.getId(), from.getPointsTo());
        return true;
    }

    /**
     * Is there an edge between the two nodes
     *
     * @param from source node
     * @param to target node
     * @return true if an edge was added from <code>from</code> to <code>to</code>
     */
    public boolean hasEdge(ProjectionNode from, ProjectionNode to) {
        return from.getEdge(to.getId()) != null;
    }

    /**
     * Union objects into a node's points-to set, registering the node as a double-free candidate once it has drop
     * sites and more than one pointee
     *
     * @param n node to update
     * @param delta objects to add
     * @return true if the set changed
     */
    public boolean addToPointsTo(ProjectionNode n, IntSet delta) {
        boolean changed = n.addAllToPointsTo(delta);
        if (changed && n.hasDropSites() && n.getPointsTo().size() > 1) {
            multiDropObjects.add(n.getId());
        }
        return changed;
    }

    public Set<DerefEdge> getDerefEdges() {
        return Collections.unmodifiableSet(derefEdges);
    }

    public IntSet getMultiDropObjects() {
        return multiDropObjects;
    }

    public int numNodes() {
        return nodes.size();
    }

    public int numEdges() {
        return numEdges;
    }

    @Override
    public Iterator<ProjectionNode> iterator() {
        return Collections.unmodifiableList(nodes).iterator();
    }

    /**
     * Name of the local a node is for, falling back to the local index
     */
    private static String nodeLabel(ProjectionNode n, Program program) {
        String name = null;
        if (program != null) {
            FunctionBody body = program.getBody(n.getCall().getFunction());
            if (body != null) {
                name = body.getLocalName(n.getLocal());
            }
        }
        String local = name == null ? "_" + n.getLocal() : name;
        CallContext context = n.getCall().getContext();
        String caller = context.isEntry() ? "entry" : "called at " + context.get(CallContext.CALL_SITE);
        return "#" + n.getId() + " " + local + n.getPath() + " " + n.getCall().getFunction() + " (" + caller + ") -> "
                + n.getPointsTo();
    }

    /**
     * Print the graph in graphviz dot format to a file
     *
     * @param filename name of the file, ".dot" is appended
     * @param program program the graph was built for, used to print local names
     */
    public void dumpPointerFlowGraphToFile(String filename, Program program) {
        String fullFilename = filename + ".dot";
        try (Writer out = new BufferedWriter(new FileWriter(fullFilename))) {
            dumpPointerFlowGraph(out, program);
            System.err.println("\nDOT written to: " + fullFilename);
        }
        catch (IOException e) {
            System.err.println("Could not write DOT to file, " + fullFilename + ", " + e.getMessage());
        }
    }

    /**
     * Write the graph in graphviz dot format
     *
     * @param writer output
     * @param program program the graph was built for, may be null
     * @return the writer
     * @throws IOException if the writer fails
     */
    public Writer dumpPointerFlowGraph(Writer writer, Program program) throws IOException {
        double spread = 1.0;
        writer.write("digraph G {\n" + "nodesep=" + spread + ";\n" + "ranksep=" + spread + ";\n"
                                        + "graph [fontsize=10]" + ";\n" + "node [fontsize=10]" + ";\n"
                                        + "edge [fontsize=10]" + ";\n");

        writer.write("/******************** NODES ********************/\n");
        for (ProjectionNode n : nodes) {
            String shape = n.hasDropSites() ? "box" : "ellipse";
            writer.write("\t" + n.getId() + " [label=\"" + escape(nodeLabel(n, program)) + "\", shape=" + shape
                                            + "];\n");
        }

        writer.write("/******************** EDGES ********************/\n");
        for (ProjectionNode n : nodes) {
            for (FlowEdge e : n.getEdges()) {
                writer.write("\t" + e.getSource() + " -> " + e.getTarget() + (e.isDeref() ? " [style=dashed]" : "")
                                                + ";\n");
            }
        }

        writer.write("\n}\n");
        return writer;
    }

    /**
     * Print the graph one node per line, followed by its outgoing edges
     *
     * @param program program the graph was built for, may be null
     * @return textual dump
     */
    public String dump(Program program) {
        StringBuilder sb = new StringBuilder();
        for (ProjectionNode n : nodes) {
            sb.append(nodeLabel(n, program));
            if (n.hasDropSites()) {
                sb.append(" dropped at ").append(n.getDropSites());
            }
            sb.append("\n");
            for (FlowEdge e : n.getEdges()) {
                sb.append("\t").append(e).append(" at ").append(e.getSite().getBlock()).append("\n");
            }
        }
        return sb.toString();
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
