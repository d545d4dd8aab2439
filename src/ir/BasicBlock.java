package ir;

import java.util.Collections;
import java.util.List;

import com.ibm.wala.util.intset.IntIterator;
import com.ibm.wala.util.intset.IntSet;

/**
 * Basic block of a function body: straight-line assignments followed by at most one call or drop terminator
 */
public final class BasicBlock {

    private final int id;
    private final IntSet successors;
    /**
     * Whether this block belongs to an unwind path
     */
    private final boolean cleanup;
    private final List<Assignment> assignments;
    private final CallEffect call;
    private final DropEffect drop;

    /**
     * Create a basic block
     *
     * @param id index of the block within its function
     * @param successors indices of the successor blocks
     * @param cleanup true for blocks on an unwind path
     * @param assignments assignments in program order
     * @param call call terminator or null
     * @param drop drop terminator or null
     */
    public BasicBlock(int id, IntSet successors, boolean cleanup, List<Assignment> assignments, CallEffect call,
                      DropEffect drop) {
        assert call == null || drop == null : "A block has at most one terminator";
        this.id = id;
        this.successors = successors;
        this.cleanup = cleanup;
        this.assignments = Collections.unmodifiableList(assignments);
        this.call = call;
        this.drop = drop;
    }

    public int getId() {
        return id;
    }

    public IntSet getSuccessors() {
        return successors;
    }

    public boolean isCleanup() {
        return cleanup;
    }

    public List<Assignment> getAssignments() {
        return assignments;
    }

    /**
     * Call terminating this block
     *
     * @return the call or null if the block does not end in a call
     */
    public CallEffect getCall() {
        return call;
    }

    /**
     * Destructor invocation terminating this block
     *
     * @return the drop or null if the block does not end in a drop
     */
    public DropEffect getDrop() {
        return drop;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("bb").append(id);
        if (cleanup) {
            sb.append(" (cleanup)");
        }
        sb.append(" -> [");
        IntIterator iter = successors.intIterator();
        while (iter.hasNext()) {
            sb.append("bb").append(iter.next());
            if (iter.hasNext()) {
                sb.append(", ");
            }
        }
        sb.append("]");
        return sb.toString();
    }
}
