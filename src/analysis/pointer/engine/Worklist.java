package analysis.pointer.engine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.ibm.wala.util.intset.IntSet;
import com.ibm.wala.util.intset.MutableSparseIntSet;

/**
 * FIFO queue of pending points-to additions
 */
public final class Worklist {

    private final Deque<PointsToDelta> queue = new ArrayDeque<>();

    /**
     * Schedule an addition to a node. Empty sets are not scheduled.
     *
     * @param node id of the node
     * @param pointsTo objects to add, must not be modified afterwards
     */
    public void add(int node, IntSet pointsTo) {
        if (pointsTo.isEmpty()) {
            return;
        }
        add(new PointsToDelta(node, pointsTo));
    }

    /**
     * Schedule an addition to a node, copying the set first so that later changes to it are not seen
     *
     * @param node id of the node
     * @param pointsTo objects to add
     */
    public void addCopy(int node, IntSet pointsTo) {
        if (pointsTo.isEmpty()) {
            return;
        }
        add(new PointsToDelta(node, MutableSparseIntSet.make(pointsTo)));
    }

    /**
     * Schedule an existing item
     *
     * @param item pending addition
     */
    public void add(PointsToDelta item) {
        queue.addLast(item);
    }

    /**
     * Get and remove the oldest item
     *
     * @return next item or null if the worklist is empty
     */
    public PointsToDelta poll() {
        return queue.pollFirst();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public int size() {
        return queue.size();
    }

    /**
     * Remove all pending items
     *
     * @return the removed items in queue order
     */
    public List<PointsToDelta> drain() {
        List<PointsToDelta> l = new ArrayList<>(queue);
        queue.clear();
        return l;
    }
}
