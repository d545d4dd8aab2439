package util;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * FIFO work queue in which each element is enqueued at most once over the lifetime of the queue, so a breadth-first
 * traversal processes every element exactly once even on cyclic structures.
 *
 * @param <T> type of queue elements
 */
public class WorkQueue<T> {

    /**
     * Internal Q
     */
    private final Deque<T> q = new ArrayDeque<>();
    /**
     * Every element ever added
     */
    private final Set<T> seen = new LinkedHashSet<>();

    /**
     * Create an empty queue
     */
    public WorkQueue() {
    }

    /**
     * Create a queue containing all the elements in the given collection
     *
     * @param c initial elements of the queue
     */
    public WorkQueue(Collection<? extends T> c) {
        this.addAll(c);
    }

    /**
     * Add n to the back of the queue if it was never added before
     *
     * @param n element to add
     * @return true if the element is new
     */
    public boolean add(T n) {
        boolean isNew = seen.add(n);
        if (isNew) {
            q.addLast(n);
        }
        return isNew;
    }

    /**
     * Add a collection of elements to the back of the queue
     *
     * @param collection elements to add
     * @return true if any element was new
     */
    public boolean addAll(Collection<? extends T> collection) {
        boolean changed = false;
        for (T n : collection) {
            changed |= add(n);
        }
        return changed;
    }

    /**
     * Get and remove the next element from the queue
     *
     * @return the next element or null if the queue is empty
     */
    public T poll() {
        return q.pollFirst();
    }

    public boolean isEmpty() {
        return q.isEmpty();
    }

    /**
     * Elements that have ever been added, in the order they were added
     *
     * @return read-only set of elements
     */
    public Set<T> getSeen() {
        return Collections.unmodifiableSet(seen);
    }

    @Override
    public String toString() {
        return q.toString();
    }
}
