package ir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Immutable sequence of projections applied to a local, e.g. <code>(*x).0</code> is [DEREF, FIELD(0)]
 */
public final class AccessPath {

    /**
     * Path with no projections, the local itself
     */
    public static final AccessPath EMPTY = new AccessPath(Collections.<Projection> emptyList());

    private final List<Projection> projections;
    private final boolean containsDeref;
    private final int memoizedHashCode;

    private AccessPath(List<Projection> projections) {
        this.projections = projections;
        boolean deref = false;
        for (Projection p : projections) {
            deref |= p.isDeref();
        }
        this.containsDeref = deref;
        this.memoizedHashCode = projections.hashCode();
    }

    /**
     * Create a path from the given projections
     *
     * @param projections projections in application order
     * @return access path
     */
    public static AccessPath of(Projection... projections) {
        if (projections.length == 0) {
            return EMPTY;
        }
        return new AccessPath(Collections.unmodifiableList(new ArrayList<>(Arrays.asList(projections))));
    }

    /**
     * Create a path from the given projections
     *
     * @param projections projections in application order
     * @return access path
     */
    public static AccessPath of(List<Projection> projections) {
        if (projections.isEmpty()) {
            return EMPTY;
        }
        return new AccessPath(Collections.unmodifiableList(new ArrayList<>(projections)));
    }

    public List<Projection> getProjections() {
        return projections;
    }

    public int length() {
        return projections.size();
    }

    public boolean isEmpty() {
        return projections.isEmpty();
    }

    /**
     * Does any projection on this path dereference
     *
     * @return true if the path contains a DEREF
     */
    public boolean containsDeref() {
        return containsDeref;
    }

    /**
     * Is this path an initial segment of <code>other</code> (a path is a prefix of itself)
     *
     * @param other path to compare against
     * @return true if <code>other</code> starts with all of this path's projections
     */
    public boolean isPrefixOf(AccessPath other) {
        if (other.length() < this.length()) {
            return false;
        }
        return other.projections.subList(0, this.length()).equals(this.projections);
    }

    /**
     * Is this path an initial segment of <code>other</code> that is shorter than <code>other</code>
     *
     * @param other path to compare against
     * @return true if this path is a strict prefix of <code>other</code>
     */
    public boolean isStrictPrefixOf(AccessPath other) {
        return other.length() > this.length() && isPrefixOf(other);
    }

    /**
     * Get the projections of this path that follow the given prefix
     *
     * @param prefix prefix of this path
     * @return path such that <code>prefix.append(result).equals(this)</code>
     */
    public AccessPath suffixAfter(AccessPath prefix) {
        if (!prefix.isPrefixOf(this)) {
            throw new IllegalArgumentException(prefix + " is not a prefix of " + this);
        }
        return of(projections.subList(prefix.length(), length()));
    }

    /**
     * Extend this path with the projections of <code>suffix</code>
     *
     * @param suffix projections to add at the end
     * @return new path
     */
    public AccessPath append(AccessPath suffix) {
        if (suffix.isEmpty()) {
            return this;
        }
        if (this.isEmpty()) {
            return suffix;
        }
        List<Projection> l = new ArrayList<>(length() + suffix.length());
        l.addAll(projections);
        l.addAll(suffix.projections);
        return new AccessPath(Collections.unmodifiableList(l));
    }

    /**
     * Extend this path with a single projection
     *
     * @param p projection to add at the end
     * @return new path
     */
    public AccessPath append(Projection p) {
        List<Projection> l = new ArrayList<>(length() + 1);
        l.addAll(projections);
        l.add(p);
        return new AccessPath(Collections.unmodifiableList(l));
    }

    @Override
    public int hashCode() {
        return memoizedHashCode;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof AccessPath)) {
            return false;
        }
        AccessPath other = (AccessPath) obj;
        return memoizedHashCode == other.memoizedHashCode && projections.equals(other.projections);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Projection p : projections) {
            sb.append(p);
        }
        return sb.toString();
    }
}
