package ir;

/**
 * A local together with an access path, i.e. a memory location named in the IR
 */
public final class Place {

    private final int local;
    private final AccessPath path;
    private final int memoizedHashCode;

    /**
     * Create a place
     *
     * @param local index of the local slot
     * @param path projections applied to the local
     */
    public Place(int local, AccessPath path) {
        assert local >= 0;
        this.local = local;
        this.path = path;
        this.memoizedHashCode = local * 31 + path.hashCode();
    }

    /**
     * Create a place for a local with no projections
     *
     * @param local index of the local slot
     * @return place for the local itself
     */
    public static Place local(int local) {
        return new Place(local, AccessPath.EMPTY);
    }

    public int getLocal() {
        return local;
    }

    public AccessPath getPath() {
        return path;
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
        if (!(obj instanceof Place)) {
            return false;
        }
        Place other = (Place) obj;
        return local == other.local && path.equals(other.path);
    }

    @Override
    public String toString() {
        if (path.isEmpty()) {
            return "_" + local;
        }
        return "(_" + local + path + ")";
    }
}
