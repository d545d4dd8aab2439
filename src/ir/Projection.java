package ir;

/**
 * Single projection operator applied to a place
 */
public final class Projection {

    /**
     * Kinds of projections
     */
    public enum Kind {
        DEREF, FIELD, INDEX, DOWNCAST;
    }

    /**
     * Dereference, there is only one
     */
    public static final Projection DEREF = new Projection(Kind.DEREF, -1);

    /**
     * Array or slice indexing, all indices are treated as the same element
     */
    public static final Projection INDEX = new Projection(Kind.INDEX, -1);

    private final Kind kind;
    /**
     * Field index for FIELD, variant index for DOWNCAST, -1 otherwise
     */
    private final int index;

    private Projection(Kind kind, int index) {
        this.kind = kind;
        this.index = index;
    }

    /**
     * Projection to the <code>i</code>th field
     *
     * @param i field index
     * @return field projection
     */
    public static Projection field(int i) {
        return new Projection(Kind.FIELD, i);
    }

    /**
     * Projection to an enum variant
     *
     * @param variant variant index
     * @return downcast projection
     */
    public static Projection downcast(int variant) {
        return new Projection(Kind.DOWNCAST, variant);
    }

    public Kind getKind() {
        return kind;
    }

    public int getIndex() {
        return index;
    }

    public boolean isDeref() {
        return kind == Kind.DEREF;
    }

    @Override
    public int hashCode() {
        return kind.hashCode() * 31 + index;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Projection)) {
            return false;
        }
        Projection other = (Projection) obj;
        return kind == other.kind && index == other.index;
    }

    @Override
    public String toString() {
        switch (kind) {
        case DEREF:
            return "*";
        case FIELD:
            return "." + index;
        case INDEX:
            return "[]";
        case DOWNCAST:
            return " as " + index;
        default:
            throw new RuntimeException("Unhandled projection kind " + kind);
        }
    }
}
