package ir;

/**
 * Static type of a local slot or of a projected place, as far as the analysis needs to know it
 */
public final class TypeDescriptor {

    /**
     * Coarse classification of a type
     */
    public enum Kind {
        /**
         * The unit type, carries no value
         */
        UNIT,
        /**
         * Borrowed reference
         */
        REFERENCE,
        /**
         * Raw pointer
         */
        RAW_POINTER,
        /**
         * Anything else (structs, boxes, integers, ...)
         */
        OTHER;
    }

    /**
     * Unit type
     */
    public static final TypeDescriptor UNIT = new TypeDescriptor("()", Kind.UNIT);

    /**
     * Type of a place whose type was not reported
     */
    public static final TypeDescriptor UNKNOWN = new TypeDescriptor("?", Kind.OTHER);

    private final String name;
    private final Kind kind;

    /**
     * Create a type descriptor
     *
     * @param name printable name of the type
     * @param kind classification
     */
    public TypeDescriptor(String name, Kind kind) {
        this.name = name;
        this.kind = kind;
    }

    public String getName() {
        return name;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Is this a raw or borrowed pointer type
     *
     * @return true for references and raw pointers
     */
    public boolean isPointer() {
        return kind == Kind.REFERENCE || kind == Kind.RAW_POINTER;
    }

    public boolean isUnit() {
        return kind == Kind.UNIT;
    }

    @Override
    public int hashCode() {
        return name.hashCode() * 31 + kind.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof TypeDescriptor)) {
            return false;
        }
        TypeDescriptor other = (TypeDescriptor) obj;
        return kind == other.kind && name.equals(other.name);
    }

    @Override
    public String toString() {
        return name;
    }
}
