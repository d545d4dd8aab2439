package ir;

/**
 * Classification of the right-hand side of an assignment or of a call argument
 */
public enum OpKind {
    /**
     * Bitwise copy of the right-hand value
     */
    COPY,
    /**
     * Ownership of the right-hand value moves to the left-hand place
     */
    MOVE,
    /**
     * Borrow of the right-hand place
     */
    REF,
    /**
     * Raw address of the right-hand place
     */
    ADDRESS_OF,
    /**
     * Constant value, never carries a pointer
     */
    CONSTANT;

    /**
     * Parse the front end's name for an op
     *
     * @param s name, e.g. "address_of"
     * @return the op, or null if the name is not a classified op
     */
    public static OpKind fromString(String s) {
        switch (s) {
        case "copy":
            return COPY;
        case "move":
            return MOVE;
        case "ref":
            return REF;
        case "address_of":
            return ADDRESS_OF;
        case "constant":
            return CONSTANT;
        default:
            return null;
        }
    }
}
