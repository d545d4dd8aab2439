package ir;

/**
 * Assignment effect <code>left = op right</code> inside a basic block
 */
public final class Assignment {

    private final Place left;
    private final OpKind op;
    /**
     * Null iff <code>op</code> is {@link OpKind#CONSTANT}
     */
    private final Place right;
    /**
     * Type of the right-hand place if the front end reported it, null otherwise
     */
    private final TypeDescriptor rightType;
    private final SourceLocation location;

    /**
     * Create an assignment effect
     *
     * @param left assigned place
     * @param op kind of the right-hand side
     * @param right right-hand place, null for constants
     * @param rightType type of the right-hand place, or null if unknown
     * @param location source location of the statement
     */
    public Assignment(Place left, OpKind op, Place right, TypeDescriptor rightType, SourceLocation location) {
        assert (op == OpKind.CONSTANT) == (right == null) : "Constant assignments have no right-hand place";
        this.left = left;
        this.op = op;
        this.right = right;
        this.rightType = rightType;
        this.location = location;
    }

    public Place getLeft() {
        return left;
    }

    public OpKind getOp() {
        return op;
    }

    public Place getRight() {
        return right;
    }

    public TypeDescriptor getRightType() {
        return rightType;
    }

    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public String toString() {
        if (op == OpKind.CONSTANT) {
            return left + " = const";
        }
        return left + " = " + op.name().toLowerCase() + " " + right;
    }
}
