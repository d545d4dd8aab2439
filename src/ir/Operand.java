package ir;

/**
 * Argument of a call
 */
public final class Operand {

    private final OpKind kind;
    private final Place place;
    private final TypeDescriptor type;

    /**
     * Create an operand
     *
     * @param kind one of COPY, MOVE or CONSTANT
     * @param place place read by the operand, null for constants
     * @param type type of the place, or null if unknown
     */
    public Operand(OpKind kind, Place place, TypeDescriptor type) {
        assert kind == OpKind.COPY || kind == OpKind.MOVE || kind == OpKind.CONSTANT;
        this.kind = kind;
        this.place = place;
        this.type = type;
    }

    /**
     * Constant operand
     *
     * @return operand with no place
     */
    public static Operand constant() {
        return new Operand(OpKind.CONSTANT, null, null);
    }

    public OpKind getKind() {
        return kind;
    }

    public Place getPlace() {
        return place;
    }

    public TypeDescriptor getType() {
        return type;
    }

    @Override
    public String toString() {
        if (kind == OpKind.CONSTANT) {
            return "const";
        }
        return kind.name().toLowerCase() + " " + place;
    }
}
