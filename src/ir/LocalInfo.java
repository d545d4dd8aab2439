package ir;

/**
 * Entry of a function's local slot table
 */
public final class LocalInfo {

    private final int index;
    private final TypeDescriptor type;
    private final boolean needsDrop;
    /**
     * Name in the source code, null for temporaries
     */
    private final String name;

    /**
     * Create a local slot description
     *
     * @param index index of the local, 0 is the return slot
     * @param type declared type
     * @param needsDrop whether values of this local run a destructor
     * @param name source name or null
     */
    public LocalInfo(int index, TypeDescriptor type, boolean needsDrop, String name) {
        this.index = index;
        this.type = type;
        this.needsDrop = needsDrop;
        this.name = name;
    }

    public int getIndex() {
        return index;
    }

    public TypeDescriptor getType() {
        return type;
    }

    public boolean needsDrop() {
        return needsDrop;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "_" + index + (name == null ? "" : " (" + name + ")") + ": " + type;
    }
}
