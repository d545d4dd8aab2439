package ir;

/**
 * Identifier of a function in the analyzed program, its fully-qualified name (e.g. <code>demo::buf::Buffer::new</code>)
 */
public final class FunctionId implements Comparable<FunctionId> {

    /**
     * Fully-qualified name as emitted by the front end
     */
    private final String name;

    /**
     * Create an identifier from the fully-qualified name of a function
     *
     * @param name fully-qualified name
     */
    public FunctionId(String name) {
        assert name != null;
        this.name = name;
    }

    /**
     * Get the fully-qualified name of the function
     *
     * @return name with the front end's separators
     */
    public String getName() {
        return name;
    }

    /**
     * Name of the function with path separators normalized to dots (e.g. <code>demo.buf.Buffer.new</code>), used for
     * suffix matching against entry points and library signatures
     *
     * @return dotted name
     */
    public String getDottedName() {
        return name.replace("::", ".");
    }

    /**
     * Last segment of the fully-qualified name
     *
     * @return simple name of the function
     */
    public String getSimpleName() {
        String dotted = getDottedName();
        int i = dotted.lastIndexOf('.');
        return i < 0 ? dotted : dotted.substring(i + 1);
    }

    /**
     * Check whether the dotted form of this name equals <code>suffix</code> or ends with "." followed by it
     *
     * @param suffix dotted path suffix
     * @return true if the suffix matches whole path segments of this name
     */
    public boolean matchesSuffix(String suffix) {
        String dotted = getDottedName();
        String s = suffix.replace("::", ".");
        return dotted.equals(s) || dotted.endsWith("." + s);
    }

    @Override
    public int compareTo(FunctionId o) {
        return name.compareTo(o.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof FunctionId)) {
            return false;
        }
        return name.equals(((FunctionId) obj).name);
    }

    @Override
    public String toString() {
        return name;
    }
}
