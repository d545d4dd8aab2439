package ir;

/**
 * Source range reported by the front end: file, line range and column range
 */
public final class SourceLocation {

    /**
     * Location used when the front end did not report one
     */
    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0, 0, 0);

    private final String file;
    private final int startLine;
    private final int startColumn;
    private final int endLine;
    private final int endColumn;
    private final int memoizedHashCode;

    /**
     * Create a source location
     *
     * @param file path of the source file
     * @param startLine first line (1-based)
     * @param startColumn first column (1-based)
     * @param endLine last line
     * @param endColumn last column
     */
    public SourceLocation(String file, int startLine, int startColumn, int endLine, int endColumn) {
        this.file = file;
        this.startLine = startLine;
        this.startColumn = startColumn;
        this.endLine = endLine;
        this.endColumn = endColumn;
        this.memoizedHashCode = computeHashCode();
    }

    private int computeHashCode() {
        int h = file.hashCode();
        h = h * 31 + startLine;
        h = h * 31 + startColumn;
        h = h * 31 + endLine;
        h = h * 31 + endColumn;
        return h;
    }

    public String getFile() {
        return file;
    }

    public int getStartLine() {
        return startLine;
    }

    public int getStartColumn() {
        return startColumn;
    }

    public int getEndLine() {
        return endLine;
    }

    public int getEndColumn() {
        return endColumn;
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
        if (!(obj instanceof SourceLocation)) {
            return false;
        }
        SourceLocation other = (SourceLocation) obj;
        return startLine == other.startLine && startColumn == other.startColumn && endLine == other.endLine
                                        && endColumn == other.endColumn && file.equals(other.file);
    }

    @Override
    public String toString() {
        return file + ":" + startLine + ":" + startColumn + ": " + endLine + ":" + endColumn;
    }
}
