package results;

import ir.SourceLocation;

import com.ibm.wala.util.collections.Pair;

/**
 * Reported memory bug: two source locations, each with the name of the variable involved when it is known
 */
public abstract class Finding {

    private final SourceLocation firstLocation;
    private final String firstVarName;
    private final SourceLocation secondLocation;
    private final String secondVarName;
    private final int memoizedHashCode;

    /**
     * Create a finding
     *
     * @param firstLocation first location
     * @param firstVarName variable at the first location, or null
     * @param secondLocation second location
     * @param secondVarName variable at the second location, or null
     */
    protected Finding(SourceLocation firstLocation, String firstVarName, SourceLocation secondLocation,
                      String secondVarName) {
        this.firstLocation = firstLocation;
        this.firstVarName = firstVarName;
        this.secondLocation = secondLocation;
        this.secondVarName = secondVarName;
        this.memoizedHashCode = computeHashCode();
    }

    private int computeHashCode() {
        int h = getClass().hashCode();
        h = h * 31 + firstLocation.hashCode();
        h = h * 31 + (firstVarName == null ? 0 : firstVarName.hashCode());
        h = h * 31 + secondLocation.hashCode();
        h = h * 31 + (secondVarName == null ? 0 : secondVarName.hashCode());
        return h;
    }

    /**
     * Findings with the same key describe the same pair of program locations
     *
     * @return pair of the two locations
     */
    public Pair<SourceLocation, SourceLocation> getKey() {
        return Pair.make(firstLocation, secondLocation);
    }

    /**
     * Is either variable name known
     *
     * @return true if at least one location has a variable name
     */
    public boolean hasVarName() {
        return firstVarName != null || secondVarName != null;
    }

    protected SourceLocation getFirstLocation() {
        return firstLocation;
    }

    protected String getFirstVarName() {
        return firstVarName;
    }

    protected SourceLocation getSecondLocation() {
        return secondLocation;
    }

    protected String getSecondVarName() {
        return secondVarName;
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
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        Finding other = (Finding) obj;
        return firstLocation.equals(other.firstLocation) && secondLocation.equals(other.secondLocation)
                                        && equal(firstVarName, other.firstVarName)
                                        && equal(secondVarName, other.secondVarName);
    }

    private static boolean equal(String s1, String s2) {
        return s1 == null ? s2 == null : s1.equals(s2);
    }
}
