package results;

import ir.SourceLocation;

/**
 * Double free: an object may be dropped after an aliasing object was dropped
 */
public final class DfResult extends Finding {

    /**
     * Create a double-free result
     *
     * @param firstDropLocation first drop
     * @param firstDropVarName variable dropped first, or null
     * @param thenDropLocation second drop
     * @param thenDropVarName variable dropped second, or null
     */
    public DfResult(SourceLocation firstDropLocation, String firstDropVarName, SourceLocation thenDropLocation,
                    String thenDropVarName) {
        super(firstDropLocation, firstDropVarName, thenDropLocation, thenDropVarName);
    }

    public SourceLocation getFirstDropLocation() {
        return getFirstLocation();
    }

    public String getFirstDropVarName() {
        return getFirstVarName();
    }

    public SourceLocation getThenDropLocation() {
        return getSecondLocation();
    }

    public String getThenDropVarName() {
        return getSecondVarName();
    }

    @Override
    public String toString() {
        return "DF first " + getFirstDropLocation() + " (" + getFirstDropVarName() + "), then "
                                        + getThenDropLocation() + " (" + getThenDropVarName() + ")";
    }
}
