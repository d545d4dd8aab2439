package results;

import ir.SourceLocation;

/**
 * Use after free: a value is dereferenced after the object it points to may have been dropped
 */
public final class UafResult extends Finding {

    /**
     * Create a use-after-free result
     *
     * @param derefLocation where the dereference happens
     * @param derefVarName variable dereferenced, or null
     * @param dropLocation where the object is dropped
     * @param dropVarName variable dropped, or null
     */
    public UafResult(SourceLocation derefLocation, String derefVarName, SourceLocation dropLocation,
                     String dropVarName) {
        super(derefLocation, derefVarName, dropLocation, dropVarName);
    }

    public SourceLocation getDerefLocation() {
        return getFirstLocation();
    }

    public String getDerefVarName() {
        return getFirstVarName();
    }

    public SourceLocation getDropLocation() {
        return getSecondLocation();
    }

    public String getDropVarName() {
        return getSecondVarName();
    }

    @Override
    public String toString() {
        return "UAF drop " + getDropLocation() + " (" + getDropVarName() + "), deref " + getDerefLocation() + " ("
                                        + getDerefVarName() + ")";
    }
}
