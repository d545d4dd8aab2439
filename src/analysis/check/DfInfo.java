package analysis.check;

import analysis.pointer.graph.ContextualSite;

/**
 * Raw double-free finding: two drops of aliasing objects, the first of which can reach the second
 */
public final class DfInfo {

    private final int firstDropObject;
    private final ContextualSite firstDropSite;
    private final int thenDropObject;
    private final ContextualSite thenDropSite;

    /**
     * Create a raw finding
     *
     * @param firstDropObject object dropped first
     * @param firstDropSite where it is dropped
     * @param thenDropObject object dropped second
     * @param thenDropSite where it is dropped
     */
    public DfInfo(int firstDropObject, ContextualSite firstDropSite, int thenDropObject, ContextualSite thenDropSite) {
        this.firstDropObject = firstDropObject;
        this.firstDropSite = firstDropSite;
        this.thenDropObject = thenDropObject;
        this.thenDropSite = thenDropSite;
    }

    public int getFirstDropObject() {
        return firstDropObject;
    }

    public ContextualSite getFirstDropSite() {
        return firstDropSite;
    }

    public int getThenDropObject() {
        return thenDropObject;
    }

    public ContextualSite getThenDropSite() {
        return thenDropSite;
    }

    @Override
    public String toString() {
        return "DF: object " + firstDropObject + " dropped at " + firstDropSite + ", then object " + thenDropObject
                                        + " dropped at " + thenDropSite;
    }
}
