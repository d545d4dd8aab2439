package analysis.check;

import analysis.pointer.graph.ContextualSite;

/**
 * Raw use-after-free finding: an object dropped at one site and later dereferenced through a node
 */
public final class UafInfo {

    /**
     * Node whose points-to set contains the dropped object
     */
    private final int derefNode;
    private final ContextualSite derefSite;
    /**
     * Abstract object, i.e. the node it is dropped at
     */
    private final int dropObject;
    private final ContextualSite dropSite;

    /**
     * Create a raw finding
     *
     * @param derefNode node dereferenced by the edge
     * @param derefSite effect that dereferences
     * @param dropObject dropped abstract object
     * @param dropSite where the object is dropped
     */
    public UafInfo(int derefNode, ContextualSite derefSite, int dropObject, ContextualSite dropSite) {
        this.derefNode = derefNode;
        this.derefSite = derefSite;
        this.dropObject = dropObject;
        this.dropSite = dropSite;
    }

    public int getDerefNode() {
        return derefNode;
    }

    public ContextualSite getDerefSite() {
        return derefSite;
    }

    public int getDropObject() {
        return dropObject;
    }

    public ContextualSite getDropSite() {
        return dropSite;
    }

    @Override
    public String toString() {
        return "UAF: object " + dropObject + " dropped at " + dropSite + ", used through " + derefNode + " at "
                                        + derefSite;
    }
}
