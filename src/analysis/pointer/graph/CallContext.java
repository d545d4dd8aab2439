package analysis.pointer.graph;

import com.ibm.wala.ipa.callgraph.Context;
import com.ibm.wala.ipa.callgraph.ContextItem;
import com.ibm.wala.ipa.callgraph.ContextKey;

/**
 * Calling context of a function: the single call site it was most recently called from. The context of a callee
 * replaces the context of its caller, contexts are never chained.
 */
public final class CallContext implements Context {

    /**
     * Key that can be used to get the call site of this context
     */
    public static final ContextKey CALL_SITE = new ContextKey() {
        @Override
        public String toString() {
            return "CALL_SITE_KEY";
        }
    };

    /**
     * Context of an entry function, which has no caller
     */
    private static final CallContext ENTRY = new CallContext(null);

    /**
     * Calling block, null for the entry context
     */
    private final GlobalBasicBlock callSite;

    private CallContext(GlobalBasicBlock callSite) {
        this.callSite = callSite;
    }

    /**
     * Get the context of an analysis entry point
     *
     * @return context with no call site
     */
    public static CallContext entry() {
        return ENTRY;
    }

    /**
     * Get the context for a callee called from the given block
     *
     * @param callSite block containing the call
     * @return new context
     */
    public static CallContext from(GlobalBasicBlock callSite) {
        assert callSite != null;
        return new CallContext(callSite);
    }

    public boolean isEntry() {
        return callSite == null;
    }

    @Override
    public ContextItem get(ContextKey name) {
        if (CALL_SITE.equals(name)) {
            return callSite;
        }
        return null;
    }

    @Override
    public int hashCode() {
        return callSite == null ? 0 : callSite.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof CallContext)) {
            return false;
        }
        CallContext other = (CallContext) obj;
        if (callSite == null) {
            return other.callSite == null;
        }
        return callSite.equals(other.callSite);
    }

    @Override
    public String toString() {
        return callSite == null ? "[]" : "[" + callSite + "]";
    }
}
