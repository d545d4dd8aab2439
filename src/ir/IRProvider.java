package ir;

import java.util.Set;

/**
 * Source of function bodies. Bodies are requested one at a time, as the call graph is discovered.
 */
public interface IRProvider {

    /**
     * Identifiers of all functions this provider has a body for
     *
     * @return function identifiers
     */
    Set<FunctionId> getFunctionIds();

    /**
     * Build the body of a function
     *
     * @param id function to load
     * @return body, or null if this provider has no IR for the function
     */
    FunctionBody loadBody(FunctionId id);
}
