package ir;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Function table of the analyzed program. Bodies are materialized from the {@link IRProvider} on first use.
 */
public final class Program {

    private final IRProvider provider;
    private final Map<FunctionId, FunctionBody> bodies = new HashMap<>();

    /**
     * Create a function table backed by the given provider
     *
     * @param provider source of function bodies
     */
    public Program(IRProvider provider) {
        this.provider = provider;
    }

    /**
     * Functions that have local IR
     *
     * @return function identifiers
     */
    public Set<FunctionId> getFunctionIds() {
        return provider.getFunctionIds();
    }

    /**
     * Is there local IR for the given function
     *
     * @param id function identifier
     * @return true if {@link #getBody(FunctionId)} returns non-null
     */
    public boolean hasBody(FunctionId id) {
        return provider.getFunctionIds().contains(id);
    }

    /**
     * Get the body of a function, loading it if needed
     *
     * @param id function identifier
     * @return body, or null if the function is external
     */
    public FunctionBody getBody(FunctionId id) {
        FunctionBody body = bodies.get(id);
        if (body == null && hasBody(id)) {
            body = provider.loadBody(id);
            bodies.put(id, body);
        }
        return body;
    }

    /**
     * Get the body of a function that must have been registered locally
     *
     * @param id function identifier
     * @return body
     * @throws IllegalStateException if there is no local IR for the function
     */
    public FunctionBody requireBody(FunctionId id) {
        FunctionBody body = getBody(id);
        if (body == null) {
            throw new IllegalStateException("Function " + id + " is not in the function table");
        }
        return body;
    }
}
