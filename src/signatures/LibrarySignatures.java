package signatures;

import ir.FunctionId;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Summaries for calls to functions without local IR. By default an external call may return any of its pointer
 * arguments; functions known to return fresh values are ignored, and accessor functions whose effect is already
 * captured elsewhere are passed through.
 */
public class LibrarySignatures {

    /**
     * How a call to a function without local IR is modelled
     */
    public enum Policy {
        /**
         * Returns a fresh duplicate of its argument, no flow from arguments to the result
         */
        IGNORE,
        /**
         * Identity, reference or raw-pointer accessor: no dispatch expansion and no synthetic flow
         */
        PASS_THROUGH,
        /**
         * Every qualifying argument may flow to the result
         */
        ARGS_TO_RETURN;
    }

    /**
     * Functions that duplicate their receiver
     */
    public static final Set<String> DEFAULT_IGNORED = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(
                                    "core.clone.Clone.clone",
                                    "core.clone.Clone.clone_from",
                                    "alloc.borrow.ToOwned.to_owned",
                                    "alloc.string.ToString.to_string",
                                    "core.default.Default.default")));

    /**
     * Accessors that hand out a reference or pointer to their argument
     */
    public static final Set<String> DEFAULT_PASS_THROUGH = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(
                                    "core.convert.identity",
                                    "core.convert.AsRef.as_ref",
                                    "core.convert.AsMut.as_mut",
                                    "core.borrow.Borrow.borrow",
                                    "core.borrow.BorrowMut.borrow_mut",
                                    "core.ops.deref.Deref.deref",
                                    "core.ops.deref.DerefMut.deref_mut",
                                    "as_ptr",
                                    "as_mut_ptr")));

    private final Set<String> ignored;
    private final Set<String> passThrough;
    /**
     * Memoized classification of each callee
     */
    private final Map<FunctionId, Policy> policies = new HashMap<>();

    /**
     * Signatures with the default lists
     */
    public LibrarySignatures() {
        this(DEFAULT_IGNORED, DEFAULT_PASS_THROUGH);
    }

    /**
     * Signatures with the given lists. Entries are dotted path suffixes (<code>::</code> is accepted as well), matched
     * on whole path segments.
     *
     * @param ignored functions that return fresh duplicates
     * @param passThrough identity and accessor functions
     */
    public LibrarySignatures(Collection<String> ignored, Collection<String> passThrough) {
        this.ignored = new LinkedHashSet<>(ignored);
        this.passThrough = new LinkedHashSet<>(passThrough);
    }

    /**
     * Decide how a call to a function without local IR is modelled
     *
     * @param callee function being called
     * @return the policy for calls to <code>callee</code>
     */
    public Policy getPolicy(FunctionId callee) {
        Policy p = policies.get(callee);
        if (p == null) {
            p = computePolicy(callee);
            policies.put(callee, p);
        }
        return p;
    }

    private Policy computePolicy(FunctionId callee) {
        for (String s : ignored) {
            if (callee.matchesSuffix(s)) {
                return Policy.IGNORE;
            }
        }
        for (String s : passThrough) {
            if (callee.matchesSuffix(s)) {
                return Policy.PASS_THROUGH;
            }
        }
        return Policy.ARGS_TO_RETURN;
    }
}
