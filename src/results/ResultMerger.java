package results;

import ir.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.ibm.wala.util.collections.Pair;

/**
 * Deduplicates findings by their pair of locations, whatever object or context produced them. A finding with a
 * variable name replaces a lone finding without one, distinct named findings for the same locations are all kept,
 * and a nameless finding for locations that are already reported is dropped.
 *
 * @param <T> type of finding
 */
public class ResultMerger<T extends Finding> {

    private final Map<Pair<SourceLocation, SourceLocation>, Set<T>> results = new LinkedHashMap<>();

    /**
     * Merge in a finding
     *
     * @param r finding to add
     */
    public void add(T r) {
        Pair<SourceLocation, SourceLocation> key = r.getKey();
        Set<T> existing = results.get(key);
        if (existing == null) {
            existing = new LinkedHashSet<>();
            existing.add(r);
            results.put(key, existing);
            return;
        }
        if (!r.hasVarName()) {
            return;
        }
        if (existing.size() == 1 && !existing.iterator().next().hasVarName()) {
            existing.clear();
        }
        existing.add(r);
    }

    /**
     * Merge in several findings
     *
     * @param rs findings in the order they should be considered
     */
    public void addAll(Iterable<? extends T> rs) {
        for (T r : rs) {
            add(r);
        }
    }

    /**
     * Merged findings grouped by location pair
     *
     * @return read-only map from location pair to findings
     */
    public Map<Pair<SourceLocation, SourceLocation>, Set<T>> getGrouped() {
        return Collections.unmodifiableMap(results);
    }

    /**
     * All merged findings
     *
     * @return findings in the order their location pairs were first seen
     */
    public List<T> getResults() {
        List<T> l = new ArrayList<>();
        for (Set<T> s : results.values()) {
            l.addAll(s);
        }
        return l;
    }
}
