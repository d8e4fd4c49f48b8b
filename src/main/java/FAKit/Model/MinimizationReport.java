package FAKit.Model;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * What minimization removed.
 * <ul>
 *     <li>unreachable: states not reachable from the initial state, dropped before refinement</li>
 *     <li>deleted: original states that no longer exist, unreachable ones included</li>
 *     <li>equivalence classes: each state of the minimal DFA with the original states merged into it</li>
 * </ul>
 */
public final class MinimizationReport {
    private final SortedSet<String> unreachable;
    private final SortedSet<String> deleted;
    private final SortedMap<String, SortedSet<String>> equivalenceClasses;

    public MinimizationReport(SortedSet<String> unreachable,
                              SortedSet<String> deleted,
                              Map<String, SortedSet<String>> equivalenceClasses) {
        this.unreachable = Collections.unmodifiableSortedSet(new TreeSet<>(unreachable));
        this.deleted = Collections.unmodifiableSortedSet(new TreeSet<>(deleted));
        SortedMap<String, SortedSet<String>> classes = new TreeMap<>();
        for (Map.Entry<String, SortedSet<String>> e : equivalenceClasses.entrySet()) {
            classes.put(e.getKey(), Collections.unmodifiableSortedSet(new TreeSet<>(e.getValue())));
        }
        this.equivalenceClasses = Collections.unmodifiableSortedMap(classes);
    }

    public SortedSet<String> getUnreachable() {
        return unreachable;
    }

    public SortedSet<String> getDeleted() {
        return deleted;
    }

    public SortedMap<String, SortedSet<String>> getEquivalenceClasses() {
        return equivalenceClasses;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Unreachable: {").append(String.join(", ", unreachable)).append("}\n");
        sb.append("Deleted: {").append(String.join(", ", deleted)).append("}\n");
        for (Map.Entry<String, SortedSet<String>> e : equivalenceClasses.entrySet()) {
            if (e.getValue().size() > 1) {
                sb.append(e.getKey()).append(" = {").append(String.join(", ", e.getValue())).append("}\n");
            }
        }
        return sb.toString();
    }
}
