package FAKit.Model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;

/**
 * Names given to the subsets discovered by subset construction, in naming order.
 */
public final class ConversionReport {
    private final Map<SortedSet<String>, String> subsetNames;

    public ConversionReport(Map<SortedSet<String>, String> subsetNames) {
        this.subsetNames = Collections.unmodifiableMap(new LinkedHashMap<>(subsetNames));
    }

    public Map<SortedSet<String>, String> getSubsetNames() {
        return subsetNames;
    }

    public String getName(SortedSet<String> subset) {
        return subsetNames.get(subset);
    }

    /**
     * The DFA state standing for the empty subset, if the construction reached it.
     */
    public Optional<String> getTrapState() {
        for (Map.Entry<SortedSet<String>, String> e : subsetNames.entrySet()) {
            if (e.getKey().isEmpty()) {
                return Optional.of(e.getValue());
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<SortedSet<String>, String> e : subsetNames.entrySet()) {
            sb.append(e.getValue()).append(" = {").append(String.join(", ", e.getKey())).append("}\n");
        }
        return sb.toString();
    }
}
