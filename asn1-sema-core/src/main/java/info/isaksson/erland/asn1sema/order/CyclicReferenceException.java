package info.isaksson.erland.asn1sema.order;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link TopologicalSorter} found definitions that could not be ordered because they take part in,
 * or depend on, a reference cycle. Use {@link DependencySorter} when cycles are expected.
 */
public class CyclicReferenceException extends IllegalArgumentException {

    private final Map<String, Set<String>> residualGraph;

    public CyclicReferenceException(Map<String, Set<String>> residualGraph) {
        super("Can't sort cyclic references: " + residualGraph);
        this.residualGraph = Collections.unmodifiableMap(new LinkedHashMap<>(residualGraph));
    }

    /** Names left unordered, sorted alphabetically. */
    public List<String> residualNames() {
        List<String> names = new ArrayList<>(residualGraph.keySet());
        Collections.sort(names);
        return names;
    }

    /** What remained of the graph when no further definition could be ordered. */
    public Map<String, Set<String>> residualGraph() {
        return residualGraph;
    }
}
