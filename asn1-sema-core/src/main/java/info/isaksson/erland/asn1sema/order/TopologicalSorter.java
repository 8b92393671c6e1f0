package info.isaksson.erland.asn1sema.order;

import info.isaksson.erland.asn1sema.model.Dependent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dependency-first topological sort for definitions without reference cycles.
 *
 * <p>Kahn-style, working from the dependents' side: a name becomes a root once nothing left in the
 * graph refers to it. Each root taken is removed from the graph and prepended to the order, so a
 * definition always ends up after everything it references.</p>
 *
 * <ul>
 *   <li>Direct self-references are ignored.</li>
 *   <li>References to names outside the input (imports, registered OID arcs) are ignored.</li>
 *   <li>Anything else left over means a cycle and raises {@link CyclicReferenceException}.</li>
 * </ul>
 *
 * <p>Among several roots the most recently discovered one is taken first. The result is
 * deterministic for a given input order but no particular tie-break is promised.</p>
 */
public final class TopologicalSorter {

    private static final Logger LOG = LoggerFactory.getLogger(TopologicalSorter.class);

    private TopologicalSorter() {}

    /**
     * @return the input reordered so that every referenced definition precedes its dependents
     * @throws CyclicReferenceException if the reference graph contains a cycle
     */
    public static <T extends Dependent> List<T> sort(Collection<? extends T> items) {
        Map<String, Set<String>> graph = DependencyGraph.of(items);
        List<String> order = sortNames(graph);

        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < order.size(); i++) {
            position.put(order.get(i), i);
        }
        List<T> sorted = new ArrayList<>(items);
        sorted.removeIf(t -> t == null);
        sorted.sort(Comparator.comparingInt(t -> position.get(t.referenceName())));
        return sorted;
    }

    /** Order the names of a dependency graph, dependencies first. */
    public static List<String> sortNames(Map<String, Set<String>> graph) {
        if (graph == null) throw new IllegalArgumentException("graph must not be null");

        // Number of remaining definitions that refer to each name (self-references excluded).
        Map<String, Integer> referrers = new HashMap<>();
        for (Map.Entry<String, Set<String>> e : graph.entrySet()) {
            for (String ref : e.getValue()) {
                if (!ref.equals(e.getKey())) referrers.merge(ref, 1, Integer::sum);
            }
        }

        Deque<String> roots = new ArrayDeque<>();
        for (String name : graph.keySet()) {
            if (referrers.getOrDefault(name, 0) == 0) roots.addLast(name);
        }

        Map<String, Set<String>> remaining = new LinkedHashMap<>(graph);
        Deque<String> order = new ArrayDeque<>(graph.size());
        while (!roots.isEmpty()) {
            String root = roots.pollLast();
            Set<String> successors = remaining.remove(root);
            for (String successor : successors) {
                if (successor.equals(root)) continue;
                int left = referrers.merge(successor, -1, Integer::sum);
                if (left == 0 && remaining.containsKey(successor)) {
                    roots.addLast(successor);
                }
            }
            order.addFirst(root);
        }

        if (!remaining.isEmpty()) {
            LOG.warn("Cyclic references among {} of {} definitions: {}",
                    remaining.size(), graph.size(), remaining.keySet());
            throw new CyclicReferenceException(remaining);
        }
        LOG.debug("Topologically sorted {} definitions", order.size());
        return new ArrayList<>(order);
    }
}
