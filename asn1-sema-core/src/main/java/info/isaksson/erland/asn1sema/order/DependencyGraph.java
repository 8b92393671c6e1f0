package info.isaksson.erland.asn1sema.order;

import info.isaksson.erland.asn1sema.model.Dependent;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Name-based dependency graph: reference name -> names it depends on.
 */
public final class DependencyGraph {

    private DependencyGraph() {}

    /**
     * Build the graph for the given definitions, keyed in input order. When two definitions share a
     * reference name the later one replaces the earlier one.
     */
    public static Map<String, Set<String>> of(Collection<? extends Dependent> items) {
        if (items == null) throw new IllegalArgumentException("items must not be null");
        Map<String, Set<String>> graph = new LinkedHashMap<>();
        for (Dependent d : items) {
            if (d == null) continue;
            graph.put(d.referenceName(), Collections.unmodifiableSet(new LinkedHashSet<>(d.references())));
        }
        return graph;
    }
}
