package info.isaksson.erland.asn1sema.order;

import info.isaksson.erland.asn1sema.model.Dependent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Cycle-tolerant dependency ordering based on Tarjan's strongly connected components algorithm.
 *
 * <p>The graph's nodes are the definitions themselves; edges lead from a definition to the
 * definitions its references name. References that name nothing in the input are dropped.</p>
 *
 * <p>The result lists components in dependency order: everything a component references outside
 * itself appears in an earlier component. A component with several members is a reference cycle and
 * its internal order carries no meaning. A single-member component is either acyclic or
 * self-referential, see {@link #isSelfReferential(List)}.</p>
 *
 * <p>The same instance passed more than once is one node and appears once in the result, so the
 * flattened components are a permutation of the distinct input definitions. Distinct instances are
 * always kept, even when they compare equal or share a name.</p>
 *
 * <p>Never fails, whatever the shape of the graph.</p>
 */
public final class DependencySorter<T extends Dependent> {

    private static final Logger LOG = LoggerFactory.getLogger(DependencySorter.class);

    private final List<T> nodes;
    private final Map<T, List<T>> graph;
    private final Map<T, Integer> index = new IdentityHashMap<>();
    private final Map<T, Integer> lowlink = new IdentityHashMap<>();
    private final Deque<T> stack = new ArrayDeque<>();
    private final Set<T> onStack = Collections.newSetFromMap(new IdentityHashMap<>());
    private final List<List<T>> components = new ArrayList<>();
    private int nextIndex = 0;

    private DependencySorter(List<T> nodes, Map<T, List<T>> graph) {
        this.nodes = nodes;
        this.graph = graph;
    }

    public static <T extends Dependent> List<List<T>> sort(Collection<? extends T> items) {
        if (items == null) throw new IllegalArgumentException("items must not be null");

        Map<String, T> byName = new HashMap<>();
        for (T item : items) {
            if (item != null) byName.put(item.referenceName(), item);
        }

        // Identity keys: two distinct definitions are distinct nodes even if they compare equal.
        List<T> nodes = new ArrayList<>();
        Map<T, List<T>> graph = new IdentityHashMap<>();
        for (T item : items) {
            if (item == null || graph.containsKey(item)) continue;
            List<T> successors = new ArrayList<>();
            for (String ref : item.references()) {
                T target = byName.get(ref);
                if (target != null) successors.add(target);
            }
            nodes.add(item);
            graph.put(item, successors);
        }

        List<List<T>> result = new DependencySorter<>(nodes, graph).run();
        if (LOG.isDebugEnabled()) {
            long cycles = result.stream().filter(c -> c.size() > 1).count();
            LOG.debug("Dependency sort produced {} components ({} cyclic) from {} definitions",
                    result.size(), cycles, graph.size());
        }
        return result;
    }

    /** True when the component is a single definition that references itself. */
    public static boolean isSelfReferential(List<? extends Dependent> component) {
        if (component == null || component.size() != 1) return false;
        Dependent only = component.get(0);
        return only.references().contains(only.referenceName());
    }

    /** True when the component needs forward declarations: a multi-member cycle or a self-reference. */
    public static boolean isCyclic(List<? extends Dependent> component) {
        if (component == null) return false;
        return component.size() > 1 || isSelfReferential(component);
    }

    private List<List<T>> run() {
        for (T node : nodes) {
            if (!index.containsKey(node)) {
                strongConnect(node);
            }
        }
        return components;
    }

    private void strongConnect(T node) {
        index.put(node, nextIndex);
        lowlink.put(node, nextIndex);
        nextIndex++;
        stack.push(node);
        onStack.add(node);

        for (T successor : successorsOf(node)) {
            if (!index.containsKey(successor)) {
                strongConnect(successor);
                lowlink.put(node, Math.min(lowlink.get(node), lowlink.get(successor)));
            } else if (onStack.contains(successor)) {
                lowlink.put(node, Math.min(lowlink.get(node), index.get(successor)));
            }
        }

        if (lowlink.get(node).equals(index.get(node))) {
            List<T> component = new ArrayList<>();
            T member;
            do {
                member = stack.pop();
                onStack.remove(member);
                component.add(member);
            } while (member != node);
            components.add(Collections.unmodifiableList(component));
        }
    }

    private List<T> successorsOf(T node) {
        List<T> successors = graph.get(node);
        return successors == null ? List.of() : successors;
    }
}
