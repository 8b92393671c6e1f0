package info.isaksson.erland.asn1sema.core;

import info.isaksson.erland.asn1sema.model.Assignment;
import info.isaksson.erland.asn1sema.model.Module;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Result container for programmatic usage. */
public final class Asn1SemaResult {
    /** Modules in parse-forest order. */
    public final List<Module> modules;

    /**
     * Per module name: assignments grouped into components in dependency order. In
     * {@link OrderingMode#TOPOLOGICAL} mode every component has exactly one member.
     */
    public final Map<String, List<List<Assignment>>> orderedComponents;

    /** Components that need forward declarations (cycles and self-references), over all modules. */
    public final int cyclicComponentCount;

    Asn1SemaResult(List<Module> modules,
                   Map<String, List<List<Assignment>>> orderedComponents,
                   int cyclicComponentCount) {
        this.modules = List.copyOf(modules);
        this.orderedComponents = Collections.unmodifiableMap(new LinkedHashMap<>(orderedComponents));
        this.cyclicComponentCount = cyclicComponentCount;
    }

    /** Module by name, or null. */
    public Module module(String name) {
        for (Module m : modules) {
            if (m.name.equals(name)) return m;
        }
        return null;
    }

    /** Flattened dependency order for one module, or an empty list for unknown names. */
    public List<Assignment> orderedAssignments(String moduleName) {
        List<List<Assignment>> components = orderedComponents.get(moduleName);
        if (components == null) return List.of();
        return components.stream().flatMap(List::stream).toList();
    }
}
