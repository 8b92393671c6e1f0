package info.isaksson.erland.asn1sema.core;

import info.isaksson.erland.asn1sema.build.SemaModelBuilder;
import info.isaksson.erland.asn1sema.model.Assignment;
import info.isaksson.erland.asn1sema.model.Module;
import info.isaksson.erland.asn1sema.order.DependencySorter;
import info.isaksson.erland.asn1sema.order.TopologicalSorter;
import info.isaksson.erland.asn1sema.parsetree.ParseNode;
import info.isaksson.erland.asn1sema.parsetree.ParseTreeJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Core API: parse forest in, semantic modules and their declaration order out.
 *
 * <p>Code generators should use this class instead of re-implementing the build + sort pipeline.</p>
 */
public final class Asn1SemaService {

    private static final Logger LOG = LoggerFactory.getLogger(Asn1SemaService.class);

    /** Build from a parse-forest JSON file. */
    public Asn1SemaResult buildFromJson(Path parseForest, Asn1SemaOptions options) throws IOException {
        if (parseForest == null) throw new IllegalArgumentException("parseForest must not be null");
        LOG.debug("Reading parse forest from {}", parseForest);
        return build(ParseTreeJson.read(parseForest), options);
    }

    /** Build from parse-forest JSON text. */
    public Asn1SemaResult buildFromString(String json, Asn1SemaOptions options) throws IOException {
        if (json == null) throw new IllegalArgumentException("json must not be null");
        return build(ParseTreeJson.readFromString(json), options);
    }

    /**
     * Build and order every module of the forest.
     *
     * @throws IllegalArgumentException if two modules share a name, since results are looked up by name
     */
    public Asn1SemaResult build(List<ParseNode> forest, Asn1SemaOptions options) {
        if (forest == null) throw new IllegalArgumentException("forest must not be null");
        if (options == null) options = new Asn1SemaOptions();

        List<Module> modules = new SemaModelBuilder(options.unnamedMembers).build(forest);

        Map<String, List<List<Assignment>>> ordered = new LinkedHashMap<>();
        int cyclic = 0;
        for (Module m : modules) {
            if (ordered.containsKey(m.name)) {
                throw new IllegalArgumentException("Duplicate module name: " + m.name);
            }
            List<List<Assignment>> components = order(m, options.ordering);
            for (List<Assignment> c : components) {
                if (DependencySorter.isCyclic(c)) cyclic++;
            }
            ordered.put(m.name, components);
        }

        LOG.info("Built {} module(s), {} cyclic component(s)", modules.size(), cyclic);
        return new Asn1SemaResult(modules, ordered, cyclic);
    }

    private static List<List<Assignment>> order(Module module, OrderingMode mode) {
        if (mode == OrderingMode.TOPOLOGICAL) {
            List<List<Assignment>> out = new ArrayList<>();
            for (Assignment a : TopologicalSorter.sort(module.assignments)) {
                out.add(List.of(a));
            }
            return out;
        }
        return DependencySorter.sort(module.assignments);
    }
}
