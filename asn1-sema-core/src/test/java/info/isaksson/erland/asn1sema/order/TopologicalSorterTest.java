package info.isaksson.erland.asn1sema.order;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class TopologicalSorterTest {

    private static List<String> names(List<Def> defs) {
        return defs.stream().map(d -> d.name).collect(Collectors.toList());
    }

    /** Every referenced definition from the input appears before its referrer. */
    private static void assertDependenciesFirst(List<Def> sorted) {
        List<String> order = names(sorted);
        for (int i = 0; i < sorted.size(); i++) {
            Def d = sorted.get(i);
            for (String ref : d.refs) {
                if (ref.equals(d.name) || !order.contains(ref)) continue;
                assertTrue(order.indexOf(ref) < i, ref + " must precede " + d.name + " in " + order);
            }
        }
    }

    @Test
    void dependenciesComeFirst() {
        List<Def> input = List.of(
                new Def("Message", "Header", "Body"),
                new Def("Header", "Version"),
                new Def("Body"),
                new Def("Version"));

        List<Def> sorted = TopologicalSorter.sort(input);

        assertEquals(4, sorted.size());
        assertEquals(Set.copyOf(input), Set.copyOf(sorted));
        assertDependenciesFirst(sorted);
        assertEquals("Message", sorted.get(3).name);
    }

    @Test
    void selfReferencesAreTolerated() {
        List<Def> sorted = TopologicalSorter.sort(List.of(
                new Def("Tree", "Tree", "Leaf"),
                new Def("Leaf")));

        assertEquals(List.of("Leaf", "Tree"), names(sorted));
    }

    @Test
    void externalReferencesAreIgnored() {
        List<Def> sorted = TopologicalSorter.sort(List.of(
                new Def("oid", "iso", "member-body"),
                new Def("Local", "Imported.Thing")));

        assertEquals(2, sorted.size());
    }

    @Test
    void twoCycleIsRejected() {
        CyclicReferenceException ex = assertThrows(CyclicReferenceException.class,
                () -> TopologicalSorter.sort(List.of(new Def("B", "A"), new Def("A", "B"))));

        assertEquals(List.of("A", "B"), ex.residualNames());
        assertTrue(ex.getMessage().startsWith("Can't sort cyclic references: "));
    }

    @Test
    void residualKeepsCycleAndWhatItDependsOn() {
        CyclicReferenceException ex = assertThrows(CyclicReferenceException.class,
                () -> TopologicalSorter.sort(List.of(
                        new Def("Root", "A"),
                        new Def("A", "B"),
                        new Def("B", "A", "Leaf"),
                        new Def("Leaf"))));

        // Root is ordered before the cycle blocks; Leaf is only reachable through it.
        assertEquals(List.of("A", "B", "Leaf"), ex.residualNames());
        assertEquals(Set.of("A", "Leaf"), ex.residualGraph().get("B"));
    }

    @Test
    void sortNamesWorksOnPlainGraphs() {
        Map<String, Set<String>> graph = Map.of(
                "c", Set.of("b"),
                "b", Set.of("a"),
                "a", Set.of());

        assertEquals(List.of("a", "b", "c"), TopologicalSorter.sortNames(graph));
    }

    @Test
    void sameInputGivesSameOrder() {
        List<Def> input = List.of(
                new Def("A"), new Def("B"), new Def("C", "A"), new Def("D", "B"), new Def("E"));

        assertEquals(names(TopologicalSorter.sort(input)), names(TopologicalSorter.sort(input)));
    }

    @Test
    void randomAcyclicGraphs_alwaysSortDependenciesFirst() {
        Random random = new Random(20240612L);
        for (int round = 0; round < 200; round++) {
            int size = 1 + random.nextInt(25);
            List<Def> input = new ArrayList<>();
            for (int i = 0; i < size; i++) {
                List<String> refs = new ArrayList<>();
                // Only lower-numbered names, so no cycles; self and external references are tolerated.
                for (int r = random.nextInt(4); r > 0 && i > 0; r--) {
                    refs.add("N" + random.nextInt(i));
                }
                if (random.nextInt(10) == 0) refs.add("N" + i);
                if (random.nextInt(10) == 0) refs.add("Imported" + i);
                input.add(new Def("N" + i, refs.toArray(new String[0])));
            }
            Collections.shuffle(input, random);

            List<Def> sorted = TopologicalSorter.sort(input);

            assertEquals(size, sorted.size());
            assertEquals(Set.copyOf(input), Set.copyOf(sorted));
            assertDependenciesFirst(sorted);
        }
    }

    @Test
    void emptyInput() {
        assertTrue(TopologicalSorter.sort(List.<Def>of()).isEmpty());
    }
}
