package com.wetwire.importer.analysis;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Strict cycle detection over a dependency map (Tarjan's strongly connected components).
 *
 * Optional pass: the sorter itself never rejects cycles.
 */
public class CycleDetector {

    private final Map<String, ? extends Set<String>> dependencies;
    private final Set<String> nodes;

    private final Map<String, Integer> index = new HashMap<>();
    private final Map<String, Integer> lowLink = new HashMap<>();
    private final Deque<String> stack = new ArrayDeque<>();
    private final Set<String> onStack = new HashSet<>();
    private final List<List<String>> components = new ArrayList<>();
    private int counter;

    private CycleDetector(Collection<String> ids, Map<String, ? extends Set<String>> dependencies) {
        this.nodes = new TreeSet<>(ids);
        this.dependencies = dependencies;
    }

    /**
     * Returns every group of two or more ids that depend on each other,
     * each group sorted, groups ordered by their first member.
     */
    public static List<List<String>> findCycles(Collection<String> ids, Map<String, ? extends Set<String>> dependencies) {
        CycleDetector detector = new CycleDetector(ids, dependencies);
        for (String node : detector.nodes) {
            if (!detector.index.containsKey(node)) {
                detector.strongConnect(node);
            }
        }
        List<List<String>> cycles = new ArrayList<>();
        for (List<String> component : detector.components) {
            if (component.size() > 1) {
                List<String> sorted = new ArrayList<>(component);
                Collections.sort(sorted);
                cycles.add(Collections.unmodifiableList(sorted));
            }
        }
        cycles.sort(Comparator.comparing(cycle -> cycle.get(0)));
        return cycles;
    }

    /**
     * Cycles among the template's resources, as seen by the given graph.
     */
    public static List<List<String>> findCycles(ReferenceGraph graph, Collection<String> ids) {
        return findCycles(ids, graph.getEdges());
    }

    private void strongConnect(String node) {
        index.put(node, counter);
        lowLink.put(node, counter);
        counter++;
        stack.push(node);
        onStack.add(node);

        Set<String> declared = dependencies.get(node);
        for (String dep : declared == null ? Set.<String>of() : declared) {
            if (!nodes.contains(dep)) {
                continue;
            }
            if (!index.containsKey(dep)) {
                strongConnect(dep);
                lowLink.put(node, Math.min(lowLink.get(node), lowLink.get(dep)));
            } else if (onStack.contains(dep)) {
                lowLink.put(node, Math.min(lowLink.get(node), index.get(dep)));
            }
        }

        if (lowLink.get(node).equals(index.get(node))) {
            List<String> component = new ArrayList<>();
            String member;
            do {
                member = stack.pop();
                onStack.remove(member);
                component.add(member);
            } while (!member.equals(node));
            components.add(component);
        }
    }
}
