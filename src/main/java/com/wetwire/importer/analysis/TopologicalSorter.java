package com.wetwire.importer.analysis;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.wetwire.importer.model.Resource;
import com.wetwire.importer.model.Template;

/**
 * Deterministic dependency ordering that tolerates cycles.
 *
 * Kahn's algorithm with the ready queue re-sorted before every extraction.
 * Nodes that never become ready (cycle members and their dependents) are
 * appended in lexicographic order instead of failing.
 */
public final class TopologicalSorter {

    private static final Logger log = LoggerFactory.getLogger(TopologicalSorter.class);

    private TopologicalSorter() {
        // Utility class
    }

    /**
     * Orders the ids so that each id follows the ids it depends on, where possible.
     * Dependencies outside the id set and self dependencies are ignored.
     */
    public static List<String> sort(Collection<String> ids, Map<String, ? extends Set<String>> dependencies) {
        Set<String> nodes = new TreeSet<>(ids);
        Map<String, Set<String>> remaining = new HashMap<>();
        for (String node : nodes) {
            Set<String> deps = new TreeSet<>();
            Set<String> declared = dependencies.get(node);
            if (declared != null) {
                for (String dep : declared) {
                    if (nodes.contains(dep) && !dep.equals(node)) {
                        deps.add(dep);
                    }
                }
            }
            remaining.put(node, deps);
        }

        List<String> queue = new ArrayList<>();
        for (String node : nodes) {
            if (remaining.get(node).isEmpty()) {
                queue.add(node);
            }
        }

        List<String> order = new ArrayList<>(nodes.size());
        Set<String> emitted = new LinkedHashSet<>();
        while (!queue.isEmpty()) {
            Collections.sort(queue);
            String next = queue.remove(0);
            order.add(next);
            emitted.add(next);

            for (String node : nodes) {
                if (emitted.contains(node) || queue.contains(node)) {
                    continue;
                }
                Set<String> deps = remaining.get(node);
                if (deps.remove(next) && deps.isEmpty()) {
                    queue.add(node);
                }
            }
        }

        if (order.size() < nodes.size()) {
            List<String> leftovers = new ArrayList<>();
            for (String node : nodes) {
                if (!emitted.contains(node)) {
                    leftovers.add(node);
                }
            }
            log.debug("Appending {} unordered node(s) in lexicographic order: {}", leftovers.size(), leftovers);
            order.addAll(leftovers);
        }
        return order;
    }

    /**
     * Orders the template's resources using reference edges between resources
     * plus explicit DependsOn entries naming existing resources.
     */
    public static List<String> resourceOrder(Template template, ReferenceGraph graph) {
        Map<String, Set<String>> dependencies = new LinkedHashMap<>();
        for (Resource resource : template.getResources().values()) {
            Set<String> deps = new TreeSet<>();
            for (String target : graph.dependenciesOf(resource.getLogicalId())) {
                if (template.hasResource(target)) {
                    deps.add(target);
                }
            }
            for (String target : resource.getDependsOn()) {
                if (template.hasResource(target)) {
                    deps.add(target);
                }
            }
            dependencies.put(resource.getLogicalId(), deps);
        }
        return sort(template.getResources().keySet(), dependencies);
    }
}
