package com.wetwire.importer.analysis;

import java.util.Collections;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Entity id to the sorted set of ids it reads.
 *
 * Resource and output edges are kept apart: an output may share a
 * resource's logical id, and only resource edges take part in ordering.
 * Derived from value trees; may hold edges to ids the template never
 * declares, and may contain cycles.
 */
public class ReferenceGraph {

    private final Map<String, SortedSet<String>> edges = new TreeMap<>();
    private final Map<String, SortedSet<String>> outputEdges = new TreeMap<>();

    void addNode(String source) {
        edges.computeIfAbsent(source, k -> new TreeSet<>());
    }

    void addEdge(String source, String target) {
        edges.computeIfAbsent(source, k -> new TreeSet<>()).add(target);
    }

    void addOutputNode(String output) {
        outputEdges.computeIfAbsent(output, k -> new TreeSet<>());
    }

    void addOutputEdge(String output, String target) {
        outputEdges.computeIfAbsent(output, k -> new TreeSet<>()).add(target);
    }

    /**
     * Ids the given resource reads, in lexicographic order.
     */
    public SortedSet<String> dependenciesOf(String source) {
        return view(edges.get(source));
    }

    /**
     * Ids the given output's value reads, in lexicographic order.
     */
    public SortedSet<String> outputDependenciesOf(String output) {
        return view(outputEdges.get(output));
    }

    public boolean hasEdge(String source, String target) {
        return dependenciesOf(source).contains(target);
    }

    /**
     * True if any resource or output reads the given id.
     */
    public boolean isReferenced(String target) {
        return Stream.concat(edges.values().stream(), outputEdges.values().stream())
                .anyMatch(targets -> targets.contains(target));
    }

    /**
     * Resource edges only.
     */
    public Map<String, SortedSet<String>> getEdges() {
        return Collections.unmodifiableMap(edges);
    }

    public Map<String, SortedSet<String>> getOutputEdges() {
        return Collections.unmodifiableMap(outputEdges);
    }

    public int edgeCount() {
        return Stream.concat(edges.values().stream(), outputEdges.values().stream())
                .mapToInt(SortedSet::size)
                .sum();
    }

    private static SortedSet<String> view(SortedSet<String> targets) {
        return targets == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(targets);
    }

    @Override
    public String toString() {
        return "resources=" + edges + ", outputs=" + outputEdges;
    }
}
