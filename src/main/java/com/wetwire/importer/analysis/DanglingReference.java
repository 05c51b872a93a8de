package com.wetwire.importer.analysis;

/**
 * A reference from a declared entity to an id nothing declares.
 */
public record DanglingReference(String source, String target) implements Comparable<DanglingReference> {

    @Override
    public int compareTo(DanglingReference other) {
        int bySource = source.compareTo(other.source);
        return bySource != 0 ? bySource : target.compareTo(other.target);
    }

    @Override
    public String toString() {
        return source + " -> " + target;
    }
}
