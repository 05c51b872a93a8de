package com.wetwire.importer.parser.tree;

import lombok.Getter;

/**
 * Scalar node holding null, String, Long, Double, Boolean or BigInteger.
 */
@Getter
public class TreeScalar extends TreeNode {

    private final Object value;

    public TreeScalar(Object value) {
        this(value, null);
    }

    public TreeScalar(Object value, String tag) {
        super(tag);
        this.value = value;
    }

    /**
     * Text form of the value, or null for a null scalar.
     */
    public String text() {
        return value == null ? null : value.toString();
    }

    @Override
    public String toString() {
        return (isTagged() ? getTag() + " " : "") + value;
    }
}
