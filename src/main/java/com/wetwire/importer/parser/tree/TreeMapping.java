package com.wetwire.importer.parser.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Getter;

/**
 * Mapping node with string keys in document order.
 */
@Getter
public class TreeMapping extends TreeNode {

    private final Map<String, TreeNode> entries;

    public TreeMapping(Map<String, TreeNode> entries) {
        this(entries, null);
    }

    public TreeMapping(Map<String, TreeNode> entries, String tag) {
        super(tag);
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public TreeNode get(String key) {
        return entries.get(key);
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    @Override
    public String toString() {
        return (isTagged() ? getTag() + " " : "") + entries;
    }
}
