package com.wetwire.importer.parser.tree;

import java.util.List;

import lombok.Getter;

@Getter
public class TreeSequence extends TreeNode {

    private final List<TreeNode> items;

    public TreeSequence(List<TreeNode> items) {
        this(items, null);
    }

    public TreeSequence(List<TreeNode> items, String tag) {
        super(tag);
        this.items = List.copyOf(items);
    }

    @Override
    public String toString() {
        return (isTagged() ? getTag() + " " : "") + items;
    }
}
