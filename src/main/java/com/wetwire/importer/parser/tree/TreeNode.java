package com.wetwire.importer.parser.tree;

import lombok.Getter;

/**
 * Syntax-neutral document node produced by the decoders.
 *
 * The tag is the node's local tag ({@code !Ref}, {@code !Sub}, ...) or null.
 */
@Getter
public abstract class TreeNode {

    private final String tag;

    protected TreeNode(String tag) {
        this.tag = tag;
    }

    public boolean isTagged() {
        return tag != null;
    }
}
