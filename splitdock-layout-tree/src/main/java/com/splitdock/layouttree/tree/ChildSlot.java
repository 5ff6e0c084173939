package com.splitdock.layouttree.tree;

/** One of the two child positions of a {@link SplitNode}. */
public enum ChildSlot {
    FIRST,
    SECOND;

    public ChildSlot other() {
        return this == FIRST ? SECOND : FIRST;
    }
}
