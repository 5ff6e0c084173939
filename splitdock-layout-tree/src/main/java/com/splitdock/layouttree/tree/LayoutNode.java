package com.splitdock.layouttree.tree;

import com.splitdock.layouttree.document.NodeDocument;

import java.util.Objects;

/**
 * Node in the layout tree: either a {@link PanelNode} (leaf) or a {@link SplitNode} (binary container).
 * The id is fixed at creation. The parent reference is non-owning and is maintained only by
 * {@link SplitNode} when a child is attached or detached; the root and detached nodes have no parent.
 */
public abstract class LayoutNode {

    private final String id;
    private double minSize = LayoutBounds.DEFAULT_MIN_SIZE;
    private SplitNode parent;

    LayoutNode(String id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    public String getId() {
        return id;
    }

    /** Structural type; never {@link NodeType#UNKNOWN}. */
    public abstract NodeType getType();

    /** Recursively builds the persisted form of this node. */
    public abstract NodeDocument toDocument();

    public double getMinSize() {
        return minSize;
    }

    /** Sets the minimum size, clamped to [{@value LayoutBounds#MIN_SIZE}, {@value LayoutBounds#MAX_SIZE}]. */
    public void setMinSize(double size) {
        this.minSize = LayoutBounds.clampMinSize(size);
    }

    /** Split this node is attached to, or null for the root and for detached nodes. */
    public SplitNode getParent() {
        return parent;
    }

    void setParent(SplitNode parent) {
        this.parent = parent;
    }

    public boolean isPanel() {
        return getType() == NodeType.PANEL;
    }

    public boolean isSplit() {
        return getType() == NodeType.SPLIT;
    }

    /**
     * Finds a node by id in the subtree (DFS, first before second). Returns null if not found.
     */
    public static LayoutNode findNodeById(LayoutNode root, String nodeId) {
        if (root == null || nodeId == null || nodeId.isBlank()) return null;
        if (nodeId.equals(root.id)) return root;
        if (root instanceof SplitNode split) {
            LayoutNode found = findNodeById(split.getFirst(), nodeId);
            if (found != null) return found;
            return findNodeById(split.getSecond(), nodeId);
        }
        return null;
    }

    /**
     * Descends preferring the second child, falling back to the first, until a panel is reached.
     * Returns null for an empty subtree.
     */
    public static PanelNode findRightmostPanel(LayoutNode node) {
        if (node == null) return null;
        if (node instanceof PanelNode panel) return panel;
        SplitNode split = (SplitNode) node;
        if (split.getSecond() != null) return findRightmostPanel(split.getSecond());
        return findRightmostPanel(split.getFirst());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id + "]";
    }
}
