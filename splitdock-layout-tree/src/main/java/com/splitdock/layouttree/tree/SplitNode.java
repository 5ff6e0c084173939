package com.splitdock.layouttree.tree;

import com.splitdock.layouttree.document.NodeDocument;

import java.util.Objects;

/**
 * Binary container. Owns its two children; attaching a child sets the child's parent reference and
 * detaching clears it. Outside a mutation in progress both slots are always filled.
 * <p>
 * {@link #setChild} transfers ownership in and returns the detached previous occupant (the caller drops it);
 * {@link #takeChild} transfers ownership out and leaves the slot empty.
 */
public final class SplitNode extends LayoutNode {

    private Orientation orientation;
    private double splitRatio = LayoutBounds.DEFAULT_SPLIT_RATIO;
    private LayoutNode first;
    private LayoutNode second;

    public SplitNode(String id, Orientation orientation) {
        super(id);
        this.orientation = Objects.requireNonNull(orientation, "orientation");
    }

    @Override
    public NodeType getType() {
        return NodeType.SPLIT;
    }

    public Orientation getOrientation() {
        return orientation;
    }

    public void setOrientation(Orientation orientation) {
        this.orientation = Objects.requireNonNull(orientation, "orientation");
    }

    /** Fraction of the space given to the first child. */
    public double getSplitRatio() {
        return splitRatio;
    }

    /** Sets the ratio, clamped to [{@value LayoutBounds#MIN_SPLIT_RATIO}, {@value LayoutBounds#MAX_SPLIT_RATIO}]. */
    public void setSplitRatio(double ratio) {
        this.splitRatio = LayoutBounds.clampSplitRatio(ratio);
    }

    public LayoutNode getFirst() {
        return first;
    }

    public LayoutNode getSecond() {
        return second;
    }

    public LayoutNode getChild(ChildSlot slot) {
        Objects.requireNonNull(slot, "slot");
        return slot == ChildSlot.FIRST ? first : second;
    }

    /** Number of filled slots: 0, 1 or 2. */
    public int childCount() {
        return (first != null ? 1 : 0) + (second != null ? 1 : 0);
    }

    /** Slot holding exactly this node (identity), or null when it is not a direct child. */
    public ChildSlot slotOf(LayoutNode node) {
        if (node == null) return null;
        if (first == node) return ChildSlot.FIRST;
        if (second == node) return ChildSlot.SECOND;
        return null;
    }

    public LayoutNode setFirst(LayoutNode child) {
        return setChild(ChildSlot.FIRST, child);
    }

    public LayoutNode setSecond(LayoutNode child) {
        return setChild(ChildSlot.SECOND, child);
    }

    /**
     * Attaches {@code child} (may be null to empty the slot) and returns the previous occupant, detached.
     *
     * @throws IllegalStateException    if {@code child} is still attached to a split
     * @throws IllegalArgumentException if {@code child} is this split or one of its ancestors
     */
    public LayoutNode setChild(ChildSlot slot, LayoutNode child) {
        Objects.requireNonNull(slot, "slot");
        LayoutNode previous = getChild(slot);
        if (previous == child) return null;
        if (child != null) {
            if (child.getParent() != null) {
                throw new IllegalStateException("Node " + child.getId() + " is already attached to split "
                        + child.getParent().getId() + "; take it out first");
            }
            for (LayoutNode n = this; n != null; n = n.getParent()) {
                if (n == child) {
                    throw new IllegalArgumentException("Attaching " + child.getId() + " under " + getId() + " would create a cycle");
                }
            }
        }
        if (previous != null) previous.setParent(null);
        if (slot == ChildSlot.FIRST) {
            first = child;
        } else {
            second = child;
        }
        if (child != null) child.setParent(this);
        return previous;
    }

    public LayoutNode takeFirst() {
        return takeChild(ChildSlot.FIRST);
    }

    public LayoutNode takeSecond() {
        return takeChild(ChildSlot.SECOND);
    }

    /** Detaches and returns the child in {@code slot} (null if empty); the slot is left empty. */
    public LayoutNode takeChild(ChildSlot slot) {
        return setChild(slot, null);
    }

    @Override
    public NodeDocument toDocument() {
        return NodeDocument.split(
                getId(),
                orientation,
                splitRatio,
                getMinSize(),
                first != null ? first.toDocument() : null,
                second != null ? second.toDocument() : null);
    }
}
