package com.splitdock.layouttree.tree;

/**
 * Placement of a new panel relative to a target node. Left/Right split side by side ({@link Orientation#VERTICAL}),
 * Top/Bottom stack ({@link Orientation#HORIZONTAL}); Left/Top put the new panel in the first slot.
 */
public enum Direction {
    LEFT(1, Orientation.VERTICAL, true),
    RIGHT(2, Orientation.VERTICAL, false),
    TOP(3, Orientation.HORIZONTAL, true),
    BOTTOM(4, Orientation.HORIZONTAL, false);

    private final int code;
    private final Orientation orientation;
    private final boolean newPanelFirst;

    Direction(int code, Orientation orientation, boolean newPanelFirst) {
        this.code = code;
        this.orientation = orientation;
        this.newPanelFirst = newPanelFirst;
    }

    /** Integer code used by host UIs (1 = left ... 4 = bottom). */
    public int getCode() {
        return code;
    }

    public Orientation orientation() {
        return orientation;
    }

    public boolean newPanelFirst() {
        return newPanelFirst;
    }

    /** Slot the new panel takes in the split created for this direction. */
    public ChildSlot newPanelSlot() {
        return newPanelFirst ? ChildSlot.FIRST : ChildSlot.SECOND;
    }

    /**
     * @throws IllegalArgumentException for codes outside 1..4 (including the drop-zone "center" code 5)
     */
    public static Direction fromCode(int code) {
        for (Direction d : values()) {
            if (d.code == code) return d;
        }
        throw new IllegalArgumentException("Unsupported direction code: " + code);
    }
}
