package com.splitdock.engine;

/** Kinds of change notifications the docking manager emits after a mutation completes. */
public enum LayoutChangeType {
    ROOT_CHANGED,
    PANEL_COUNT_CHANGED,
    /** Carries the added panel id. */
    PANEL_ADDED,
    /** Carries the removed panel id. */
    PANEL_REMOVED,
    LAYOUT_CHANGED,
    MIN_PANEL_SIZE_CHANGED,
    DEV_MODE_CHANGED
}
