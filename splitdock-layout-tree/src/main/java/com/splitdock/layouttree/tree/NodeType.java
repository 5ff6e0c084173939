package com.splitdock.layouttree.tree;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Structural type of a layout node. JSON uses the lower-case tag ({@code "panel"}, {@code "split"});
 * the legacy {@code "container"} tag reads as {@link #SPLIT}. Unknown tags deserialize as {@link #UNKNOWN}.
 *
 * @see LayoutNode#getType()
 */
public enum NodeType {
    /** Leaf: one user-visible panel. */
    PANEL("panel"),
    /** Binary container with exactly two children. */
    SPLIT("split"),
    /** Used when a document contains an unknown type tag. Never produced by a live node. */
    UNKNOWN("unknown");

    private static final String LEGACY_SPLIT_TAG = "container";

    private final String tag;

    NodeType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String toValue() {
        return tag;
    }

    @JsonCreator
    public static NodeType fromValue(String value) {
        if (value == null || value.isBlank()) return UNKNOWN;
        String normalized = value.trim().toLowerCase();
        if (LEGACY_SPLIT_TAG.equals(normalized)) return SPLIT;
        for (NodeType t : values()) {
            if (t != UNKNOWN && t.tag.equals(normalized)) return t;
        }
        return UNKNOWN;
    }
}
