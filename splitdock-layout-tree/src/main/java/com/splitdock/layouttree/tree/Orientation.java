package com.splitdock.layouttree.tree;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** How a split divides its space. JSON values are {@code "horizontal"} and {@code "vertical"}. */
public enum Orientation {
    /** Children stacked top to bottom. */
    HORIZONTAL("horizontal", "H"),
    /** Children side by side, left to right. */
    VERTICAL("vertical", "V");

    private final String value;
    private final String shortName;

    Orientation(String value, String shortName) {
        this.value = value;
        this.shortName = shortName;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    /** One-letter form used in tree dumps. */
    public String getShortName() {
        return shortName;
    }

    /** Returns null for null, blank or unrecognized values. */
    @JsonCreator
    public static Orientation fromValue(String value) {
        if (value == null || value.isBlank()) return null;
        String normalized = value.trim().toLowerCase();
        for (Orientation o : values()) {
            if (o.value.equals(normalized)) return o;
        }
        return null;
    }
}
