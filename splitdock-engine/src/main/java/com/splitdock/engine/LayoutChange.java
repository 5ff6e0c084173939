package com.splitdock.engine;

import java.util.Objects;

/**
 * One change notification. {@code panelId} is set for {@link LayoutChangeType#PANEL_ADDED} and
 * {@link LayoutChangeType#PANEL_REMOVED}, null otherwise.
 */
public record LayoutChange(LayoutChangeType type, String panelId) {

    public LayoutChange {
        Objects.requireNonNull(type, "type");
    }

    public static LayoutChange of(LayoutChangeType type) {
        return new LayoutChange(type, null);
    }

    public static LayoutChange panelAdded(String panelId) {
        return new LayoutChange(LayoutChangeType.PANEL_ADDED, panelId);
    }

    public static LayoutChange panelRemoved(String panelId) {
        return new LayoutChange(LayoutChangeType.PANEL_REMOVED, panelId);
    }
}
