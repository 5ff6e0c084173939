package com.splitdock.engine;

import com.splitdock.layouttree.tree.PanelNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Panel id → panel lookup maintained alongside the tree. Entries are created when a panel is inserted or
 * loaded and removed when it is removed; never updated in place. Only panels are registered.
 */
public final class PanelRegistry {

    private final Map<String, PanelNode> panelsById = new LinkedHashMap<>();

    /**
     * @throws IllegalArgumentException if a panel with the same id is already registered
     */
    public void register(PanelNode panel) {
        Objects.requireNonNull(panel, "panel");
        if (panelsById.putIfAbsent(panel.getId(), panel) != null) {
            throw new IllegalArgumentException("Panel already registered: " + panel.getId());
        }
    }

    /** Removes the entry; returns the panel that was registered, or null. */
    public PanelNode unregister(String panelId) {
        return panelId != null ? panelsById.remove(panelId) : null;
    }

    public PanelNode get(String panelId) {
        return panelId != null ? panelsById.get(panelId) : null;
    }

    public boolean contains(String panelId) {
        return panelId != null && panelsById.containsKey(panelId);
    }

    public int size() {
        return panelsById.size();
    }

    /** Registered ids in registration order (snapshot). */
    public List<String> ids() {
        return new ArrayList<>(panelsById.keySet());
    }

    public void clear() {
        panelsById.clear();
    }

    /** Replaces all entries with those of {@code other}. */
    void replaceWith(PanelRegistry other) {
        Objects.requireNonNull(other, "other");
        if (other == this) return;
        panelsById.clear();
        panelsById.putAll(other.panelsById);
    }
}
