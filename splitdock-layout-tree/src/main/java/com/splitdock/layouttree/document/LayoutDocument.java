package com.splitdock.layouttree.document;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Root of a persisted layout: format version, global minimum panel size and the node tree
 * ({@code root} absent for an empty layout).
 */
public final class LayoutDocument {

    private final String version;
    private final Double minPanelSize;
    private final NodeDocument root;

    @JsonCreator
    public LayoutDocument(
            @JsonProperty("version") String version,
            @JsonProperty("minPanelSize") Double minPanelSize,
            @JsonProperty("root") NodeDocument root) {
        this.version = version;
        this.minPanelSize = minPanelSize;
        this.root = root;
    }

    public String getVersion() {
        return version;
    }

    public Double getMinPanelSize() {
        return minPanelSize;
    }

    public NodeDocument getRoot() {
        return root;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LayoutDocument that = (LayoutDocument) o;
        return Objects.equals(version, that.version) && Objects.equals(minPanelSize, that.minPanelSize)
                && Objects.equals(root, that.root);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, minPanelSize, root);
    }
}
