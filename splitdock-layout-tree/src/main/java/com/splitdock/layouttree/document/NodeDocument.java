package com.splitdock.layouttree.document;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.splitdock.layouttree.tree.NodeType;
import com.splitdock.layouttree.tree.Orientation;

import java.util.Objects;

/**
 * Persisted form of one layout node. Panels carry {@code title}, {@code contentRef} and {@code closable};
 * splits carry {@code orientation}, {@code splitRatio} and the nested {@code first}/{@code second} documents.
 * Attributes that do not apply to the node type are null and left out of the JSON.
 * {@code qmlSource} and {@code canClose} are accepted as aliases of {@code contentRef} and {@code closable}
 * when reading older layout files.
 */
public final class NodeDocument {

    private final NodeType type;
    private final String id;
    private final String title;
    private final String contentRef;
    private final Boolean closable;
    private final Orientation orientation;
    private final Double splitRatio;
    private final Double minSize;
    private final NodeDocument first;
    private final NodeDocument second;

    @JsonCreator
    public NodeDocument(
            @JsonProperty("type") NodeType type,
            @JsonProperty("id") String id,
            @JsonProperty("title") String title,
            @JsonProperty("contentRef") @JsonAlias("qmlSource") String contentRef,
            @JsonProperty("closable") @JsonAlias("canClose") Boolean closable,
            @JsonProperty("orientation") Orientation orientation,
            @JsonProperty("splitRatio") Double splitRatio,
            @JsonProperty("minSize") Double minSize,
            @JsonProperty("first") NodeDocument first,
            @JsonProperty("second") NodeDocument second) {
        this.type = type != null ? type : NodeType.UNKNOWN;
        this.id = id;
        this.title = title;
        this.contentRef = contentRef;
        this.closable = closable;
        this.orientation = orientation;
        this.splitRatio = splitRatio;
        this.minSize = minSize;
        this.first = first;
        this.second = second;
    }

    public static NodeDocument panel(String id, String title, String contentRef, boolean closable, double minSize) {
        return new NodeDocument(NodeType.PANEL, id, title, contentRef, closable, null, null, minSize, null, null);
    }

    public static NodeDocument split(String id, Orientation orientation, double splitRatio, double minSize,
                                     NodeDocument first, NodeDocument second) {
        return new NodeDocument(NodeType.SPLIT, id, null, null, null, orientation, splitRatio, minSize, first, second);
    }

    /** Never null; {@link NodeType#UNKNOWN} for missing or unrecognized tags. */
    public NodeType getType() {
        return type;
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getContentRef() {
        return contentRef;
    }

    public Boolean getClosable() {
        return closable;
    }

    public Orientation getOrientation() {
        return orientation;
    }

    public Double getSplitRatio() {
        return splitRatio;
    }

    public Double getMinSize() {
        return minSize;
    }

    public NodeDocument getFirst() {
        return first;
    }

    public NodeDocument getSecond() {
        return second;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeDocument that = (NodeDocument) o;
        return type == that.type && Objects.equals(id, that.id)
                && Objects.equals(title, that.title) && Objects.equals(contentRef, that.contentRef)
                && Objects.equals(closable, that.closable) && orientation == that.orientation
                && Objects.equals(splitRatio, that.splitRatio) && Objects.equals(minSize, that.minSize)
                && Objects.equals(first, that.first) && Objects.equals(second, that.second);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, id, title, contentRef, closable, orientation, splitRatio, minSize, first, second);
    }
}
