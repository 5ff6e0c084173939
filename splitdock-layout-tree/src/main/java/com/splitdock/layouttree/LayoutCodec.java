package com.splitdock.layouttree;

import com.splitdock.layouttree.document.LayoutDocument;
import com.splitdock.layouttree.document.NodeDocument;
import com.splitdock.layouttree.tree.LayoutBounds;
import com.splitdock.layouttree.tree.LayoutNode;
import com.splitdock.layouttree.tree.PanelNode;
import com.splitdock.layouttree.tree.SplitNode;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Converts between live layout trees and {@link LayoutDocument}s.
 * <p>
 * Reading is strict: an unknown type tag, a blank id, a split missing a child or orientation, or an id used
 * twice fails the whole conversion with {@link LayoutFormatException}. Missing optional attributes take
 * defaults (ratio {@value LayoutBounds#DEFAULT_SPLIT_RATIO}, min size = document min panel size, closable).
 * Nodes are built top-down; each panel is handed to the sink right after it is created.
 */
public final class LayoutCodec {

    /** The only layout format version this codec reads and writes. */
    public static final String SUPPORTED_VERSION = "2.0";

    private LayoutCodec() {
    }

    public static LayoutDocument toDocument(LayoutNode root, double minPanelSize) {
        return new LayoutDocument(SUPPORTED_VERSION, minPanelSize, root != null ? root.toDocument() : null);
    }

    public static boolean isSupportedVersion(LayoutDocument document) {
        return document != null && SUPPORTED_VERSION.equals(document.getVersion());
    }

    /**
     * Builds a detached tree from a node document.
     *
     * @param document       root node document; null yields null (empty layout)
     * @param defaultMinSize min size for nodes that do not carry one
     * @param panelSink      receives every panel as it is constructed (e.g. to register it)
     * @throws LayoutFormatException when the document does not describe a valid tree
     */
    public static LayoutNode toTree(NodeDocument document, double defaultMinSize, Consumer<PanelNode> panelSink) {
        Objects.requireNonNull(panelSink, "panelSink");
        if (document == null) return null;
        return buildNode(document, LayoutBounds.clampMinSize(defaultMinSize), panelSink, new HashSet<>(), "root");
    }

    private static LayoutNode buildNode(NodeDocument doc, double defaultMinSize, Consumer<PanelNode> panelSink,
                                        Set<String> seenIds, String path) {
        String id = doc.getId();
        if (id == null || id.isBlank()) {
            throw new LayoutFormatException("Node at " + path + " has no id");
        }
        if (!seenIds.add(id)) {
            throw new LayoutFormatException("Duplicate node id " + id + " at " + path);
        }
        double minSize = doc.getMinSize() != null ? doc.getMinSize() : defaultMinSize;
        switch (doc.getType()) {
            case PANEL -> {
                PanelNode panel = new PanelNode(id, doc.getTitle(), doc.getContentRef());
                panel.setClosable(doc.getClosable() == null || doc.getClosable());
                panel.setMinSize(minSize);
                panelSink.accept(panel);
                return panel;
            }
            case SPLIT -> {
                if (doc.getOrientation() == null) {
                    throw new LayoutFormatException("Split " + id + " at " + path + " has no valid orientation");
                }
                if (doc.getFirst() == null || doc.getSecond() == null) {
                    throw new LayoutFormatException("Split " + id + " at " + path + " is missing a child");
                }
                SplitNode split = new SplitNode(id, doc.getOrientation());
                split.setSplitRatio(doc.getSplitRatio() != null ? doc.getSplitRatio() : LayoutBounds.DEFAULT_SPLIT_RATIO);
                split.setMinSize(minSize);
                split.setFirst(buildNode(doc.getFirst(), defaultMinSize, panelSink, seenIds, path + ".first"));
                split.setSecond(buildNode(doc.getSecond(), defaultMinSize, panelSink, seenIds, path + ".second"));
                return split;
            }
            default -> throw new LayoutFormatException("Unknown node type for " + id + " at " + path);
        }
    }
}
