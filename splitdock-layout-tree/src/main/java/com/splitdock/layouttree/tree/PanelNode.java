package com.splitdock.layouttree.tree;

import com.splitdock.layouttree.document.NodeDocument;

/**
 * Leaf of the layout tree: one panel with a display title and an opaque content reference
 * (a URI or resource path the rendering layer knows how to load).
 */
public final class PanelNode extends LayoutNode {

    private String title;
    private String contentRef;
    private boolean closable = true;

    public PanelNode(String id, String title) {
        this(id, title, "");
    }

    public PanelNode(String id, String title, String contentRef) {
        super(id);
        this.title = title != null ? title : "";
        this.contentRef = contentRef != null ? contentRef : "";
    }

    @Override
    public NodeType getType() {
        return NodeType.PANEL;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title != null ? title : "";
    }

    public String getContentRef() {
        return contentRef;
    }

    public void setContentRef(String contentRef) {
        this.contentRef = contentRef != null ? contentRef : "";
    }

    /** Whether the user may close this panel. Default true. */
    public boolean isClosable() {
        return closable;
    }

    public void setClosable(boolean closable) {
        this.closable = closable;
    }

    @Override
    public NodeDocument toDocument() {
        return NodeDocument.panel(getId(), title, contentRef, closable, getMinSize());
    }
}
