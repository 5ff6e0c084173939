package com.splitdock.layouttree;

/**
 * Thrown when a layout document is well-formed JSON but does not describe a valid layout tree
 * (unknown node type, missing id, split without both children, duplicate id, non-object root).
 */
public class LayoutFormatException extends IllegalArgumentException {

    public LayoutFormatException(String message) {
        super(message);
    }
}
