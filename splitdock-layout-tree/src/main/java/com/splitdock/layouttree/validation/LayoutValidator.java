package com.splitdock.layouttree.validation;

import com.splitdock.layouttree.LayoutTreeConfig;
import com.splitdock.layouttree.tree.LayoutBounds;
import com.splitdock.layouttree.tree.LayoutNode;
import com.splitdock.layouttree.tree.NodeType;
import com.splitdock.layouttree.tree.PanelNode;
import com.splitdock.layouttree.tree.SplitNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks on a layout tree, run on demand (before save, after load, from debug tooling),
 * never on every mutation.
 * <p>
 * Errors: null root, split missing a child, empty id, type tag not matching the node class, parent
 * reference not matching the attachment point, duplicate id, depth above {@value #MAX_SERIALIZABLE_DEPTH}
 * (such a tree cannot be saved).
 * Warnings: depth above {@value #MAX_RECOMMENDED_DEPTH}, more than {@value #MAX_RECOMMENDED_NODES} nodes,
 * split ratio out of range, panel without title or content reference, min size below {@value LayoutBounds#MIN_SIZE}.
 */
public final class LayoutValidator {

    public static final int MAX_RECOMMENDED_DEPTH = 10;
    public static final int MAX_RECOMMENDED_NODES = 50;
    /** Deepest tree whose layout document stays within {@link LayoutTreeConfig#MAX_NESTING_DEPTH}. */
    public static final int MAX_SERIALIZABLE_DEPTH = LayoutTreeConfig.MAX_NESTING_DEPTH - 1;

    private LayoutValidator() {
    }

    public static ValidationReport validate(LayoutNode root) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (root == null) {
            errors.add("Root node is null");
            return new ValidationReport(errors, warnings);
        }
        if (root.getParent() != null) {
            errors.add("Root node " + root.getId() + " has a parent (" + root.getParent().getId() + ")");
        }

        Set<String> seenIds = new HashSet<>();
        validateNode(root, errors, warnings, seenIds);

        int depth = calculateDepth(root);
        if (depth > MAX_SERIALIZABLE_DEPTH) {
            errors.add("Layout depth " + depth + " exceeds the maximum that can be saved (" + MAX_SERIALIZABLE_DEPTH + ")");
        } else if (depth > MAX_RECOMMENDED_DEPTH) {
            warnings.add("Layout depth is very deep: " + depth + " levels (recommended <= " + MAX_RECOMMENDED_DEPTH + ")");
        }
        int nodeCount = countNodes(root);
        if (nodeCount > MAX_RECOMMENDED_NODES) {
            warnings.add("Too many nodes: " + nodeCount + " (recommended <= " + MAX_RECOMMENDED_NODES + ")");
        }
        return new ValidationReport(errors, warnings);
    }

    private static void validateNode(LayoutNode node, List<String> errors, List<String> warnings, Set<String> seenIds) {
        String id = node.getId();
        if (id.isEmpty()) {
            errors.add("Node has empty ID");
        } else if (!seenIds.add(id)) {
            errors.add("Duplicate node ID: " + id);
        }

        if (node.getMinSize() < LayoutBounds.MIN_SIZE) {
            warnings.add("Node " + id + " has very small minSize: " + node.getMinSize());
        }

        if (node.getType() == NodeType.SPLIT) {
            if (!(node instanceof SplitNode split)) {
                errors.add("Split node " + id + " is not a SplitNode");
                return;
            }
            if (!LayoutBounds.isValidSplitRatio(split.getSplitRatio())) {
                warnings.add("Invalid split ratio in node " + id + ": " + split.getSplitRatio());
            }
            if (split.getFirst() == null || split.getSecond() == null) {
                errors.add("Split container " + id + " missing child nodes");
            }
            validateChild(split, split.getFirst(), errors, warnings, seenIds);
            validateChild(split, split.getSecond(), errors, warnings, seenIds);
        } else if (node.getType() == NodeType.PANEL) {
            if (!(node instanceof PanelNode panel)) {
                errors.add("Panel node " + id + " is not a PanelNode");
                return;
            }
            if (panel.getTitle().isEmpty()) {
                warnings.add("Panel " + id + " has empty title");
            }
            if (panel.getContentRef().isEmpty()) {
                warnings.add("Panel " + id + " has empty contentRef");
            }
        } else {
            errors.add("Node " + id + " has unsupported type " + node.getType());
        }
    }

    private static void validateChild(SplitNode split, LayoutNode child, List<String> errors, List<String> warnings,
                                      Set<String> seenIds) {
        if (child == null) return;
        if (child.getParent() != split) {
            errors.add("Node " + child.getId() + " is attached to " + split.getId() + " but its parent is "
                    + (child.getParent() != null ? child.getParent().getId() : "null"));
        }
        validateNode(child, errors, warnings, seenIds);
    }

    /** Levels from the root down to the deepest panel; a lone panel has depth 1. */
    static int calculateDepth(LayoutNode node) {
        if (!(node instanceof SplitNode split)) {
            return node != null ? 1 : 0;
        }
        return 1 + Math.max(calculateDepth(split.getFirst()), calculateDepth(split.getSecond()));
    }

    static int countNodes(LayoutNode node) {
        if (node == null) return 0;
        if (node instanceof SplitNode split) {
            return 1 + countNodes(split.getFirst()) + countNodes(split.getSecond());
        }
        return 1;
    }
}
