package com.splitdock.engine;

import com.splitdock.config.DockConfig;
import com.splitdock.layouttree.LayoutCodec;
import com.splitdock.layouttree.LayoutFormatException;
import com.splitdock.layouttree.LayoutTreeConfig;
import com.splitdock.layouttree.document.LayoutDocument;
import com.splitdock.layouttree.load.LayoutFileStore;
import com.splitdock.layouttree.load.LayoutPaths;
import com.splitdock.layouttree.tree.ChildSlot;
import com.splitdock.layouttree.tree.Direction;
import com.splitdock.layouttree.tree.LayoutBounds;
import com.splitdock.layouttree.tree.LayoutNode;
import com.splitdock.layouttree.tree.PanelNode;
import com.splitdock.layouttree.tree.SplitNode;
import com.splitdock.layouttree.validation.LayoutValidator;
import com.splitdock.layouttree.validation.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Owns the layout tree and is its only mutator. Inserts panels beside any node, removes panels with sibling
 * promotion, persists and restores the tree.
 * <p>
 * Every operation either completes or fails before touching the tree; failures are reported through
 * {@link LayoutResult}, never thrown. Change notifications are collected while the tree is restructured and
 * delivered to listeners only once the structure is consistent again. A listener may call back into the
 * manager; a nested removal of a panel whose removal is still being reported is rejected with
 * {@link LayoutError#IN_PROGRESS}.
 * <p>
 * Single-threaded: call from one logical thread (the UI event loop).
 */
public final class DockingManager {

    private static final Logger log = LoggerFactory.getLogger(DockingManager.class);

    private static final String SPLIT_ID_PREFIX = "node_";

    private final DockConfig config;
    private final PanelRegistry registry = new PanelRegistry();
    /** Panel ids whose removal has not unwound yet (reentrancy guard). */
    private final Set<String> removalsInProgress = new HashSet<>();
    private final List<LayoutChangeListener> listeners = new ArrayList<>();

    private LayoutNode root;
    private double minPanelSize;
    private boolean devMode;
    private int nodeIdCounter;

    public DockingManager() {
        this(DockConfig.defaults());
    }

    public DockingManager(DockConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.minPanelSize = LayoutBounds.clampMinSize(config.getMinPanelSize());
        this.devMode = config.isDevMode();
        log.info("DockingManager initialized | minPanelSize={} | devMode={}", minPanelSize, devMode);
    }

    // ---------------------------------------------------------------- listeners and state

    public void addListener(LayoutChangeListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(LayoutChangeListener listener) {
        listeners.remove(listener);
    }

    /** Root of the tree, or null when the layout is empty. */
    public LayoutNode getRoot() {
        return root;
    }

    public int panelCount() {
        return registry.size();
    }

    public double getMinPanelSize() {
        return minPanelSize;
    }

    /** Sets the global minimum panel size (clamped) used for panels created from now on. */
    public LayoutResult setMinPanelSize(double size) {
        double clamped = LayoutBounds.clampMinSize(size);
        if (Double.compare(clamped, minPanelSize) == 0) {
            return LayoutResult.success();
        }
        minPanelSize = clamped;
        return publish(LayoutResult.success(List.of(LayoutChange.of(LayoutChangeType.MIN_PANEL_SIZE_CHANGED))));
    }

    /** When on, a tree dump is logged after every mutation. Starts from {@link DockConfig#isDevMode()}. */
    public boolean isDevMode() {
        return devMode;
    }

    public LayoutResult setDevMode(boolean enabled) {
        if (devMode == enabled) {
            return LayoutResult.success();
        }
        devMode = enabled;
        log.info("Dev mode changed | devMode={}", enabled);
        return publish(LayoutResult.success(List.of(LayoutChange.of(LayoutChangeType.DEV_MODE_CHANGED))));
    }

    /** O(1) lookup of a panel by id. */
    public Optional<PanelNode> findPanel(String panelId) {
        return Optional.ofNullable(registry.get(panelId));
    }

    /** Any node (panel or split) by id, depth-first; null if absent. */
    public LayoutNode findNode(String nodeId) {
        return LayoutNode.findNodeById(root, nodeId);
    }

    // ---------------------------------------------------------------- insert

    /**
     * Adds a panel beside the rightmost panel (to its right), or as the root of an empty layout.
     */
    public LayoutResult addPanel(String panelId, String title, String contentRef) {
        if (panelId == null) {
            return reject(LayoutError.INVALID_ARGUMENT, "Panel id is null");
        }
        return insertPanel(buildPanel(panelId, title, contentRef), null, null);
    }

    /**
     * Adds a panel next to the node {@code targetId} (panel or split) on the given side.
     */
    public LayoutResult addPanelAt(String panelId, String title, String contentRef, String targetId, Direction direction) {
        if (panelId == null) {
            return reject(LayoutError.INVALID_ARGUMENT, "Panel id is null");
        }
        if (targetId == null) {
            return reject(LayoutError.INVALID_ARGUMENT, "Target id is null");
        }
        return insertPanel(buildPanel(panelId, title, contentRef), targetId, direction);
    }

    /** Same as {@link #addPanelAt(String, String, String, String, Direction)} with a direction code (1..4). */
    public LayoutResult addPanelAt(String panelId, String title, String contentRef, String targetId, int directionCode) {
        Direction direction;
        try {
            direction = Direction.fromCode(directionCode);
        } catch (IllegalArgumentException e) {
            return reject(LayoutError.INVALID_ARGUMENT, e.getMessage());
        }
        return addPanelAt(panelId, title, contentRef, targetId, direction);
    }

    /**
     * Creates a detached panel with a generated {@code node_<n>} id and the current minimum panel size, ready for
     * {@link #insertPanel}. The panel is not part of the layout until inserted.
     */
    public PanelNode createPanel(String title, String contentRef) {
        return buildPanel(generateNodeId(null), title, contentRef);
    }

    /**
     * Inserts a detached panel. With a null {@code targetId} the panel becomes the root of an empty layout or goes
     * beside the rightmost panel ({@code direction} defaults to {@link Direction#RIGHT}). With a target, the target
     * and the panel become the two children of a new split that takes the target's place.
     * <p>
     * All preconditions (argument shape, unique id, target exists) are checked before the tree is touched.
     */
    public LayoutResult insertPanel(PanelNode panel, String targetId, Direction direction) {
        if (panel == null) {
            return reject(LayoutError.INVALID_ARGUMENT, "Panel is null");
        }
        String panelId = panel.getId();
        if (panelId.isBlank()) {
            return reject(LayoutError.INVALID_ARGUMENT, "Panel id cannot be empty");
        }
        if (panel.getParent() != null || panel == root) {
            return reject(LayoutError.INVALID_ARGUMENT, "Panel " + panelId + " is already part of the layout");
        }
        if (registry.contains(panelId) || findNode(panelId) != null) {
            return reject(LayoutError.DUPLICATE, "Node id already exists: " + panelId);
        }

        if (targetId == null && root == null) {
            root = panel;
            registry.register(panel);
            log.info("Layout insert | panelId={} | placement=root", panelId);
            return publish(LayoutResult.success(addedChanges(panelId, true)));
        }

        LayoutNode target;
        Direction placement;
        if (targetId == null) {
            target = LayoutNode.findRightmostPanel(root);
            placement = direction != null ? direction : Direction.RIGHT;
            if (target == null) {
                return reject(LayoutError.NOT_FOUND, "No panel found to attach " + panelId + " to");
            }
        } else {
            target = findNode(targetId);
            if (target == null) {
                return reject(LayoutError.NOT_FOUND, "Target node not found: " + targetId);
            }
            if (direction == null) {
                return reject(LayoutError.INVALID_ARGUMENT, "Direction is required when inserting next to " + targetId);
            }
            placement = direction;
        }
        if (target != root && target.getParent() == null) {
            return reject(LayoutError.INVALID_ARGUMENT, "Target " + target.getId() + " is not attached to the tree");
        }

        boolean rootChanged = attachBeside(panel, target, placement);
        registry.register(panel);
        if (log.isInfoEnabled()) {
            log.info("Layout insert | panelId={} | targetId={} | direction={} | panelCount={}",
                    panelId, target.getId(), placement, registry.size());
        }
        return publish(LayoutResult.success(addedChanges(panelId, rootChanged)));
    }

    /**
     * Wraps {@code target} and {@code panel} in a new split that takes the target's position.
     *
     * @return true if the new split became the root
     */
    private boolean attachBeside(PanelNode panel, LayoutNode target, Direction direction) {
        SplitNode split = new SplitNode(generateNodeId(panel.getId()), direction.orientation());
        split.setMinSize(minPanelSize);
        ChildSlot panelSlot = direction.newPanelSlot();

        if (target == root) {
            split.setChild(panelSlot, panel);
            split.setChild(panelSlot.other(), target);
            root = split;
            return true;
        }

        SplitNode parent = target.getParent();
        ChildSlot targetSlot = parent.slotOf(target);
        parent.takeChild(targetSlot);
        split.setChild(panelSlot, panel);
        split.setChild(panelSlot.other(), target);
        parent.setChild(targetSlot, split);
        return false;
    }

    // ---------------------------------------------------------------- remove

    /**
     * Removes a panel. Its sibling subtree is promoted into the position its parent split held; the panel and
     * that split are discarded. A nested call for the same id while this one is still running (e.g. from a
     * listener) is a no-op returning {@link LayoutError#IN_PROGRESS}.
     */
    public LayoutResult removePanel(String panelId) {
        if (panelId == null || panelId.isBlank()) {
            return reject(LayoutError.INVALID_ARGUMENT, "Panel id cannot be empty");
        }
        if (!removalsInProgress.add(panelId)) {
            log.debug("Panel removal already in progress, ignoring | panelId={}", panelId);
            return LayoutResult.failure(LayoutError.IN_PROGRESS, "Removal already in progress: " + panelId);
        }
        try {
            PanelNode panel = registry.get(panelId);
            if (panel == null) {
                return reject(LayoutError.NOT_FOUND, "Panel not found: " + panelId);
            }
            if (log.isDebugEnabled()) {
                log.debug("Layout remove start | panelId={} | title={} | panelCount={}", panelId, panel.getTitle(), registry.size());
            }
            return publish(detachAndPromote(panel));
        } finally {
            removalsInProgress.remove(panelId);
        }
    }

    /** Like {@link #removePanel} but refuses panels that are not closable. */
    public LayoutResult closePanel(String panelId) {
        PanelNode panel = registry.get(panelId);
        if (panel != null && !panel.isClosable()) {
            return reject(LayoutError.NOT_CLOSABLE, "Panel is not closable: " + panelId);
        }
        return removePanel(panelId);
    }

    private LayoutResult detachAndPromote(PanelNode panel) {
        String panelId = panel.getId();
        boolean rootChanged;

        if (panel == root) {
            root = null;
            rootChanged = true;
        } else {
            SplitNode parent = panel.getParent();
            ChildSlot slot = parent != null ? parent.slotOf(panel) : null;
            if (slot == null || parent.getChild(slot.other()) == null) {
                return reject(LayoutError.INVALID_ARGUMENT, "Panel " + panelId + " is not attached to a complete split");
            }
            SplitNode grandParent = parent.getParent();
            if (grandParent == null && parent != root) {
                return reject(LayoutError.INVALID_ARGUMENT, "Panel " + panelId + " is in a detached subtree");
            }

            LayoutNode sibling = parent.takeChild(slot.other());
            parent.takeChild(slot);
            if (grandParent == null) {
                root = sibling;
                rootChanged = true;
                log.debug("Parent is root, replacing root with sibling | siblingId={}", sibling.getId());
            } else {
                grandParent.setChild(grandParent.slotOf(parent), sibling);
                rootChanged = false;
                log.debug("Replaced parent split with sibling in grandparent | parentId={} | siblingId={} | grandParentId={}",
                        parent.getId(), sibling.getId(), grandParent.getId());
            }
        }

        registry.unregister(panelId);
        log.info("Layout remove | panelId={} | panelCount={}", panelId, registry.size());

        List<LayoutChange> changes = new ArrayList<>();
        if (rootChanged) changes.add(LayoutChange.of(LayoutChangeType.ROOT_CHANGED));
        changes.add(LayoutChange.of(LayoutChangeType.PANEL_COUNT_CHANGED));
        changes.add(LayoutChange.panelRemoved(panelId));
        changes.add(LayoutChange.of(LayoutChangeType.LAYOUT_CHANGED));
        return LayoutResult.success(changes);
    }

    // ---------------------------------------------------------------- other mutations

    /** Sets the ratio (clamped) of the split {@code splitId}. */
    public LayoutResult updateSplitRatio(String splitId, double ratio) {
        LayoutNode node = findNode(splitId);
        if (!(node instanceof SplitNode split)) {
            return reject(LayoutError.NOT_FOUND, "Split not found: " + splitId);
        }
        double before = split.getSplitRatio();
        split.setSplitRatio(ratio);
        if (Double.compare(before, split.getSplitRatio()) == 0) {
            return LayoutResult.success();
        }
        return publish(LayoutResult.success(List.of(LayoutChange.of(LayoutChangeType.LAYOUT_CHANGED))));
    }

    /** Empties the layout. */
    public LayoutResult clear() {
        root = null;
        registry.clear();
        log.info("Layout cleared");
        return publish(LayoutResult.success(List.of(
                LayoutChange.of(LayoutChangeType.ROOT_CHANGED),
                LayoutChange.of(LayoutChangeType.PANEL_COUNT_CHANGED),
                LayoutChange.of(LayoutChangeType.LAYOUT_CHANGED))));
    }

    // ---------------------------------------------------------------- persistence

    public LayoutDocument saveLayout() {
        return LayoutCodec.toDocument(root, minPanelSize);
    }

    /**
     * Replaces the current layout with the one described by {@code document}. The new tree is built aside and
     * swapped in only when the whole document is valid; otherwise the current tree is untouched.
     */
    public LayoutResult loadLayout(LayoutDocument document) {
        if (document == null) {
            return reject(LayoutError.INVALID_ARGUMENT, "Layout document is null");
        }
        if (!LayoutCodec.isSupportedVersion(document)) {
            return reject(LayoutError.VERSION_MISMATCH, "Incompatible layout version: " + document.getVersion()
                    + " (supported " + LayoutCodec.SUPPORTED_VERSION + ")");
        }
        double loadedMinPanelSize = document.getMinPanelSize() != null
                ? LayoutBounds.clampMinSize(document.getMinPanelSize())
                : minPanelSize;
        PanelRegistry loaded = new PanelRegistry();
        LayoutNode loadedRoot;
        try {
            loadedRoot = LayoutCodec.toTree(document.getRoot(), loadedMinPanelSize, loaded::register);
        } catch (LayoutFormatException e) {
            return reject(LayoutError.INVALID_ARGUMENT, "Invalid layout document: " + e.getMessage());
        }

        boolean minSizeChanged = Double.compare(loadedMinPanelSize, minPanelSize) != 0;
        root = loadedRoot;
        registry.replaceWith(loaded);
        minPanelSize = loadedMinPanelSize;
        log.info("Layout loaded | panelCount={} | minPanelSize={}", registry.size(), minPanelSize);

        List<LayoutChange> changes = new ArrayList<>();
        changes.add(LayoutChange.of(LayoutChangeType.ROOT_CHANGED));
        changes.add(LayoutChange.of(LayoutChangeType.PANEL_COUNT_CHANGED));
        if (minSizeChanged) changes.add(LayoutChange.of(LayoutChangeType.MIN_PANEL_SIZE_CHANGED));
        changes.add(LayoutChange.of(LayoutChangeType.LAYOUT_CHANGED));
        return publish(LayoutResult.success(changes));
    }

    /** Writes the current layout as pretty-printed JSON. */
    public LayoutResult saveLayoutToFile(Path file) {
        if (file == null) {
            return reject(LayoutError.INVALID_ARGUMENT, "Layout file path is null");
        }
        try {
            LayoutFileStore.write(file, LayoutTreeConfig.toJsonPretty(saveLayout()));
        } catch (IOException | UncheckedIOException e) {
            log.error("Failed to write layout to file | path={} | error={}", file, e.getMessage());
            return LayoutResult.failure(LayoutError.IO_FAILURE, "Failed to write layout to " + file + ": " + e.getMessage());
        }
        log.info("Layout saved to file | path={} | panelCount={}", file, registry.size());
        return LayoutResult.success();
    }

    /** Reads a layout file and loads it; the current tree is untouched on any failure. */
    public LayoutResult loadLayoutFromFile(Path file) {
        if (file == null) {
            return reject(LayoutError.INVALID_ARGUMENT, "Layout file path is null");
        }
        Optional<String> json = LayoutFileStore.read(file);
        if (json.isEmpty()) {
            return reject(LayoutError.IO_FAILURE, "Failed to read layout file " + file);
        }
        LayoutDocument document;
        try {
            document = LayoutTreeConfig.fromJson(json.get());
        } catch (UncheckedIOException | LayoutFormatException e) {
            return reject(LayoutError.INVALID_ARGUMENT, "Malformed layout file " + file + ": " + e.getMessage());
        }
        LayoutResult result = loadLayout(document);
        if (result.isSuccess()) {
            log.info("Layout loaded from file | path={} | panelCount={}", file, registry.size());
        }
        return result;
    }

    /** Default layout file, resolved from the working directory. */
    public Path getDefaultLayoutPath() {
        return getDefaultLayoutPath(Path.of(""));
    }

    /**
     * Configured layout directory (or the project root found above {@code startDir}) joined with the layout
     * file name. The directory is created if missing.
     */
    public Path getDefaultLayoutPath(Path startDir) {
        Path dir = config.getLayoutDir() != null
                ? Path.of(config.getLayoutDir()).toAbsolutePath()
                : LayoutPaths.findProjectRoot(startDir, config.getProjectMarker(), config.getProjectSearchLevels());
        LayoutPaths.ensureDirectoryExists(dir);
        return dir.resolve(config.getLayoutFileName());
    }

    // ---------------------------------------------------------------- inspection

    public ValidationReport validate() {
        return LayoutValidator.validate(root);
    }

    /** Panels in depth-first order, first child before second. */
    public List<PanelNode> getFlatPanelList() {
        List<PanelNode> panels = new ArrayList<>();
        collectPanels(root, panels);
        return panels;
    }

    /** Indented text rendering of the tree, one node per line. */
    public String dumpTree() {
        if (root == null) {
            return "Empty tree";
        }
        StringBuilder sb = new StringBuilder();
        dumpNode(root, 0, sb);
        return sb.toString();
    }

    // ---------------------------------------------------------------- helpers

    private PanelNode buildPanel(String panelId, String title, String contentRef) {
        PanelNode panel = new PanelNode(panelId, title, contentRef);
        panel.setMinSize(minPanelSize);
        return panel;
    }

    /** Next {@code node_<n>} id not used by the tree, the registry or {@code reservedId} (may be null). */
    private String generateNodeId(String reservedId) {
        String id;
        do {
            id = SPLIT_ID_PREFIX + (++nodeIdCounter);
        } while (id.equals(reservedId) || registry.contains(id) || findNode(id) != null);
        return id;
    }

    private static List<LayoutChange> addedChanges(String panelId, boolean rootChanged) {
        List<LayoutChange> changes = new ArrayList<>();
        if (rootChanged) changes.add(LayoutChange.of(LayoutChangeType.ROOT_CHANGED));
        changes.add(LayoutChange.of(LayoutChangeType.PANEL_COUNT_CHANGED));
        changes.add(LayoutChange.panelAdded(panelId));
        changes.add(LayoutChange.of(LayoutChangeType.LAYOUT_CHANGED));
        return changes;
    }

    private LayoutResult reject(LayoutError error, String message) {
        log.warn("Layout operation rejected | error={} | {}", error, message);
        return LayoutResult.failure(error, message);
    }

    /** Delivers the result's changes to a snapshot of the listeners, in order. */
    private LayoutResult publish(LayoutResult result) {
        if (!result.isSuccess() || result.getChanges().isEmpty()) {
            return result;
        }
        if (devMode && log.isInfoEnabled()) {
            log.info("Layout tree after mutation:\n{}", dumpTree());
        }
        List<LayoutChangeListener> snapshot = List.copyOf(listeners);
        for (LayoutChange change : result.getChanges()) {
            for (LayoutChangeListener listener : snapshot) {
                try {
                    listener.onLayoutChange(change);
                } catch (RuntimeException e) {
                    log.warn("Layout listener failed | change={} | listener={}", change, listener, e);
                }
            }
        }
        return result;
    }

    private static void collectPanels(LayoutNode node, List<PanelNode> panels) {
        if (node instanceof PanelNode panel) {
            panels.add(panel);
        } else if (node instanceof SplitNode split) {
            collectPanels(split.getFirst(), panels);
            collectPanels(split.getSecond(), panels);
        }
    }

    private static void dumpNode(LayoutNode node, int indent, StringBuilder sb) {
        if (node == null) return;
        sb.append("  ".repeat(indent));
        if (node instanceof PanelNode panel) {
            sb.append("Panel[").append(panel.getId()).append("]: ").append(panel.getTitle()).append('\n');
        } else if (node instanceof SplitNode split) {
            sb.append("Split[").append(split.getId()).append("]: ").append(split.getOrientation().getShortName())
                    .append(" (ratio: ").append(split.getSplitRatio()).append(")\n");
            dumpNode(split.getFirst(), indent + 1, sb);
            dumpNode(split.getSecond(), indent + 1, sb);
        }
    }
}
