package com.splitdock.engine;

import com.splitdock.config.DockConfig;
import com.splitdock.layouttree.LayoutTreeConfig;
import com.splitdock.layouttree.document.LayoutDocument;
import com.splitdock.layouttree.tree.ChildSlot;
import com.splitdock.layouttree.tree.Direction;
import com.splitdock.layouttree.tree.LayoutNode;
import com.splitdock.layouttree.tree.Orientation;
import com.splitdock.layouttree.tree.PanelNode;
import com.splitdock.layouttree.tree.SplitNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DockingManagerTest {

    @TempDir
    Path tempDir;

    private DockingManager manager;
    private List<LayoutChange> received;

    @BeforeEach
    void setUp() {
        manager = new DockingManager();
        received = new ArrayList<>();
        manager.addListener(received::add);
    }

    private PanelNode panel(String id) {
        return manager.findPanel(id).orElseThrow();
    }

    private void addThree() {
        manager.addPanel("a", "A", "A.qml");
        manager.addPanelAt("b", "B", "B.qml", "a", Direction.RIGHT);
        manager.addPanelAt("c", "C", "C.qml", "b", Direction.RIGHT);
    }

    // ---------------------------------------------------------------- insert

    @Test
    void addPanel_onEmptyTreeBecomesRoot() {
        LayoutResult result = manager.addPanel("a", "A", "A.qml");

        assertTrue(result.isSuccess());
        PanelNode root = assertInstanceOf(PanelNode.class, manager.getRoot());
        assertEquals("a", root.getId());
        assertNull(root.getParent());
        assertEquals(1, manager.panelCount());
        assertEquals(List.of(
                LayoutChange.of(LayoutChangeType.ROOT_CHANGED),
                LayoutChange.of(LayoutChangeType.PANEL_COUNT_CHANGED),
                LayoutChange.panelAdded("a"),
                LayoutChange.of(LayoutChangeType.LAYOUT_CHANGED)), result.getChanges());
        assertEquals(result.getChanges(), received);
    }

    @Test
    void addPanelAt_rightOfRootCreatesVerticalSplit() {
        manager.addPanel("a", "A", "A.qml");

        LayoutResult result = manager.addPanelAt("b", "B", "B.qml", "a", Direction.RIGHT);

        assertTrue(result.isSuccess());
        SplitNode root = assertInstanceOf(SplitNode.class, manager.getRoot());
        assertEquals(Orientation.VERTICAL, root.getOrientation());
        assertEquals(0.5, root.getSplitRatio());
        assertSame(panel("a"), root.getFirst());
        assertSame(panel("b"), root.getSecond());
        assertSame(root, panel("a").getParent());
        assertEquals(LayoutChangeType.ROOT_CHANGED, result.getChanges().get(0).type());
    }

    @Test
    void addPanelAt_eachDirectionPlacesPanelInExpectedSlot() {
        for (Direction direction : Direction.values()) {
            DockingManager m = new DockingManager();
            m.addPanel("target", "T", "T.qml");

            assertTrue(m.addPanelAt("new", "N", "N.qml", "target", direction).isSuccess());

            SplitNode split = assertInstanceOf(SplitNode.class, m.getRoot());
            assertEquals(direction.orientation(), split.getOrientation(), direction.name());
            assertEquals("new", split.getChild(direction.newPanelSlot()).getId(), direction.name());
            assertEquals("target", split.getChild(direction.newPanelSlot().other()).getId(), direction.name());
        }
    }

    @Test
    void addPanelAt_nestedTargetReplacesTargetInItsSlot() {
        manager.addPanel("a", "A", "A.qml");
        manager.addPanelAt("b", "B", "B.qml", "a", Direction.RIGHT);
        SplitNode root = (SplitNode) manager.getRoot();
        received.clear();

        LayoutResult result = manager.addPanelAt("c", "C", "C.qml", "b", Direction.BOTTOM);

        assertTrue(result.isSuccess());
        assertSame(root, manager.getRoot());
        SplitNode nested = assertInstanceOf(SplitNode.class, root.getSecond());
        assertSame(root, nested.getParent());
        assertEquals(Orientation.HORIZONTAL, nested.getOrientation());
        assertSame(panel("b"), nested.getFirst());
        assertSame(panel("c"), nested.getSecond());
        assertEquals(List.of(
                LayoutChange.of(LayoutChangeType.PANEL_COUNT_CHANGED),
                LayoutChange.panelAdded("c"),
                LayoutChange.of(LayoutChangeType.LAYOUT_CHANGED)), received);
    }

    @Test
    void addPanelAt_splitTargetWrapsWholeSubtree() {
        addThree();
        SplitNode inner = (SplitNode) ((SplitNode) manager.getRoot()).getSecond();

        assertTrue(manager.addPanelAt("d", "D", "D.qml", inner.getId(), Direction.TOP).isSuccess());

        SplitNode wrapper = (SplitNode) ((SplitNode) manager.getRoot()).getSecond();
        assertSame(panel("d"), wrapper.getFirst());
        assertSame(inner, wrapper.getSecond());
        assertTrue(manager.validate().isValid());
    }

    @Test
    void addPanel_withoutTargetGoesRightOfRightmostPanel() {
        manager.addPanel("a", "A", "A.qml");
        manager.addPanelAt("b", "B", "B.qml", "a", Direction.BOTTOM);

        assertTrue(manager.addPanel("c", "C", "C.qml").isSuccess());

        SplitNode root = (SplitNode) manager.getRoot();
        SplitNode added = assertInstanceOf(SplitNode.class, root.getSecond());
        assertEquals(Orientation.VERTICAL, added.getOrientation());
        assertSame(panel("b"), added.getFirst());
        assertSame(panel("c"), added.getSecond());
    }

    @Test
    void addPanel_generatedSplitIdsAreUnique() {
        manager.addPanel("node_1", "Looks like a split id", "X.qml");
        manager.addPanel("b", "B", "B.qml");
        manager.addPanel("c", "C", "C.qml");

        Set<String> ids = new HashSet<>();
        collectIds(manager.getRoot(), ids);
        assertEquals(5, ids.size());
        assertTrue(manager.validate().isValid());
    }

    @Test
    void createPanel_generatesDetachedPanelWithCurrentMinSize() {
        manager.setMinPanelSize(240);

        PanelNode created = manager.createPanel("Output", "Output.qml");
        PanelNode another = manager.createPanel("Search", "Search.qml");

        assertTrue(created.getId().startsWith("node_"));
        assertNotEquals(created.getId(), another.getId());
        assertEquals(240.0, created.getMinSize());
        assertEquals("Output.qml", created.getContentRef());
        assertNull(created.getParent());
        assertEquals(0, manager.panelCount());

        assertTrue(manager.insertPanel(created, null, null).isSuccess());
        assertTrue(manager.insertPanel(another, created.getId(), Direction.BOTTOM).isSuccess());
        assertSame(created, panel(created.getId()));
        Set<String> ids = new HashSet<>();
        collectIds(manager.getRoot(), ids);
        assertEquals(3, ids.size());
        assertTrue(manager.validate().isValid());
    }

    @Test
    void addPanel_duplicateIdIsRejectedWithoutChange() {
        addThree();
        String before = manager.dumpTree();
        received.clear();

        LayoutResult result = manager.addPanelAt("b", "B2", "B2.qml", "a", Direction.LEFT);

        assertFalse(result.isSuccess());
        assertEquals(LayoutError.DUPLICATE, result.getError());
        assertEquals(before, manager.dumpTree());
        assertTrue(received.isEmpty());

        String splitId = ((SplitNode) manager.getRoot()).getId();
        assertEquals(LayoutError.DUPLICATE, manager.addPanel(splitId, "S", "S.qml").getError());
        assertEquals(3, manager.panelCount());
    }

    @Test
    void addPanelAt_unknownTargetIsRejected() {
        manager.addPanel("a", "A", "A.qml");

        LayoutResult result = manager.addPanelAt("b", "B", "B.qml", "missing", Direction.LEFT);

        assertEquals(LayoutError.NOT_FOUND, result.getError());
        assertEquals(1, manager.panelCount());
        assertTrue(manager.findPanel("b").isEmpty());
    }

    @Test
    void addPanelAt_onEmptyTreeWithTargetIsNotFound() {
        assertEquals(LayoutError.NOT_FOUND, manager.addPanelAt("a", "A", "A.qml", "x", Direction.LEFT).getError());
        assertNull(manager.getRoot());
    }

    @Test
    void addPanelAt_invalidArgumentsAreRejected() {
        manager.addPanel("a", "A", "A.qml");

        assertEquals(LayoutError.INVALID_ARGUMENT, manager.addPanelAt("b", "B", "B.qml", "a", (Direction) null).getError());
        assertEquals(LayoutError.INVALID_ARGUMENT, manager.addPanelAt("b", "B", "B.qml", "a", 5).getError());
        assertEquals(LayoutError.INVALID_ARGUMENT, manager.addPanel("", "B", "B.qml").getError());
        assertEquals(LayoutError.INVALID_ARGUMENT, manager.addPanel(null, "B", "B.qml").getError());
        assertEquals(LayoutError.INVALID_ARGUMENT, manager.insertPanel(null, null, null).getError());
        assertEquals(LayoutError.INVALID_ARGUMENT, manager.insertPanel(panel("a"), null, null).getError());
        assertEquals(1, manager.panelCount());

        assertTrue(manager.addPanelAt("b", "B", "B.qml", "a", 3).isSuccess());
        assertEquals("b", ((SplitNode) manager.getRoot()).getFirst().getId());
    }

    @Test
    void addPanel_usesGlobalMinPanelSize() {
        manager.setMinPanelSize(200);
        manager.addPanel("a", "A", "A.qml");
        manager.addPanel("b", "B", "B.qml");

        assertEquals(200.0, panel("a").getMinSize());
        assertEquals(200.0, manager.getRoot().getMinSize());
    }

    // ---------------------------------------------------------------- remove

    @Test
    void removePanel_onlyPanelEmptiesTree() {
        manager.addPanel("a", "A", "A.qml");
        received.clear();

        LayoutResult result = manager.removePanel("a");

        assertTrue(result.isSuccess());
        assertNull(manager.getRoot());
        assertEquals(0, manager.panelCount());
        assertEquals(List.of(
                LayoutChange.of(LayoutChangeType.ROOT_CHANGED),
                LayoutChange.of(LayoutChangeType.PANEL_COUNT_CHANGED),
                LayoutChange.panelRemoved("a"),
                LayoutChange.of(LayoutChangeType.LAYOUT_CHANGED)), received);
    }

    @Test
    void removePanel_siblingOfRootSplitBecomesRoot() {
        manager.addPanel("a", "A", "A.qml");
        manager.addPanelAt("b", "B", "B.qml", "a", Direction.RIGHT);

        assertTrue(manager.removePanel("a").isSuccess());

        assertSame(panel("b"), manager.getRoot());
        assertNull(panel("b").getParent());
        assertEquals(1, manager.panelCount());
        assertTrue(manager.findPanel("a").isEmpty());
    }

    @Test
    void removePanel_siblingTakesParentSlotInGrandparent() {
        addThree();
        SplitNode root = (SplitNode) manager.getRoot();
        received.clear();

        assertTrue(manager.removePanel("b").isSuccess());

        assertSame(root, manager.getRoot());
        assertSame(panel("a"), root.getFirst());
        assertSame(panel("c"), root.getSecond());
        assertSame(root, panel("c").getParent());
        assertEquals(2, manager.panelCount());
        assertEquals(List.of(
                LayoutChange.of(LayoutChangeType.PANEL_COUNT_CHANGED),
                LayoutChange.panelRemoved("b"),
                LayoutChange.of(LayoutChangeType.LAYOUT_CHANGED)), received);
    }

    @Test
    void removePanel_promotesWholeSiblingSubtree() {
        addThree();
        SplitNode inner = (SplitNode) ((SplitNode) manager.getRoot()).getSecond();

        assertTrue(manager.removePanel("a").isSuccess());

        assertSame(inner, manager.getRoot());
        assertNull(inner.getParent());
        assertTrue(manager.validate().isValid());
    }

    @Test
    void removePanel_unknownOrBlankIdIsRejected() {
        addThree();
        String before = manager.dumpTree();

        assertEquals(LayoutError.NOT_FOUND, manager.removePanel("zzz").getError());
        assertEquals(LayoutError.NOT_FOUND, manager.removePanel(((SplitNode) manager.getRoot()).getId()).getError());
        assertEquals(LayoutError.INVALID_ARGUMENT, manager.removePanel("").getError());
        assertEquals(before, manager.dumpTree());
    }

    @Test
    void removePanel_nestedRemovalOfSameIdIsIgnored() {
        addThree();
        List<LayoutResult> nested = new ArrayList<>();
        List<Integer> panelCounts = new ArrayList<>();
        manager.addListener(change -> {
            if (change.type() == LayoutChangeType.PANEL_REMOVED) {
                panelCounts.add(manager.panelCount());
                nested.add(manager.removePanel(change.panelId()));
            }
        });

        LayoutResult result = manager.removePanel("b");

        assertTrue(result.isSuccess());
        assertEquals(1, nested.size());
        assertEquals(LayoutError.IN_PROGRESS, nested.get(0).getError());
        assertEquals(List.of(2), panelCounts);
        assertEquals(2, manager.panelCount());
        assertEquals(1, received.stream().filter(c -> c.type() == LayoutChangeType.PANEL_REMOVED).count());

        // guard released once the outer call returns
        assertEquals(LayoutError.NOT_FOUND, manager.removePanel("b").getError());
    }

    @Test
    void removePanel_sameIdReAddedByListenerCannotBeRemovedUntilOuterCallReturns() {
        addThree();
        List<LayoutResult> nested = new ArrayList<>();
        manager.addListener(change -> {
            if (change.type() == LayoutChangeType.PANEL_REMOVED && "b".equals(change.panelId()) && nested.isEmpty()) {
                nested.add(manager.addPanel("b", "B again", "B.qml"));
                nested.add(manager.removePanel("b"));
            }
        });

        assertTrue(manager.removePanel("b").isSuccess());

        assertTrue(nested.get(0).isSuccess());
        assertEquals(LayoutError.IN_PROGRESS, nested.get(1).getError());
        assertEquals("B again", panel("b").getTitle());
        assertEquals(3, manager.panelCount());

        assertTrue(manager.removePanel("b").isSuccess());
        assertTrue(manager.findPanel("b").isEmpty());
        assertEquals(2, manager.panelCount());
    }

    @Test
    void removePanel_listenerSeesCompletedStructure() {
        addThree();
        List<String> rootsSeen = new ArrayList<>();
        manager.addListener(change -> {
            if (change.type() == LayoutChangeType.ROOT_CHANGED) {
                rootsSeen.add(manager.getRoot().getId());
                assertTrue(manager.validate().isValid());
            }
        });

        manager.removePanel("a");

        assertEquals(1, rootsSeen.size());
        assertNotEquals("a", rootsSeen.get(0));
        assertSame(manager.getRoot(), manager.findNode(rootsSeen.get(0)));
    }

    @Test
    void removePanel_listenerMayRemoveAnotherPanel() {
        addThree();
        manager.addListener(change -> {
            if (change.type() == LayoutChangeType.PANEL_REMOVED && "a".equals(change.panelId())) {
                assertTrue(manager.removePanel("c").isSuccess());
            }
        });

        manager.removePanel("a");

        assertSame(panel("b"), manager.getRoot());
        assertEquals(1, manager.panelCount());
    }

    @Test
    void listener_failureDoesNotStopOtherListeners() {
        DockingManager m = new DockingManager();
        List<LayoutChange> seen = new ArrayList<>();
        m.addListener(change -> {
            throw new IllegalStateException("boom");
        });
        m.addListener(seen::add);

        assertTrue(m.addPanel("a", "A", "A.qml").isSuccess());

        assertEquals(4, seen.size());
        assertSame(m.findPanel("a").orElseThrow(), m.getRoot());
    }

    @Test
    void closePanel_respectsClosableFlag() {
        addThree();
        panel("a").setClosable(false);

        assertEquals(LayoutError.NOT_CLOSABLE, manager.closePanel("a").getError());
        assertEquals(3, manager.panelCount());
        assertTrue(manager.closePanel("b").isSuccess());
        assertEquals(LayoutError.NOT_FOUND, manager.closePanel("b").getError());
        assertTrue(manager.removePanel("a").isSuccess());
    }

    @Test
    void randomInsertsAndRemovals_keepTreeAndRegistryConsistent() {
        DockingManager m = new DockingManager();
        Random random = new Random(42);
        Set<String> live = new HashSet<>();
        int next = 0;

        for (int step = 0; step < 600; step++) {
            boolean insert = live.isEmpty() || live.size() < 12 && random.nextInt(3) > 0;
            if (insert) {
                String id = "p" + (next++);
                LayoutResult result;
                if (m.getRoot() == null || random.nextBoolean()) {
                    result = m.addPanel(id, id, id + ".qml");
                } else {
                    List<String> targets = new ArrayList<>();
                    collectIds(m.getRoot(), targets);
                    String target = targets.get(random.nextInt(targets.size()));
                    result = m.addPanelAt(id, id, id + ".qml", target, 1 + random.nextInt(4));
                }
                assertTrue(result.isSuccess(), result.toString());
                live.add(id);
            } else {
                List<String> ids = new ArrayList<>(live);
                ids.sort(null);
                String victim = ids.get(random.nextInt(ids.size()));
                assertTrue(m.removePanel(victim).isSuccess());
                live.remove(victim);
            }

            assertEquals(live.size(), m.panelCount());
            Set<String> flat = m.getFlatPanelList().stream().map(PanelNode::getId).collect(Collectors.toSet());
            assertEquals(live, flat);
            if (m.getRoot() != null) {
                assertTrue(m.validate().isValid(), m.validate().toString());
                assertNull(m.getRoot().getParent());
            }
        }
    }

    // ---------------------------------------------------------------- other mutations

    @Test
    void updateSplitRatio_clampsAndNotifies() {
        addThree();
        String splitId = manager.getRoot().getId();
        received.clear();

        assertTrue(manager.updateSplitRatio(splitId, 0.95).isSuccess());

        assertEquals(0.9, ((SplitNode) manager.getRoot()).getSplitRatio());
        assertEquals(List.of(LayoutChange.of(LayoutChangeType.LAYOUT_CHANGED)), received);
        assertEquals(LayoutError.NOT_FOUND, manager.updateSplitRatio("a", 0.3).getError());
        assertEquals(LayoutError.NOT_FOUND, manager.updateSplitRatio("missing", 0.3).getError());
    }

    @Test
    void clear_emptiesTreeAndRegistry() {
        addThree();
        received.clear();

        assertTrue(manager.clear().isSuccess());

        assertNull(manager.getRoot());
        assertEquals(0, manager.panelCount());
        assertTrue(manager.getFlatPanelList().isEmpty());
        assertEquals(3, received.size());
        assertTrue(manager.addPanel("a", "A", "A.qml").isSuccess());
    }

    @Test
    void setMinPanelSize_clampsAndNotifiesOnChange() {
        assertEquals(150.0, manager.getMinPanelSize());

        manager.setMinPanelSize(10);
        assertEquals(50.0, manager.getMinPanelSize());
        assertEquals(List.of(LayoutChange.of(LayoutChangeType.MIN_PANEL_SIZE_CHANGED)), received);

        received.clear();
        manager.setMinPanelSize(20);
        assertTrue(received.isEmpty());
    }

    @Test
    void setDevMode_togglesAndNotifiesOnChange() {
        assertFalse(manager.isDevMode());

        assertTrue(manager.setDevMode(true).isSuccess());
        assertTrue(manager.isDevMode());
        assertEquals(List.of(LayoutChange.of(LayoutChangeType.DEV_MODE_CHANGED)), received);

        received.clear();
        LayoutResult unchanged = manager.setDevMode(true);
        assertTrue(unchanged.isSuccess());
        assertTrue(unchanged.getChanges().isEmpty());
        assertTrue(received.isEmpty());

        manager.setDevMode(false);
        assertFalse(manager.isDevMode());
        assertEquals(List.of(LayoutChange.of(LayoutChangeType.DEV_MODE_CHANGED)), received);

        assertTrue(new DockingManager(DockConfig.builder().devMode(true).build()).isDevMode());
    }

    // ---------------------------------------------------------------- persistence

    @Test
    void saveAndLoad_restoresEquivalentTree() {
        addThree();
        manager.updateSplitRatio(manager.getRoot().getId(), 0.25);
        panel("c").setClosable(false);
        LayoutDocument saved = manager.saveLayout();

        DockingManager restored = new DockingManager();
        LayoutResult result = restored.loadLayout(saved);

        assertTrue(result.isSuccess());
        assertEquals(manager.dumpTree(), restored.dumpTree());
        assertEquals(3, restored.panelCount());
        assertFalse(restored.findPanel("c").orElseThrow().isClosable());
        assertEquals(saved, restored.saveLayout());
        assertTrue(restored.validate().isValid());
    }

    @Test
    void saveAndLoad_emptyTree() {
        LayoutDocument saved = manager.saveLayout();
        assertNull(saved.getRoot());

        addThree();
        assertTrue(manager.loadLayout(saved).isSuccess());

        assertNull(manager.getRoot());
        assertEquals(0, manager.panelCount());
    }

    @Test
    void loadLayout_versionMismatchLeavesTreeUntouched() {
        addThree();
        String before = manager.dumpTree();
        LayoutDocument current = manager.saveLayout();

        LayoutResult result = manager.loadLayout(new LayoutDocument("1.0", 150.0, current.getRoot()));

        assertEquals(LayoutError.VERSION_MISMATCH, result.getError());
        assertEquals(before, manager.dumpTree());
        assertEquals(3, manager.panelCount());
    }

    @Test
    void loadLayout_malformedDocumentLeavesTreeUntouched() {
        addThree();
        String before = manager.dumpTree();
        LayoutDocument bad = LayoutTreeConfig.fromJson("""
                {"version":"2.0","root":{"type":"split","id":"s","orientation":"vertical",
                 "first":{"type":"panel","id":"x","title":"X"},
                 "second":{"type":"mystery","id":"y"}}}
                """);

        LayoutResult result = manager.loadLayout(bad);

        assertEquals(LayoutError.INVALID_ARGUMENT, result.getError());
        assertEquals(before, manager.dumpTree());
        assertTrue(manager.findPanel("x").isEmpty());
        assertEquals(LayoutError.INVALID_ARGUMENT, manager.loadLayout(null).getError());
    }

    @Test
    void loadLayout_appliesDocumentMinPanelSize() {
        LayoutDocument doc = LayoutTreeConfig.fromJson("""
                {"version":"2.0","minPanelSize":300,"root":{"type":"panel","id":"p","title":"P","contentRef":"P.qml"}}
                """);

        LayoutResult result = manager.loadLayout(doc);

        assertEquals(300.0, manager.getMinPanelSize());
        assertEquals(300.0, panel("p").getMinSize());
        assertTrue(result.getChanges().contains(LayoutChange.of(LayoutChangeType.MIN_PANEL_SIZE_CHANGED)));
    }

    @Test
    void saveLayoutToFile_thenLoadLayoutFromFile() throws Exception {
        addThree();
        Path file = tempDir.resolve("layouts/layout.json");

        assertTrue(manager.saveLayoutToFile(file).isSuccess());
        String json = Files.readString(file);
        assertTrue(json.contains("\"version\" : \"2.0\""));

        DockingManager restored = new DockingManager();
        assertTrue(restored.loadLayoutFromFile(file).isSuccess());
        assertEquals(manager.dumpTree(), restored.dumpTree());
    }

    @Test
    void fileOperations_reportFailures() throws Exception {
        addThree();
        String before = manager.dumpTree();
        Path malformed = Files.writeString(tempDir.resolve("bad.json"), "{ nope");
        Path notObject = Files.writeString(tempDir.resolve("array.json"), "[]");
        Path directory = Files.createDirectories(tempDir.resolve("dir"));

        assertEquals(LayoutError.IO_FAILURE, manager.loadLayoutFromFile(tempDir.resolve("missing.json")).getError());
        assertEquals(LayoutError.INVALID_ARGUMENT, manager.loadLayoutFromFile(malformed).getError());
        assertEquals(LayoutError.INVALID_ARGUMENT, manager.loadLayoutFromFile(notObject).getError());
        assertEquals(LayoutError.IO_FAILURE, manager.saveLayoutToFile(directory).getError());
        assertEquals(before, manager.dumpTree());
    }

    @Test
    void loadLayoutFromFile_rejectsNumericVersion() throws Exception {
        addThree();
        String before = manager.dumpTree();
        Path numeric = Files.writeString(tempDir.resolve("numeric.json"), """
                {"version":2.0,"root":{"type":"panel","id":"x","title":"X","contentRef":"X.qml"}}
                """);

        LayoutResult result = manager.loadLayoutFromFile(numeric);

        assertEquals(LayoutError.INVALID_ARGUMENT, result.getError());
        assertEquals(before, manager.dumpTree());
        assertTrue(manager.findPanel("x").isEmpty());
    }

    @Test
    void getDefaultLayoutPath_usesConfiguredDirectory() {
        Path layoutDir = tempDir.resolve("config-dir");
        DockingManager m = new DockingManager(DockConfig.builder()
                .layoutDir(layoutDir.toString())
                .layoutFileName("dock.json")
                .build());

        Path path = m.getDefaultLayoutPath();

        assertEquals(layoutDir.toAbsolutePath().resolve("dock.json"), path);
        assertTrue(Files.isDirectory(layoutDir));
    }

    @Test
    void getDefaultLayoutPath_findsProjectRoot() throws Exception {
        Path project = tempDir.toRealPath().resolve("app");
        Path start = Files.createDirectories(project.resolve("build/bin"));
        Files.writeString(project.resolve("pom.xml"), "<project/>");

        assertEquals(project.resolve("layout.json"), manager.getDefaultLayoutPath(start));
    }

    // ---------------------------------------------------------------- inspection

    @Test
    void devMode_mutationsStillSucceed() {
        DockingManager m = new DockingManager(DockConfig.builder().devMode(true).minPanelSize(2000).build());

        assertEquals(1000.0, m.getMinPanelSize());
        assertTrue(m.addPanel("a", "A", "A.qml").isSuccess());
        assertTrue(m.addPanel("b", "B", "B.qml").isSuccess());
        assertTrue(m.removePanel("a").isSuccess());
        assertEquals(1, m.panelCount());
    }


    @Test
    void dumpTree_rendersIndentedStructure() {
        assertEquals("Empty tree", manager.dumpTree());

        manager.addPanel("a", "Alpha", "A.qml");
        manager.addPanelAt("b", "Beta", "B.qml", "a", Direction.BOTTOM);
        String splitId = manager.getRoot().getId();

        assertEquals("Split[" + splitId + "]: H (ratio: 0.5)\n"
                + "  Panel[a]: Alpha\n"
                + "  Panel[b]: Beta\n", manager.dumpTree());
    }

    @Test
    void getFlatPanelList_isDepthFirstFirstChildFirst() {
        addThree();
        manager.addPanelAt("d", "D", "D.qml", "a", Direction.LEFT);

        assertEquals(List.of("d", "a", "b", "c"),
                manager.getFlatPanelList().stream().map(PanelNode::getId).toList());
    }

    @Test
    void validate_emptyLayoutIsReportedAsError() {
        assertFalse(manager.validate().isValid());
        manager.addPanel("a", "A", "A.qml");
        assertTrue(manager.validate().isValid());
    }

    private static void collectIds(LayoutNode node, Collection<String> ids) {
        if (node == null) return;
        ids.add(node.getId());
        if (node instanceof SplitNode split) {
            collectIds(split.getChild(ChildSlot.FIRST), ids);
            collectIds(split.getChild(ChildSlot.SECOND), ids);
        }
    }
}
