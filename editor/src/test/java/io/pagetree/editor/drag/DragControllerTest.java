package io.pagetree.editor.drag;

import io.pagetree.core.FieldState;
import io.pagetree.core.NodeId;
import io.pagetree.core.Page;
import io.pagetree.core.PageComment;
import io.pagetree.core.PageTree;
import io.pagetree.core.TreeNode;
import io.pagetree.editor.AddMode;
import io.pagetree.editor.DocumentState;
import io.pagetree.editor.EditCommitter;
import io.pagetree.storage.HistoryJournal;
import org.junit.jupiter.api.Test;
import org.pcollections.TreePVector;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DragControllerTest {

    private final HistoryJournal journal = new HistoryJournal(10);

    private DragController controller(boolean subtree) {
        return new DragController(new EditCommitter(journal), subtree);
    }

    private static NodeId id(String v) { return new NodeId(v); }

    private static TreeNode node(String id, int page, String parent, String... children) {
        var ids = new ArrayList<NodeId>();
        for (String c : children) ids.add(id(c));
        return new TreeNode(id(id), page, parent == null ? null : id(parent), TreePVector.from(ids));
    }

    private static DocumentState doc(PageTree tree, int pageCount) {
        var pages = new ArrayList<Page>();
        for (int i = 0; i < pageCount; i++) pages.add(Page.of(i, new FieldState("f" + i), "p" + i));
        return new DocumentState(pages, 0, tree, tree.rootId(), true, AddMode.BRANCH, 0, 0);
    }

    /** A(0) with children B(1), C(2). */
    private static DocumentState abc() {
        return doc(PageTree.of(List.of(
                node("A", 0, null, "B", "C"),
                node("B", 1, "A"),
                node("C", 2, "A")), id("A")), 3);
    }

    /** A(0) ─┬─ B(1) ── D(3), └─ C(2). */
    private static DocumentState abcd() {
        return doc(PageTree.of(List.of(
                node("A", 0, null, "B", "C"),
                node("B", 1, "A", "D"),
                node("C", 2, "A"),
                node("D", 3, "B")), id("A")), 4);
    }

    private static List<NodeId> children(DocumentState d, String id) {
        return d.tree().findNode(id(id)).orElseThrow().childrenIds();
    }

    private static List<String> comments(DocumentState d) {
        return d.pages().stream().map(p -> ((PageComment.Text) p.comment()).text()).toList();
    }

    @Test
    void dropping_the_root_on_a_branch_button_reroots_first() {
        var dc = controller(false);
        var doc = abc();
        var drag = dc.start(DragState.idle(DragMode.ATTACH_SINGLE), doc.tree(), id("A"));
        drag = dc.hoverButton(drag, doc.tree(), id("C"), ButtonType.BRANCH);
        assertTrue(drag.hasButtonTarget());

        var outcome = dc.commit(drag, doc);
        assertTrue(outcome.committed());
        assertFalse(outcome.dragState().isDragging());

        var after = outcome.document();
        assertEquals(id("B"), after.tree().rootId());
        assertEquals(List.of(id("C")), children(after, "B"));
        assertEquals(List.of(id("A")), children(after, "C"));
        assertEquals(List.of("p1", "p2", "p0"), comments(after));
        assertEquals(1, journal.undoCount());
    }

    @Test
    void single_node_drop_onto_a_descendant_leaves_children_behind() {
        var dc = controller(false);
        var doc = abcd();
        var drag = dc.start(DragState.idle(DragMode.ATTACH_SINGLE), doc.tree(), id("B"));
        drag = dc.hoverNode(drag, doc.tree(), id("D"));
        assertEquals(id("D"), drag.targetNodeId());

        var after = dc.commit(drag, doc).document();
        assertEquals(List.of(id("D"), id("C")), children(after, "A"));
        assertEquals(List.of(id("B")), children(after, "D"));
        assertEquals(List.of("p0", "p3", "p1", "p2"), comments(after));
    }

    @Test
    void branch_mode_rejects_descendant_targets_and_the_root() {
        var dc = controller(false);
        var doc = abcd();
        var drag = dc.start(DragState.idle(DragMode.ATTACH_BRANCH), doc.tree(), id("B"));
        assertNull(dc.hoverNode(drag, doc.tree(), id("D")).targetNodeId());
        assertEquals(id("C"), dc.hoverNode(drag, doc.tree(), id("C")).targetNodeId());

        var fromRoot = dc.start(DragState.idle(DragMode.ATTACH_BRANCH), doc.tree(), id("A"));
        assertNull(dc.hoverNode(fromRoot, doc.tree(), id("C")).targetNodeId());
    }

    @Test
    void subtree_buttons_refuse_descendants_and_the_root() {
        var dc = controller(true);
        var doc = abcd();
        var drag = dc.start(DragState.idle(DragMode.ATTACH_SINGLE), doc.tree(), id("B"));
        assertFalse(dc.hoverButton(drag, doc.tree(), id("D"), ButtonType.INSERT).hasButtonTarget());

        drag = dc.hoverButton(drag, doc.tree(), id("C"), ButtonType.BRANCH);
        var after = dc.commit(drag, doc).document();
        assertEquals(List.of(id("C")), children(after, "A"));
        assertEquals(List.of(id("B")), children(after, "C"));
        assertEquals(List.of(id("D")), children(after, "B"));

        var fromRoot = dc.start(DragState.idle(DragMode.ATTACH_SINGLE), doc.tree(), id("A"));
        assertFalse(dc.hoverButton(fromRoot, doc.tree(), id("C"), ButtonType.BRANCH).hasButtonTarget());
        assertFalse(dc.hoverButton(fromRoot, doc.tree(), id("C"), ButtonType.DELETE).hasButtonTarget());
    }

    @Test
    void delete_button_removes_the_node_but_keeps_the_page() {
        var dc = controller(false);
        var doc = abcd();
        var drag = dc.start(DragState.idle(DragMode.ATTACH_SINGLE), doc.tree(), id("C"));
        drag = dc.hoverButton(drag, doc.tree(), id("A"), ButtonType.DELETE);

        var after = dc.commit(drag, doc).document();
        assertEquals(3, after.tree().size());
        assertEquals(List.of("p0", "p1", "p3", "p2"), comments(after));
    }

    @Test
    void reorder_mode_never_commits_in_the_tree_view() {
        var dc = controller(false);
        var doc = abc();
        var drag = dc.start(DragState.idle(DragMode.REORDER), doc.tree(), id("B"));
        drag = dc.hoverSlot(dc.hoverNode(drag, doc.tree(), id("C")), 0);
        assertNull(drag.targetNodeId());

        var outcome = dc.commit(drag, doc);
        assertFalse(outcome.committed());
        assertEquals(DragMode.REORDER, outcome.dragState().mode());
        assertEquals(0, journal.undoCount());
    }

    @Test
    void dropping_nowhere_or_where_it_already_is_changes_nothing() {
        var dc = controller(false);
        var doc = abc();
        var drag = dc.start(DragState.idle(DragMode.ATTACH_SINGLE), doc.tree(), id("B"));
        assertFalse(dc.commit(drag, doc).committed());

        var unknown = dc.start(DragState.idle(DragMode.ATTACH_SINGLE), doc.tree(), id("ghost"));
        assertFalse(unknown.isDragging());

        var leaving = dc.leaveButton(dc.hoverButton(drag, doc.tree(), id("C"), ButtonType.BRANCH));
        assertFalse(leaving.hasButtonTarget());
        assertEquals(0, journal.undoCount());
    }
}
