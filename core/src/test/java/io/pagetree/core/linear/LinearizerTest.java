package io.pagetree.core.linear;

import io.pagetree.core.FieldState;
import io.pagetree.core.NodeId;
import io.pagetree.core.Page;
import io.pagetree.core.PageComment;
import io.pagetree.core.PageField;
import io.pagetree.core.PageTree;
import io.pagetree.core.PageTrees;
import io.pagetree.core.TreeMutations;
import io.pagetree.core.TreeNode;
import org.junit.jupiter.api.Test;
import org.pcollections.TreePVector;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LinearizerTest {

    private static List<Page> pages(int n) {
        var out = new ArrayList<Page>();
        for (int i = 0; i < n; i++) out.add(Page.of(i, new FieldState("board-" + i), "c" + i));
        return out;
    }

    @Test
    void already_linear_pairs_are_returned_unchanged() {
        var pages = pages(3);
        var tree = PageTrees.createTreeFromPages(3);
        var result = Linearizer.normalize(tree, pages);
        assertFalse(result.changed());
        assertSame(tree, result.tree());
        assertSame(pages, result.pages());
    }

    @Test
    void branch_order_is_pre_order_and_normalization_is_idempotent() {
        // n0(0) -> n1(1) -> n2(2); add page 3 as an inserted child of n0
        var tree = PageTrees.createTreeFromPages(3);
        var added = TreeMutations.insertNode(tree, new NodeId("n0"), 3);
        var pages = new ArrayList<>(pages(3));
        pages.add(Page.of(3, new FieldState("board-3"), "c3"));

        var first = Linearizer.normalize(added.tree(), pages);
        assertTrue(first.changed());
        assertEquals(List.of("board-0", "board-3", "board-1", "board-2"),
                first.pages().stream().map(p -> ((PageField.Value) p.field()).state().encoded()).toList());
        assertEquals(List.of(0, 1, 2, 3), first.tree().preOrder().stream().map(TreeNode::pageIndex).toList());
        assertEquals(1, first.remap(3));

        var second = Linearizer.normalize(first.tree(), first.pages());
        assertFalse(second.changed());
    }

    @Test
    void unreachable_pages_go_last_in_previous_order() {
        var tree = PageTree.of(List.of(
                TreeNode.leaf(new NodeId("a"), 2, null)), new NodeId("a"));
        var result = Linearizer.normalize(tree, pages(3));
        assertEquals(List.of("c2", "c0", "c1"),
                result.pages().stream().map(p -> ((PageComment.Text) p.comment()).text()).toList());
        assertEquals(0, result.tree().root().pageIndex());
    }

    @Test
    void references_that_would_point_forward_are_materialized() {
        var pages = new ArrayList<>(pages(2));
        pages.add(new Page(2, PageField.ref(1), PageComment.ref(0), pages.get(1).flags()));
        // Tree order puts page 2 before page 1.
        var tree = PageTrees.ensureVirtualRoot(PageTree.of(List.of(
                new TreeNode(new NodeId("a"), 0, null, TreePVector.singleton(new NodeId("c"))),
                TreeNode.leaf(new NodeId("c"), 2, new NodeId("a")),
                TreeNode.leaf(new NodeId("b"), 1, null)), new NodeId("a")));

        var result = Linearizer.normalize(tree, pages);
        Page moved = result.pages().get(1);
        assertEquals(PageField.value(new FieldState("board-1")), moved.field());
        assertEquals(PageComment.ref(0), moved.comment());
    }
}
