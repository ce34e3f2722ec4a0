package io.pagetree.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Random;

import static io.pagetree.core.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

class TreeMutationsTest {

    @Test
    void add_branch_appends_and_remove_splices_children_into_the_slot() {
        var t = tree("A", node("A", 0, null, "B"), node("B", 1, "A", "D"), node("D", 3, "B"));

        var added = TreeMutations.addBranchNode(t, id("A"), 2);
        assertTrue(added.added());
        NodeId c = added.newNodeId();
        assertEquals(List.of(id("B"), c), children(added.tree(), "A"));
        assertValid(added.tree());

        var removed = TreeMutations.removeNode(added.tree(), id("B"), false);
        assertEquals(List.of(id("D"), c), children(removed, "A"));
        assertEquals(id("A"), parent(removed, "D"));
        assertTrue(removed.findNode(id("B")).isEmpty());
        assertValid(removed);
    }

    @Test
    void insert_node_takes_over_the_main_route() {
        var added = TreeMutations.insertNode(abcd(), id("A"), 4);
        NodeId x = added.newNodeId();
        var t = added.tree();

        assertEquals(List.of(x, id("C")), children(t, "A"));
        assertEquals(List.of(id("B")), children(t, x.value()));
        assertEquals(x, parent(t, "B"));
        assertValid(t);
    }

    @Test
    void insert_under_a_leaf_behaves_like_add_branch() {
        var added = TreeMutations.insertNode(abcd(), id("C"), 4);
        assertEquals(List.of(added.newNodeId()), children(added.tree(), "C"));
        assertValid(added.tree());
    }

    @Test
    void unknown_parent_is_a_no_op() {
        var t = abcd();
        var added = TreeMutations.addBranchNode(t, id("nope"), 4);
        assertFalse(added.added());
        assertSame(t, added.tree());
    }

    @Test
    void remove_with_descendants_drops_the_subtree() {
        var t = TreeMutations.removeNode(abcd(), id("B"), true);
        assertEquals(ids("C"), children(t, "A"));
        assertEquals(2, t.size());
        assertValid(t);
    }

    @Test
    void removing_the_root_promotes_its_first_child() {
        var t = TreeMutations.removeNode(abcd(), id("A"), false);
        assertEquals(id("B"), t.rootId());
        assertEquals(ids("C", "D"), children(t, "B"));
        assertValid(t);
    }

    @Test
    void last_node_virtual_root_and_whole_tree_are_not_removable() {
        var single = tree("A", node("A", 0, null));
        assertSame(single, TreeMutations.removeNode(single, id("A"), false));

        var t = abcd();
        assertSame(t, TreeMutations.removeNode(t, id("A"), true));

        var forest = PageTrees.ensureVirtualRoot(tree("A", node("A", 0, null), node("B", 1, null)));
        assertSame(forest, TreeMutations.removeNode(forest, forest.rootId(), false));
    }

    @Test
    void can_move_node_rules() {
        var t = abcd();
        assertFalse(TreeMutations.canMoveNode(t, id("B"), id("B"), true));
        assertFalse(TreeMutations.canMoveNode(t, id("B"), id("D"), false));
        assertTrue(TreeMutations.canMoveNode(t, id("B"), id("D"), true));
        assertTrue(TreeMutations.canMoveNode(t, id("C"), id("D"), false));
        assertFalse(TreeMutations.canMoveNode(t, id("C"), id("missing"), true));
    }

    @Test
    void move_single_node_leaves_children_behind() {
        var t = TreeMutations.moveNodeToParent(abcd(), id("B"), id("C"));
        assertEquals(ids("D", "C"), children(t, "A"));
        assertEquals(ids("B"), children(t, "C"));
        assertTrue(children(t, "B").isEmpty());
        assertValid(t);
    }

    @Test
    void move_single_node_onto_its_own_descendant() {
        var t = TreeMutations.moveNodeToParent(abcd(), id("B"), id("D"));
        assertEquals(ids("D", "C"), children(t, "A"));
        assertEquals(ids("B"), children(t, "D"));
        assertValid(t);
    }

    @Test
    void move_to_insert_position_hands_the_previous_first_child_down() {
        var t = TreeMutations.moveNodeToInsertPosition(abcd(), id("C"), id("B"));
        assertEquals(ids("B"), children(t, "A"));
        assertEquals(ids("C"), children(t, "B"));
        assertEquals(ids("D"), children(t, "C"));
        assertValid(t);
    }

    @Test
    void moving_the_root_reroots_first() {
        var t = TreeMutations.moveNodeToParent(abcd(), id("A"), id("C"));
        assertEquals(id("B"), t.rootId());
        assertEquals(ids("C", "D"), children(t, "B"));
        assertEquals(ids("A"), children(t, "C"));
        assertValid(t);
    }

    @Test
    void subtree_move_carries_children_and_rejects_descendant_targets() {
        var moved = TreeMutations.moveSubtreeToParent(abcd(), id("B"), id("C"));
        assertEquals(ids("C"), children(moved, "A"));
        assertEquals(ids("B"), children(moved, "C"));
        assertEquals(ids("D"), children(moved, "B"));
        assertValid(moved);

        var t = abcd();
        assertSame(t, TreeMutations.moveSubtreeToParent(t, id("B"), id("D")));
        assertSame(t, TreeMutations.moveSubtreeToParent(t, id("A"), id("C")));
    }

    @Test
    void subtree_insert_prepends_the_previous_first_child() {
        var t = TreeMutations.moveSubtreeToInsertPosition(abcd(), id("C"), id("B"));
        assertEquals(ids("B"), children(t, "A"));
        assertEquals(ids("C"), children(t, "B"));
        assertEquals(ids("D"), children(t, "C"));
        assertValid(t);
    }

    @Test
    void right_siblings_travel_together() {
        var t = tree("A",
                node("A", 0, null, "B", "C", "E"),
                node("B", 1, "A", "D"),
                node("C", 2, "A"),
                node("D", 3, "B"),
                node("E", 4, "A"));
        var moved = TreeMutations.moveNodeWithRightSiblingsToParent(t, id("C"), id("D"));
        assertEquals(ids("B"), children(moved, "A"));
        assertEquals(ids("C", "E"), children(moved, "D"));
        assertValid(moved);

        assertSame(t, TreeMutations.moveNodeWithRightSiblingsToParent(t, id("A"), id("C")));
    }

    @Test
    void moving_x_onto_its_descendant_without_permission_is_rejected() {
        var t = abcd();
        assertFalse(TreeMutations.canMoveNode(t, id("A"), id("D"), false));
        assertSame(t, TreeMutations.moveSubtreeToParent(t, id("B"), id("D")));
        assertSame(t, TreeMutations.moveNodeWithRightSiblingsToParent(t, id("B"), id("D")));
    }

    @Test
    void reroot_by_first_child_leaves_old_root_detached() {
        var t = TreeMutations.rerootByFirstChild(abcd());
        assertEquals(id("B"), t.rootId());
        assertEquals(ids("C", "D"), children(t, "B"));
        var oldRoot = t.findNode(id("A")).orElseThrow();
        assertNull(oldRoot.parentId());
        assertFalse(oldRoot.hasChildren());
    }

    @Test
    void detach_and_attach_compose_a_move() {
        var detached = TreeMutations.detachSubtree(abcd(), id("B"));
        assertNull(parent(detached, "B"));
        assertFalse(TreeValidator.validate(detached).valid());

        var attached = TreeMutations.attach(detached, id("B"), id("C"), Placement.BRANCH);
        assertEquals(ids("B"), children(attached, "C"));
        assertValid(attached);

        // Only detached nodes can be attached.
        assertSame(attached, TreeMutations.attach(attached, id("C"), id("D"), Placement.BRANCH));
    }

    @Test
    void update_page_indices_skips_the_virtual_root() {
        var forest = PageTrees.ensureVirtualRoot(tree("A", node("A", 0, null), node("B", 1, null)));
        var t = TreeMutations.updateTreePageIndices(forest, Map.of(0, 1, 1, 0, -1, 5));
        assertEquals(1, t.findNode(id("A")).orElseThrow().pageIndex());
        assertEquals(0, t.findNode(id("B")).orElseThrow().pageIndex());
        assertTrue(t.root().isVirtual());
    }

    @Test
    void page_insert_and_remove_keep_indices_in_sync() {
        var linear = PageTrees.createTreeFromPages(3);
        var grown = TreeMutations.insertPageIntoTree(linear, 1, 0);
        assertEquals(4, grown.size());
        assertValid(grown);
        assertEquals(List.of(0, 1, 2, 3), grown.preOrder().stream().map(TreeNode::pageIndex).toList());

        var shrunk = TreeMutations.removePageFromTree(grown, 1);
        assertValid(shrunk);
        assertEquals(List.of(0, 1, 2), shrunk.preOrder().stream().map(TreeNode::pageIndex).toList());

        var several = TreeMutations.insertPagesIntoTree(linear, 3, 2, 2);
        assertEquals(List.of(0, 1, 2, 3, 4), several.preOrder().stream().map(TreeNode::pageIndex).toList());
        assertEquals(List.of(0, 1, 2), TreeMutations.removePagesFromTree(several, 3, 5)
                .preOrder().stream().map(TreeNode::pageIndex).toList());
    }

    @Test
    void page_without_a_parent_node_becomes_a_branch_of_the_root() {
        var t = TreeMutations.insertPageIntoTree(abcd(), 1, 99);
        var rootChildren = children(t, "A");
        assertEquals(3, rootChildren.size());
        assertEquals(ids("B", "C"), rootChildren.subList(0, 2));

        var added = t.findNode(rootChildren.get(2)).orElseThrow();
        assertEquals(1, added.pageIndex());
        assertFalse(added.hasChildren());
        assertEquals(ids("D"), children(t, "B"));
        assertEquals(2, t.findNode(id("B")).orElseThrow().pageIndex());
        assertValid(t);
    }

    @Test
    void random_operation_sequences_keep_the_tree_valid() {
        var random = new Random(42);
        var tree = PageTrees.createTreeFromPages(4);
        int nextPage = 4;
        for (int step = 0; step < 2_000; step++) {
            var ids = tree.preOrder().stream().filter(n -> !n.isVirtual()).map(TreeNode::id).toList();
            NodeId a = ids.get(random.nextInt(ids.size()));
            NodeId b = ids.get(random.nextInt(ids.size()));
            PageTree next = switch (random.nextInt(8)) {
                case 0 -> TreeMutations.addBranchNode(tree, a, nextPage++).tree();
                case 1 -> TreeMutations.insertNode(tree, a, nextPage++).tree();
                case 2 -> TreeMutations.removeNode(tree, a, random.nextBoolean());
                case 3 -> TreeMutations.moveNodeToParent(tree, a, b);
                case 4 -> TreeMutations.moveNodeToInsertPosition(tree, a, b);
                case 5 -> TreeMutations.moveSubtreeToParent(tree, a, b);
                case 6 -> TreeMutations.moveSubtreeToInsertPosition(tree, a, b);
                default -> TreeMutations.moveNodeWithRightSiblingsToParent(tree, a, b);
            };
            var result = TreeValidator.validate(next);
            assertTrue(result.valid(), () -> "step produced " + result.errors());
            tree = next;
        }
    }
}
