package io.pagetree.core;

import org.pcollections.PMap;
import org.pcollections.PVector;
import org.pcollections.TreePVector;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Factories and whole-tree helpers that are not single structural edits.
 */
public final class PageTrees {

    private PageTrees() {}

    /**
     * Linear chain over pages {@code 0..pageCount-1}: page 0 is the root and every page is
     * the only child of the previous one. Zero pages yield the empty tree.
     */
    public static PageTree createTreeFromPages(int pageCount) {
        if (pageCount <= 0) return PageTree.empty();
        var ids = new ArrayList<NodeId>(pageCount);
        for (int i = 0; i < pageCount; i++) {
            ids.add(new NodeId("n" + i));
        }
        var nodes = new ArrayList<TreeNode>(pageCount);
        for (int i = 0; i < pageCount; i++) {
            NodeId parent = i == 0 ? null : ids.get(i - 1);
            PVector<NodeId> children = i + 1 < pageCount
                    ? TreePVector.singleton(ids.get(i + 1))
                    : TreePVector.empty();
            nodes.add(new TreeNode(ids.get(i), i, parent, children));
        }
        return PageTree.of(nodes, ids.get(0));
    }

    /** Same as {@link #createTreeFromPages(int)} sized to {@code pages}. */
    public static PageTree createTreeFromPages(List<Page> pages) {
        return createTreeFromPages(pages.size());
    }

    /**
     * Repair a forest into a tree. When several nodes have no parent (or the root id does not
     * name a parentless node) they are gathered under one virtual root: an existing virtual
     * node if there is one, otherwise a new one. The declared root goes first, the rest
     * follow by page index. Already well-rooted trees are returned as-is.
     */
    public static PageTree ensureVirtualRoot(PageTree tree) {
        if (tree.isEmpty()) return tree;

        var parentless = new ArrayList<TreeNode>();
        for (TreeNode n : tree.nodes().values()) {
            if (n.parentId() == null) parentless.add(n);
        }
        if (parentless.isEmpty()) return tree; // cyclic; the validator reports it
        if (parentless.size() == 1) {
            NodeId only = parentless.get(0).id();
            return only.equals(tree.rootId()) ? tree : tree.with(tree.nodes(), only);
        }

        TreeNode virtual = null;
        for (TreeNode n : parentless) {
            if (n.isVirtual()) {
                virtual = n;
                break;
            }
        }
        PMap<NodeId, TreeNode> nodes = tree.nodes();
        if (virtual == null) {
            virtual = TreeNode.virtualRoot(tree.allocateId());
            nodes = nodes.plus(virtual.id(), virtual);
        }
        NodeId declaredRoot = tree.rootId();
        NodeId virtualId = virtual.id();
        var tops = new ArrayList<TreeNode>(parentless);
        tops.removeIf(n -> n.id().equals(virtualId));
        tops.sort(Comparator.<TreeNode>comparingInt(n -> n.id().equals(declaredRoot) ? 0 : 1)
                .thenComparingInt(TreeNode::pageIndex)
                .thenComparing(TreeNode::id));

        PVector<NodeId> children = virtual.childrenIds();
        for (TreeNode top : tops) {
            children = children.plus(top.id());
            nodes = nodes.plus(top.id(), top.withParent(virtualId));
        }
        nodes = nodes.plus(virtualId, virtual.withChildren(children));
        return tree.with(nodes, virtualId);
    }

    /**
     * Node the editor should focus after loading: the root, or the first real child when the
     * root is virtual. Null for an empty tree or a childless virtual root.
     */
    public static NodeId getDefaultActiveNodeId(PageTree tree) {
        TreeNode root = tree.root();
        if (root == null) return null;
        return root.isVirtual() ? root.firstChild() : root.id();
    }

    /**
     * Combine two independent trees into one. The incoming tree's page indices are shifted
     * by {@code pageOffset} and its ids are reallocated so they cannot collide. The result
     * has a virtual root whose children are the base tree's top-level sequences followed by
     * the incoming tree's.
     */
    public static PageTree mergeIndependentTrees(PageTree base, PageTree incoming, int pageOffset) {
        PageTree b = ensureVirtualRoot(base);
        PageTree in = ensureVirtualRoot(incoming);
        if (in.isEmpty()) return b;
        if (b.isEmpty()) return offsetOnly(in, pageOffset);

        b = wrapInVirtualRoot(b);
        TreeNode virtual = b.root();
        PMap<NodeId, TreeNode> nodes = b.nodes();

        // Reallocate incoming ids against the growing result.
        Map<NodeId, NodeId> renamed = new HashMap<>();
        PageTree scratch = b;
        for (TreeNode n : in.preOrder()) {
            if (n.isVirtual()) continue;
            NodeId fresh = scratch.allocateId();
            renamed.put(n.id(), fresh);
            scratch = scratch.with(scratch.nodes().plus(fresh, TreeNode.leaf(fresh, 0, null)), scratch.rootId());
        }

        TreeNode inRoot = in.root();
        List<NodeId> tops = inRoot.isVirtual() ? inRoot.childrenIds() : List.of(inRoot.id());
        for (TreeNode n : in.preOrder()) {
            if (n.isVirtual()) continue;
            NodeId id = renamed.get(n.id());
            NodeId parent = tops.contains(n.id()) ? virtual.id() : renamed.get(n.parentId());
            PVector<NodeId> children = TreePVector.empty();
            for (NodeId c : n.childrenIds()) {
                children = children.plus(renamed.get(c));
            }
            nodes = nodes.plus(id, new TreeNode(id, n.pageIndex() + pageOffset, parent, children));
        }
        PVector<NodeId> rootChildren = virtual.childrenIds();
        for (NodeId top : tops) {
            rootChildren = rootChildren.plus(renamed.get(top));
        }
        nodes = nodes.plus(virtual.id(), virtual.withChildren(rootChildren));
        return b.with(nodes, virtual.id());
    }

    /** Put a virtual root above a real root; trees already rooted virtually are returned as-is. */
    public static PageTree wrapInVirtualRoot(PageTree tree) {
        TreeNode root = tree.root();
        if (root == null || root.isVirtual()) return tree;
        NodeId virtualId = tree.allocateId();
        PMap<NodeId, TreeNode> nodes = tree.nodes()
                .plus(virtualId, new TreeNode(virtualId, TreeNode.VIRTUAL_PAGE_INDEX, null,
                        TreePVector.singleton(root.id())))
                .plus(root.id(), root.withParent(virtualId));
        return tree.with(nodes, virtualId);
    }

    private static PageTree offsetOnly(PageTree tree, int pageOffset) {
        if (pageOffset == 0) return tree;
        var map = new HashMap<Integer, Integer>();
        for (TreeNode n : tree.nodes().values()) {
            if (!n.isVirtual()) map.put(n.pageIndex(), n.pageIndex() + pageOffset);
        }
        return TreeMutations.updateTreePageIndices(tree, map);
    }
}
