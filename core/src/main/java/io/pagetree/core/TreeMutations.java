// file: src/main/java/io/pagetree/core/TreeMutations.java
package io.pagetree.core;

import org.pcollections.PMap;
import org.pcollections.PVector;
import org.pcollections.TreePVector;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Pure structural edits on a {@link PageTree}.
 * <p>
 * Contract:
 *  - Every function returns a new tree and never touches its input.
 *  - An operation that does not apply (unknown id, cycle, last node, virtual node) returns
 *    the input instance unchanged, so callers detect no-ops with {@code result == tree}.
 *  - Results are not validated here; callers run {@link TreeValidator} before committing.
 * <p>
 * Every move is composed of two halves: a detach (the node leaves its parent) and an
 * {@link #attach} (the detached node lands under its target).
 */
public final class TreeMutations {

    private static final Logger log = Logger.getLogger(TreeMutations.class.getName());

    private TreeMutations() {}

    /** Result of an operation that creates a node. {@code newNodeId} is null on no-op. */
    public record Addition(PageTree tree, NodeId newNodeId) {
        public boolean added() { return newNodeId != null; }
    }

    // ---------------------------------------------------------------- creation

    /** New node as the last child of {@code parentId}. */
    public static Addition addBranchNode(PageTree tree, NodeId parentId, int pageIndex) {
        TreeNode parent = tree.get(parentId);
        if (parent == null) {
            log.fine(() -> "addBranchNode: unknown parent " + parentId);
            return new Addition(tree, null);
        }
        NodeId id = tree.allocateId();
        PMap<NodeId, TreeNode> nodes = tree.nodes()
                .plus(parentId, parent.withChildren(parent.childrenIds().plus(id)))
                .plus(id, TreeNode.leaf(id, pageIndex, parentId));
        return new Addition(tree.with(nodes, tree.rootId()), id);
    }

    /**
     * New node as the first child of {@code parentId}. The parent's previous first child
     * becomes the sole child of the new node. A childless parent behaves like
     * {@link #addBranchNode}.
     */
    public static Addition insertNode(PageTree tree, NodeId parentId, int pageIndex) {
        TreeNode parent = tree.get(parentId);
        if (parent == null) {
            log.fine(() -> "insertNode: unknown parent " + parentId);
            return new Addition(tree, null);
        }
        NodeId first = parent.firstChild();
        if (first == null) return addBranchNode(tree, parentId, pageIndex);

        NodeId id = tree.allocateId();
        TreeNode created = new TreeNode(id, pageIndex, parentId, TreePVector.singleton(first));
        PMap<NodeId, TreeNode> nodes = tree.nodes()
                .plus(parentId, parent.withChildren(parent.childrenIds().with(0, id)))
                .plus(first, tree.get(first).withParent(id))
                .plus(id, created);
        return new Addition(tree.with(nodes, tree.rootId()), id);
    }

    // ---------------------------------------------------------------- removal

    /**
     * Remove {@code nodeId}.
     * <ul>
     *   <li>{@code removeDescendants}: the whole subtree goes.</li>
     *   <li>otherwise the node's children take its slot in the parent; a root is replaced by
     *       its first child (see {@link #rerootByFirstChild}).</li>
     * </ul>
     * The virtual root, the last real node and a whole-tree subtree delete are refused.
     */
    public static PageTree removeNode(PageTree tree, NodeId nodeId, boolean removeDescendants) {
        TreeNode node = tree.get(nodeId);
        if (node == null) {
            log.fine(() -> "removeNode: unknown node " + nodeId);
            return tree;
        }
        if (node.isVirtual()) {
            log.fine("removeNode: the virtual root cannot be removed");
            return tree;
        }
        if (tree.realNodeCount() <= 1) {
            log.fine("removeNode: refusing to remove the last node");
            return tree;
        }

        PageTree result;
        if (removeDescendants) {
            if (node.parentId() == null) {
                log.fine("removeNode: refusing to remove the whole tree");
                return tree;
            }
            TreeNode parent = tree.get(node.parentId());
            PMap<NodeId, TreeNode> nodes = tree.nodes()
                    .minusAll(tree.getDescendants(nodeId))
                    .plus(parent.id(), parent.withChildren(parent.childrenIds().minus(nodeId)));
            result = tree.with(nodes, tree.rootId());
        } else {
            PageTree detached = detachLeavingChildren(tree, nodeId);
            if (detached == tree) return tree;
            result = detached.with(detached.nodes().minus(nodeId), detached.rootId());
        }

        if (result.realNodeCount() == 0) {
            log.fine("removeNode: refusing to leave only the virtual root");
            return tree;
        }
        return result;
    }

    // ---------------------------------------------------------------- moves

    /**
     * Whether {@code sourceId} may be moved under {@code targetId}.
     * The virtual root is never a source. Unless {@code allowDescendant}, the target may not
     * sit inside the source's subtree.
     */
    public static boolean canMoveNode(PageTree tree, NodeId sourceId, NodeId targetId, boolean allowDescendant) {
        if (sourceId == null || sourceId.equals(targetId)) return false;
        TreeNode source = tree.get(sourceId);
        if (source == null || !tree.contains(targetId)) return false;
        if (source.isVirtual()) return false;
        return allowDescendant || !tree.isDescendant(sourceId, targetId);
    }

    /** Move a single node to be the last child of {@code targetId}; its children stay behind. */
    public static PageTree moveNodeToParent(PageTree tree, NodeId sourceId, NodeId targetId) {
        return moveSingle(tree, sourceId, targetId, Placement.BRANCH);
    }

    /** Move a single node to be the first child of {@code targetId}; its children stay behind. */
    public static PageTree moveNodeToInsertPosition(PageTree tree, NodeId sourceId, NodeId targetId) {
        return moveSingle(tree, sourceId, targetId, Placement.INSERT);
    }

    /** Move a whole subtree to be the last child of {@code targetId}. */
    public static PageTree moveSubtreeToParent(PageTree tree, NodeId sourceId, NodeId targetId) {
        return moveSubtree(tree, sourceId, targetId, Placement.BRANCH);
    }

    /** Move a whole subtree to be the first child of {@code targetId}. */
    public static PageTree moveSubtreeToInsertPosition(PageTree tree, NodeId sourceId, NodeId targetId) {
        return moveSubtree(tree, sourceId, targetId, Placement.INSERT);
    }

    /**
     * Single-node move with the given placement. Targets inside the source's own subtree are
     * allowed: the source's children are spliced into its old slot first.
     */
    public static PageTree moveSingle(PageTree tree, NodeId sourceId, NodeId targetId, Placement placement) {
        if (!canMoveNode(tree, sourceId, targetId, true)) {
            log.fine(() -> "move rejected: " + sourceId + " -> " + targetId);
            return tree;
        }
        PageTree detached = detachLeavingChildren(tree, sourceId);
        if (detached == tree) return tree;
        return attach(detached, sourceId, targetId, placement);
    }

    /** Subtree move with the given placement. The root and descendant targets are rejected. */
    public static PageTree moveSubtree(PageTree tree, NodeId sourceId, NodeId targetId, Placement placement) {
        if (!canMoveNode(tree, sourceId, targetId, false)) {
            log.fine(() -> "subtree move rejected: " + sourceId + " -> " + targetId);
            return tree;
        }
        if (tree.get(sourceId).parentId() == null) {
            log.fine("subtree move rejected: the root cannot move as a subtree");
            return tree;
        }
        return attach(detachSubtree(tree, sourceId), sourceId, targetId, placement);
    }

    /**
     * Move {@code sourceId} and every later sibling, in order, to the end of
     * {@code targetId}'s children. Subtrees travel along.
     */
    public static PageTree moveNodeWithRightSiblingsToParent(PageTree tree, NodeId sourceId, NodeId targetId) {
        TreeNode source = tree.get(sourceId);
        if (source == null || source.parentId() == null || !tree.contains(targetId)) {
            log.fine(() -> "branch move rejected: " + sourceId + " -> " + targetId);
            return tree;
        }
        var moving = new ArrayList<NodeId>();
        moving.add(sourceId);
        moving.addAll(tree.getRightSiblings(sourceId));
        for (NodeId id : moving) {
            if (!canMoveNode(tree, id, targetId, false)) {
                log.fine(() -> "branch move rejected: " + id + " cannot move under " + targetId);
                return tree;
            }
        }

        TreeNode oldParent = tree.get(source.parentId());
        PMap<NodeId, TreeNode> nodes = tree.nodes()
                .plus(oldParent.id(), oldParent.withChildren(oldParent.childrenIds().minusAll(moving)));
        TreeNode target = nodes.get(targetId);
        nodes = nodes.plus(targetId, target.withChildren(target.childrenIds().plusAll(moving)));
        for (NodeId id : moving) {
            nodes = nodes.plus(id, nodes.get(id).withParent(targetId));
        }
        return tree.with(nodes, tree.rootId());
    }

    // ---------------------------------------------------------------- primitives

    /**
     * Promote the root's first child to root. The old root's remaining children are
     * prepended to the new root's children; the old root is left detached (no parent,
     * no children). Roots without children and virtual roots are left alone.
     */
    public static PageTree rerootByFirstChild(PageTree tree) {
        TreeNode root = tree.root();
        if (root == null || root.isVirtual() || !root.hasChildren()) return tree;

        PVector<NodeId> siblings = root.childrenIds();
        TreeNode promoted = tree.get(siblings.get(0));
        PVector<NodeId> rest = siblings.subList(1, siblings.size());

        PMap<NodeId, TreeNode> nodes = tree.nodes()
                .plus(root.id(), root.withParent(null).withChildren(TreePVector.empty()))
                .plus(promoted.id(), promoted.withParent(null)
                        .withChildren(rest.plusAll(promoted.childrenIds())));
        for (NodeId id : rest) {
            nodes = nodes.plus(id, nodes.get(id).withParent(promoted.id()));
        }
        return tree.with(nodes, promoted.id());
    }

    /**
     * Take {@code id} out of the tree, splicing its children into the former parent at the
     * node's slot. The node stays in the map, detached. A root is handled by
     * {@link #rerootByFirstChild}.
     */
    public static PageTree detachLeavingChildren(PageTree tree, NodeId id) {
        TreeNode node = tree.get(id);
        if (node == null) return tree;
        if (node.parentId() == null) {
            return id.equals(tree.rootId()) ? rerootByFirstChild(tree) : tree;
        }
        TreeNode parent = tree.get(node.parentId());
        int slot = parent.childrenIds().indexOf(id);
        if (slot < 0) return tree;

        PVector<NodeId> spliced = parent.childrenIds().minus(slot).plusAll(slot, node.childrenIds());
        PMap<NodeId, TreeNode> nodes = tree.nodes()
                .plus(parent.id(), parent.withChildren(spliced))
                .plus(id, node.withParent(null).withChildren(TreePVector.empty()));
        for (NodeId child : node.childrenIds()) {
            nodes = nodes.plus(child, nodes.get(child).withParent(parent.id()));
        }
        return tree.with(nodes, tree.rootId());
    }

    /** Cut {@code id} (with its subtree) from its parent. Roots and detached nodes are left alone. */
    public static PageTree detachSubtree(PageTree tree, NodeId id) {
        TreeNode node = tree.get(id);
        if (node == null || node.parentId() == null) return tree;
        TreeNode parent = tree.get(node.parentId());
        PMap<NodeId, TreeNode> nodes = tree.nodes()
                .plus(parent.id(), parent.withChildren(parent.childrenIds().minus(id)))
                .plus(id, node.withParent(null));
        return tree.with(nodes, tree.rootId());
    }

    /**
     * Hang the detached node {@code id} under {@code targetId}.
     * <ul>
     *   <li>{@link Placement#BRANCH}: appended as the last child.</li>
     *   <li>{@link Placement#INSERT}: becomes the first child; the target's previous first child
     *       becomes the first child of {@code id}, ahead of any children it already has.</li>
     * </ul>
     * Attached nodes, the tree root and targets inside {@code id}'s subtree are rejected.
     */
    public static PageTree attach(PageTree tree, NodeId id, NodeId targetId, Placement placement) {
        TreeNode node = tree.get(id);
        TreeNode target = tree.get(targetId);
        if (node == null || target == null) return tree;
        if (node.parentId() != null || id.equals(tree.rootId())) return tree;
        if (tree.isDescendant(id, targetId)) return tree;

        PMap<NodeId, TreeNode> nodes = tree.nodes();
        if (placement == Placement.BRANCH) {
            nodes = nodes
                    .plus(targetId, target.withChildren(target.childrenIds().plus(id)))
                    .plus(id, node.withParent(targetId));
        } else {
            NodeId previousFirst = target.firstChild();
            if (previousFirst == null) {
                nodes = nodes
                        .plus(targetId, target.withChildren(TreePVector.singleton(id)))
                        .plus(id, node.withParent(targetId));
            } else {
                nodes = nodes
                        .plus(targetId, target.withChildren(target.childrenIds().with(0, id)))
                        .plus(id, node.withParent(targetId).withChildren(node.childrenIds().plus(0, previousFirst)))
                        .plus(previousFirst, nodes.get(previousFirst).withParent(id));
            }
        }
        return tree.with(nodes, tree.rootId());
    }

    // ---------------------------------------------------------------- page-index sync

    /** Rewrite real page indices through {@code indexMap} (old index -> new index). */
    public static PageTree updateTreePageIndices(PageTree tree, Map<Integer, Integer> indexMap) {
        if (indexMap.isEmpty()) return tree;
        PMap<NodeId, TreeNode> nodes = tree.nodes();
        for (TreeNode n : tree.nodes().values()) {
            if (n.isVirtual()) continue;
            Integer mapped = indexMap.get(n.pageIndex());
            if (mapped != null && mapped != n.pageIndex()) {
                nodes = nodes.plus(n.id(), n.withPageIndex(mapped));
            }
        }
        return tree.with(nodes, tree.rootId());
    }

    /**
     * A page was inserted into the page list at {@code insertIndex}: shift later page indices
     * and add a node for it as the inserted first child of the node showing
     * {@code parentPageIndex} (looked up before the shift). Without such a node the page
     * becomes a new branch of the root, or the root of an empty tree.
     */
    public static PageTree insertPageIntoTree(PageTree tree, int insertIndex, int parentPageIndex) {
        if (tree.isEmpty()) {
            return singleNode(insertIndex);
        }
        Optional<NodeId> parentId = tree.findNodeByPageIndex(parentPageIndex).map(TreeNode::id);
        PageTree shifted = shiftIndices(tree, insertIndex, +1);
        return parentId.isPresent()
                ? insertNode(shifted, parentId.get(), insertIndex).tree()
                : addBranchNode(shifted, shifted.rootId(), insertIndex).tree();
    }

    /** {@code count} pages inserted at {@code startIndex}, chained one below the other. */
    public static PageTree insertPagesIntoTree(PageTree tree, int startIndex, int count, int parentPageIndex) {
        PageTree result = tree;
        for (int i = 0; i < count; i++) {
            int parent = i == 0 ? parentPageIndex : startIndex + i - 1;
            result = insertPageIntoTree(result, startIndex + i, parent);
        }
        return result;
    }

    /**
     * Page {@code removeIndex} was deleted from the page list: drop its node (children take
     * its place) and shift later page indices down.
     */
    public static PageTree removePageFromTree(PageTree tree, int removeIndex) {
        PageTree result = tree;
        var node = tree.findNodeByPageIndex(removeIndex);
        if (node.isPresent()) {
            result = removeNode(tree, node.get().id(), false);
            if (result == tree) {
                log.fine(() -> "removePageFromTree: node for page " + removeIndex + " was kept");
            }
        }
        return shiftIndices(result, removeIndex + 1, -1);
    }

    /** Pages {@code [startIndex, endIndex)} were deleted from the page list. */
    public static PageTree removePagesFromTree(PageTree tree, int startIndex, int endIndex) {
        PageTree result = tree;
        for (int i = endIndex - 1; i >= startIndex; i--) {
            result = removePageFromTree(result, i);
        }
        return result;
    }

    private static PageTree shiftIndices(PageTree tree, int fromIndex, int delta) {
        PMap<NodeId, TreeNode> nodes = tree.nodes();
        for (TreeNode n : tree.nodes().values()) {
            if (!n.isVirtual() && n.pageIndex() >= fromIndex) {
                nodes = nodes.plus(n.id(), n.withPageIndex(n.pageIndex() + delta));
            }
        }
        return tree.with(nodes, tree.rootId());
    }

    private static PageTree singleNode(int pageIndex) {
        NodeId id = PageTree.empty().allocateId();
        return PageTree.of(List.of(TreeNode.leaf(id, pageIndex, null)), id);
    }
}
