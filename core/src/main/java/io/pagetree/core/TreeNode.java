package io.pagetree.core;

import org.pcollections.PVector;
import org.pcollections.TreePVector;

import java.util.Objects;

/**
 * Immutable vertex of a {@link PageTree}.
 * <p>
 * Fields:
 *  - id:          stable node identity.
 *  - pageIndex:   index into the flat page list, or {@link #VIRTUAL_PAGE_INDEX}.
 *  - parentId:    null for the root (and for nodes that are temporarily detached).
 *  - childrenIds: ordered; childrenIds[0] is the main route and the order is also the
 *                 subtree's contribution order to the linear page sequence.
 */
public record TreeNode(NodeId id, int pageIndex, NodeId parentId, PVector<NodeId> childrenIds) {

    /** Sentinel page index of the virtual root. Never a real page. */
    public static final int VIRTUAL_PAGE_INDEX = -1;

    public TreeNode {
        Objects.requireNonNull(id, "id");
        childrenIds = childrenIds == null ? TreePVector.empty() : childrenIds;
    }

    public static TreeNode leaf(NodeId id, int pageIndex, NodeId parentId) {
        return new TreeNode(id, pageIndex, parentId, TreePVector.empty());
    }

    public static TreeNode virtualRoot(NodeId id) {
        return leaf(id, VIRTUAL_PAGE_INDEX, null);
    }

    public boolean isVirtual() { return pageIndex == VIRTUAL_PAGE_INDEX; }

    public boolean hasChildren() { return !childrenIds.isEmpty(); }

    /** First child (main route) or null. */
    public NodeId firstChild() { return childrenIds.isEmpty() ? null : childrenIds.get(0); }

    public TreeNode withParent(NodeId parent) {
        return new TreeNode(id, pageIndex, parent, childrenIds);
    }

    public TreeNode withChildren(PVector<NodeId> children) {
        return new TreeNode(id, pageIndex, parentId, children);
    }

    public TreeNode withPageIndex(int index) {
        return new TreeNode(id, index, parentId, childrenIds);
    }
}
