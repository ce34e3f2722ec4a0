// file: src/main/java/io/pagetree/core/PageTree.java
package io.pagetree.core;

import org.pcollections.HashTreePMap;
import org.pcollections.PMap;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Immutable tree of pages.
 * <p>
 * Design:
 *  - Nodes live in a persistent map keyed by {@link NodeId}; every mutation in
 *    {@link TreeMutations} returns a new PageTree sharing unchanged nodes with its input.
 *  - Queries never throw on unknown ids; they return empty results.
 *  - Traversals are bounded by the node count, so a corrupted (cyclic) tree cannot hang
 *    a caller. {@link TreeValidator} reports such trees.
 */
public final class PageTree {

    /** Schema version written by the persistence codec. */
    public static final int CURRENT_VERSION = 1;

    private static final PageTree EMPTY = new PageTree(HashTreePMap.empty(), null, CURRENT_VERSION);

    private final PMap<NodeId, TreeNode> nodes;
    private final NodeId rootId;
    private final int version;

    public PageTree(PMap<NodeId, TreeNode> nodes, NodeId rootId, int version) {
        this.nodes = Objects.requireNonNull(nodes, "nodes");
        this.rootId = rootId;
        this.version = version;
    }

    public static PageTree empty() { return EMPTY; }

    /** Build a tree from loose nodes (keyed by their own ids). */
    public static PageTree of(Collection<TreeNode> nodes, NodeId rootId) {
        PMap<NodeId, TreeNode> map = HashTreePMap.empty();
        for (TreeNode n : nodes) {
            map = map.plus(n.id(), n);
        }
        return new PageTree(map, rootId, CURRENT_VERSION);
    }

    public PMap<NodeId, TreeNode> nodes() { return nodes; }

    public NodeId rootId() { return rootId; }

    public int version() { return version; }

    public int size() { return nodes.size(); }

    public boolean isEmpty() { return nodes.isEmpty(); }

    /** Root node, or null for an empty tree. */
    public TreeNode root() { return rootId == null ? null : nodes.get(rootId); }

    public boolean contains(NodeId id) { return id != null && nodes.containsKey(id); }

    public Optional<TreeNode> findNode(NodeId id) {
        return id == null ? Optional.empty() : Optional.ofNullable(nodes.get(id));
    }

    /** Nullable lookup for code that already checked membership. */
    TreeNode get(NodeId id) {
        return id == null ? null : nodes.get(id);
    }

    /** First node in pre-order that shows page {@code pageIndex}. */
    public Optional<TreeNode> findNodeByPageIndex(int pageIndex) {
        for (TreeNode n : preOrder()) {
            if (n.pageIndex() == pageIndex) return Optional.of(n);
        }
        return Optional.empty();
    }

    public boolean isVirtualNode(NodeId id) {
        TreeNode n = get(id);
        return n != null && n.isVirtual();
    }

    /** Number of nodes that stand for real pages. */
    public int realNodeCount() {
        int count = 0;
        for (TreeNode n : nodes.values()) {
            if (!n.isVirtual()) count++;
        }
        return count;
    }

    /**
     * Ids from the root down to {@code id} (both included).
     * Empty when the node is unknown or is not connected to the root.
     */
    public List<NodeId> getPathToNode(NodeId id) {
        var path = new ArrayList<NodeId>();
        TreeNode cursor = get(id);
        int guard = nodes.size();
        while (cursor != null && guard-- >= 0) {
            path.add(cursor.id());
            if (cursor.parentId() == null) break;
            cursor = get(cursor.parentId());
        }
        if (path.isEmpty() || !path.get(path.size() - 1).equals(rootId)) return List.of();
        Collections.reverse(path);
        return List.copyOf(path);
    }

    /** {@code id} and everything below it, in pre-order. Empty for unknown ids. */
    public List<NodeId> getDescendants(NodeId id) {
        var out = new ArrayList<NodeId>();
        walk(id, n -> out.add(n.id()));
        return List.copyOf(out);
    }

    /** True when {@code candidate} lies in the subtree rooted at {@code ancestor} (itself included). */
    public boolean isDescendant(NodeId ancestor, NodeId candidate) {
        if (!contains(ancestor) || !contains(candidate)) return false;
        return getDescendants(ancestor).contains(candidate);
    }

    /** Siblings after {@code id} in its parent's child list. Empty for the root. */
    public List<NodeId> getRightSiblings(NodeId id) {
        TreeNode n = get(id);
        if (n == null || n.parentId() == null) return List.of();
        TreeNode parent = get(n.parentId());
        if (parent == null) return List.of();
        int slot = parent.childrenIds().indexOf(id);
        if (slot < 0) return List.of();
        return List.copyOf(parent.childrenIds().subList(slot + 1, parent.childrenIds().size()));
    }

    /** All nodes reachable from the root, parents before children, siblings in order. */
    public List<TreeNode> preOrder() {
        var out = new ArrayList<TreeNode>(nodes.size());
        walk(rootId, out::add);
        return out;
    }

    /** Reachable nodes without children, in pre-order. */
    public List<TreeNode> leaves() {
        var out = new ArrayList<TreeNode>();
        for (TreeNode n : preOrder()) {
            if (!n.hasChildren()) out.add(n);
        }
        return out;
    }

    /**
     * Fresh id of the form {@code n<k>}, unique within this tree.
     * Deterministic: the same tree always hands out the same id.
     */
    public NodeId allocateId() {
        int k = nodes.size();
        NodeId candidate = new NodeId("n" + k);
        while (nodes.containsKey(candidate)) {
            k++;
            candidate = new NodeId("n" + k);
        }
        return candidate;
    }

    /** Same schema version, new contents. Used by the mutation functions. */
    PageTree with(PMap<NodeId, TreeNode> newNodes, NodeId newRootId) {
        return new PageTree(newNodes, newRootId, version);
    }

    private void walk(NodeId start, Consumer<TreeNode> visitor) {
        TreeNode first = get(start);
        if (first == null) return;
        Set<NodeId> seen = new HashSet<>();
        var stack = new ArrayDeque<TreeNode>();
        stack.push(first);
        while (!stack.isEmpty()) {
            TreeNode n = stack.pop();
            if (!seen.add(n.id())) continue; // cycle or duplicate listing
            visitor.accept(n);
            var children = n.childrenIds();
            for (int i = children.size() - 1; i >= 0; i--) {
                TreeNode child = get(children.get(i));
                if (child != null) stack.push(child);
            }
        }
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PageTree t)) return false;
        return version == t.version && Objects.equals(rootId, t.rootId) && nodes.equals(t.nodes);
    }

    @Override public int hashCode() { return Objects.hash(nodes, rootId, version); }

    @Override public String toString() {
        return "PageTree{root=" + rootId + ", nodes=" + nodes.size() + ", version=" + version + "}";
    }
}
