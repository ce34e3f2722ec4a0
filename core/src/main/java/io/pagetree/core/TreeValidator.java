package io.pagetree.core;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural checks run on every mutation result before it is committed.
 * <p>
 * Checks:
 *  - a single parentless node, and it is the declared root;
 *  - parent/child links agree in both directions, each child listed exactly once;
 *  - no node is its own ancestor and every node is reachable from the root;
 *  - page indices are non-negative (or the virtual sentinel), unique, and optionally
 *    below the page count;
 *  - at most one virtual node, and only as the root.
 */
public final class TreeValidator {

    private TreeValidator() {}

    public record ValidationResult(boolean valid, List<String> errors) {
        public ValidationResult {
            errors = List.copyOf(errors);
        }

        static ValidationResult of(List<String> errors) {
            return new ValidationResult(errors.isEmpty(), errors);
        }
    }

    public static ValidationResult validate(PageTree tree) {
        return validate(tree, Integer.MAX_VALUE);
    }

    /** Validate and also require every real page index to be below {@code pageCount}. */
    public static ValidationResult validate(PageTree tree, int pageCount) {
        var errors = new ArrayList<String>();
        if (tree.isEmpty()) {
            if (tree.rootId() != null) errors.add("Empty tree declares root " + tree.rootId());
            return ValidationResult.of(errors);
        }
        if (tree.rootId() == null) {
            errors.add("Tree has nodes but no root");
        } else if (!tree.contains(tree.rootId())) {
            errors.add("Root " + tree.rootId() + " does not exist");
        }

        int virtualCount = 0;
        Map<Integer, NodeId> pageOwners = new HashMap<>();
        for (var entry : tree.nodes().entrySet()) {
            NodeId key = entry.getKey();
            TreeNode node = entry.getValue();
            if (!key.equals(node.id())) {
                errors.add("Node stored under " + key + " has id " + node.id());
            }

            if (node.isVirtual()) {
                virtualCount++;
                if (node.parentId() != null) errors.add("Virtual node " + key + " is not the root");
            } else if (node.pageIndex() < 0) {
                errors.add("Node " + key + " has invalid page index " + node.pageIndex());
            } else {
                if (node.pageIndex() >= pageCount) {
                    errors.add("Node " + key + " points at page " + node.pageIndex() + " of " + pageCount);
                }
                NodeId owner = pageOwners.putIfAbsent(node.pageIndex(), key);
                if (owner != null) {
                    errors.add("Page " + node.pageIndex() + " is shown by both " + owner + " and " + key);
                }
            }

            if (node.parentId() == null) {
                if (!key.equals(tree.rootId())) errors.add("Detached node " + key + " is not the root");
            } else {
                TreeNode parent = tree.nodes().get(node.parentId());
                if (parent == null) {
                    errors.add("Node " + key + " has missing parent " + node.parentId());
                } else {
                    int listed = count(parent.childrenIds(), key);
                    if (listed != 1) {
                        errors.add("Node " + key + " is listed " + listed + " times by parent " + parent.id());
                    }
                }
            }

            Set<NodeId> seenChildren = new HashSet<>();
            for (NodeId childId : node.childrenIds()) {
                if (!seenChildren.add(childId)) continue; // reported from the child's side
                TreeNode child = tree.nodes().get(childId);
                if (child == null) {
                    errors.add("Node " + key + " lists missing child " + childId);
                } else if (!key.equals(child.parentId())) {
                    errors.add("Child " + childId + " of " + key + " points at parent " + child.parentId());
                }
            }

            if (hasCycle(tree, node)) errors.add("Node " + key + " is its own ancestor");
        }

        if (virtualCount > 1) errors.add("Tree has " + virtualCount + " virtual nodes");

        int reachable = tree.preOrder().size();
        if (errors.isEmpty() && reachable != tree.size()) {
            errors.add((tree.size() - reachable) + " node(s) are unreachable from the root");
        }
        return ValidationResult.of(errors);
    }

    private static int count(List<NodeId> ids, NodeId id) {
        int n = 0;
        for (NodeId each : ids) {
            if (each.equals(id)) n++;
        }
        return n;
    }

    private static boolean hasCycle(PageTree tree, TreeNode start) {
        NodeId cursor = start.parentId();
        int steps = 0;
        while (cursor != null && steps++ <= tree.size()) {
            if (cursor.equals(start.id())) return true;
            TreeNode next = tree.nodes().get(cursor);
            if (next == null) return false;
            cursor = next.parentId();
        }
        return cursor != null;
    }
}
