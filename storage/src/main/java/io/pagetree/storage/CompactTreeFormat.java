package io.pagetree.storage;

import io.pagetree.core.NodeId;
import io.pagetree.core.PageTree;
import io.pagetree.core.TreeNode;
import org.pcollections.PVector;
import org.pcollections.TreePVector;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Older semicolon-separated tree encoding, still accepted on read.
 * <pre>
 * rootSlot;pageIndex,parentSlot,childSlot,...;pageIndex,parentSlot,...
 * </pre>
 * Slots are positions in the node list; a parent slot of -1 means "no parent".
 * Ids are not stored, so nodes get fresh ids {@code n<slot>}.
 */
final class CompactTreeFormat {

    private static final Pattern LEADING_SLOT = Pattern.compile("^\\d+;.*", Pattern.DOTALL);

    private CompactTreeFormat() {}

    static boolean looksCompact(String decoded) {
        return LEADING_SLOT.matcher(decoded).matches();
    }

    /**
     * @throws IllegalArgumentException on malformed numbers or slots out of range
     */
    static PageTree decode(String compact) {
        String[] parts = compact.split(";");
        if (parts.length < 2) throw new IllegalArgumentException("compact tree has no nodes");
        int rootSlot = Integer.parseInt(parts[0].trim());
        int count = parts.length - 1;
        if (rootSlot < 0 || rootSlot >= count) {
            throw new IllegalArgumentException("root slot " + rootSlot + " out of range");
        }

        var nodes = new ArrayList<TreeNode>(count);
        for (int slot = 0; slot < count; slot++) {
            String[] values = parts[slot + 1].split(",");
            int pageIndex = Integer.parseInt(values[0].trim());
            int parentSlot = values.length > 1 ? Integer.parseInt(values[1].trim()) : -1;
            PVector<NodeId> children = TreePVector.empty();
            for (int i = 2; i < values.length; i++) {
                int child = Integer.parseInt(values[i].trim());
                if (child >= 0) children = children.plus(idFor(checkSlot(child, count)));
            }
            NodeId parent = parentSlot >= 0 ? idFor(checkSlot(parentSlot, count)) : null;
            nodes.add(new TreeNode(idFor(slot), pageIndex, parent, children));
        }
        return PageTree.of(nodes, idFor(rootSlot));
    }

    /** Encode in the compact form (nodes in pre-order). Used by tests and tooling. */
    static String encode(PageTree tree) {
        List<TreeNode> order = tree.preOrder();
        var slots = new HashMap<NodeId, Integer>();
        for (int i = 0; i < order.size(); i++) slots.put(order.get(i).id(), i);

        var sb = new StringBuilder().append(slots.get(tree.rootId()));
        for (TreeNode n : order) {
            sb.append(';').append(n.pageIndex()).append(',')
              .append(n.parentId() == null ? -1 : slots.get(n.parentId()));
            for (NodeId c : n.childrenIds()) sb.append(',').append(slots.get(c));
        }
        return sb.toString();
    }

    private static int checkSlot(int slot, int count) {
        if (slot >= count) throw new IllegalArgumentException("slot " + slot + " out of range");
        return slot;
    }

    private static NodeId idFor(int slot) {
        return new NodeId("n" + slot);
    }
}
