// file: src/main/java/io/pagetree/core/linear/Linearizer.java
package io.pagetree.core.linear;

import io.pagetree.core.Page;
import io.pagetree.core.PageTree;
import io.pagetree.core.TreeMutations;
import io.pagetree.core.TreeNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Keeps the flat page list in tree pre-order.
 * <p>
 * Order rule: real pages in pre-order of the tree (the virtual root contributes nothing,
 * repeated or out-of-range indices are skipped), followed by pages no node shows, in their
 * previous relative order. References are rewritten by {@link PageReorderer} and the tree's
 * page indices are rewritten through the same map.
 */
public final class Linearizer {

    private static final Logger log = Logger.getLogger(Linearizer.class.getName());

    private Linearizer() {}

    /**
     * @param changed  false when the pages were already in order; tree and pages are then the
     *                 input instances
     * @param indexMap old page index -> new page index; empty when unchanged
     */
    public record NormalizationResult(PageTree tree, List<Page> pages, boolean changed, Map<Integer, Integer> indexMap) {

        /** New position of the page that was at {@code oldIndex}. */
        public int remap(int oldIndex) {
            return indexMap.getOrDefault(oldIndex, oldIndex);
        }
    }

    public static NormalizationResult normalize(PageTree tree, List<Page> pages) {
        int n = pages.size();
        boolean[] placed = new boolean[n];
        var order = new ArrayList<Integer>(n);

        for (TreeNode node : tree.preOrder()) {
            if (node.isVirtual()) continue;
            int index = node.pageIndex();
            if (index < 0 || index >= n) {
                log.warning("Node " + node.id() + " points at page " + index + " outside 0.." + (n - 1) + "; skipped");
                continue;
            }
            if (placed[index]) {
                log.warning("Page " + index + " is shown by more than one node; keeping the first");
                continue;
            }
            placed[index] = true;
            order.add(index);
        }
        for (int i = 0; i < n; i++) {
            if (!placed[i]) order.add(i);
        }

        if (isIdentity(order)) {
            return new NormalizationResult(tree, pages, false, Map.of());
        }
        PageReorderer.Reordering reordering = PageReorderer.reorder(pages, order);
        PageTree remapped = TreeMutations.updateTreePageIndices(tree, reordering.indexMap());
        return new NormalizationResult(remapped, reordering.pages(), true, reordering.indexMap());
    }

    private static boolean isIdentity(List<Integer> order) {
        for (int i = 0; i < order.size(); i++) {
            if (order.get(i) != i) return false;
        }
        return true;
    }
}
