package io.pagetree.core.linear;

import io.pagetree.core.FieldState;
import io.pagetree.core.Page;
import io.pagetree.core.PageComment;
import io.pagetree.core.PageField;
import io.pagetree.core.Pages;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Permutes a page list while keeping every reference valid.
 * <p>
 * Rewrite rules for each page at its new position:
 *  - a reference whose target still comes earlier is remapped to the target's new index;
 *  - otherwise the chain is resolved in the old order and a concrete copy is stored;
 *  - a chain that never resolves becomes an empty board / empty comment (logged).
 * Page 0's {@code colorize} flag stays with position 0.
 */
public final class PageReorderer {

    private static final Logger log = Logger.getLogger(PageReorderer.class.getName());

    private PageReorderer() {}

    /** Reordered pages plus the old index -> new index map (identity entries included). */
    public record Reordering(List<Page> pages, Map<Integer, Integer> indexMap) {
        public Reordering {
            pages = List.copyOf(pages);
            indexMap = Map.copyOf(indexMap);
        }
    }

    /**
     * Apply {@code order}, where {@code order.get(newIndex) == oldIndex}.
     *
     * @throws IllegalArgumentException if {@code order} is not a permutation of the page indices
     */
    public static Reordering reorder(List<Page> pages, List<Integer> order) {
        int n = pages.size();
        if (order.size() != n) {
            throw new IllegalArgumentException("order has " + order.size() + " entries for " + n + " pages");
        }
        int[] oldToNew = new int[n];
        Arrays.fill(oldToNew, -1);
        for (int newIndex = 0; newIndex < n; newIndex++) {
            int oldIndex = order.get(newIndex);
            if (oldIndex < 0 || oldIndex >= n || oldToNew[oldIndex] != -1) {
                throw new IllegalArgumentException("order is not a permutation: " + order);
            }
            oldToNew[oldIndex] = newIndex;
        }

        Pages old = new Pages(pages);
        boolean firstColorize = n > 0 && pages.get(0).flags().colorize();
        var out = new ArrayList<Page>(n);
        var indexMap = new HashMap<Integer, Integer>();
        for (int newIndex = 0; newIndex < n; newIndex++) {
            int oldIndex = order.get(newIndex);
            Page page = pages.get(oldIndex);
            Page moved = new Page(newIndex,
                    rewriteField(old, oldIndex, page.field(), oldToNew, newIndex),
                    rewriteComment(old, oldIndex, page.comment(), oldToNew, newIndex),
                    newIndex == 0 ? page.flags().withColorize(firstColorize) : page.flags());
            out.add(moved);
            indexMap.put(oldIndex, newIndex);
        }
        return new Reordering(out, indexMap);
    }

    /**
     * List-view move: take the page at {@code from} and drop it before slot {@code toSlot}
     * ({@code 0..size}). Slots {@code from} and {@code from + 1} leave the order unchanged.
     */
    public static Reordering movePage(List<Page> pages, int from, int toSlot) {
        int n = pages.size();
        if (from < 0 || from >= n || toSlot < 0 || toSlot > n) {
            throw new IllegalArgumentException("move " + from + " -> slot " + toSlot + " out of range for " + n);
        }
        var order = new ArrayList<Integer>(n);
        for (int i = 0; i < n; i++) order.add(i);
        int target = from < toSlot ? toSlot - 1 : toSlot;
        order.remove(from);
        order.add(target, from);
        return reorder(pages, order);
    }

    private static PageField rewriteField(Pages old, int oldIndex, PageField field, int[] oldToNew, int newIndex) {
        if (!(field instanceof PageField.Ref ref)) return field;
        int target = ref.index();
        if (target >= 0 && target < oldToNew.length && oldToNew[target] < newIndex && target != oldIndex) {
            return PageField.ref(oldToNew[target]);
        }
        FieldState resolved = old.resolveField(oldIndex).orElseGet(() -> {
            log.warning("Page " + oldIndex + ": field reference chain does not resolve, using an empty board");
            return FieldState.empty();
        });
        return PageField.value(resolved.copy());
    }

    private static PageComment rewriteComment(Pages old, int oldIndex, PageComment comment, int[] oldToNew, int newIndex) {
        if (!(comment instanceof PageComment.Ref ref)) return comment;
        int target = ref.index();
        if (target >= 0 && target < oldToNew.length && oldToNew[target] < newIndex && target != oldIndex) {
            return PageComment.ref(oldToNew[target]);
        }
        String resolved = old.resolveComment(oldIndex).orElseGet(() -> {
            log.warning("Page " + oldIndex + ": comment reference chain does not resolve, using empty text");
            return "";
        });
        return PageComment.text(resolved);
    }
}
