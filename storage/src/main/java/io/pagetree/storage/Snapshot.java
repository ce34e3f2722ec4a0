package io.pagetree.storage;

import io.pagetree.core.Page;
import io.pagetree.core.PageTree;

import java.util.List;

/**
 * Frozen document state: the tree, the pages in primitive form (tree embedded in page 0)
 * and the current page index.
 * <p>
 * Pages are decoded only on {@link #restore()}, so a damaged snapshot fails when it is
 * used, not when the history is built.
 */
public record Snapshot(PageTree tree, List<PrimitivePage> pages, int currentIndex) {

    public Snapshot {
        pages = List.copyOf(pages);
    }

    /** Capture {@code pages} with {@code tree} embedded (a null or empty tree embeds nothing). */
    public static Snapshot capture(PageTree tree, List<Page> pages, int currentIndex) {
        PageTree t = tree == null ? PageTree.empty() : tree;
        List<Page> embedded = EmbeddedTreeCodec.embedTreeInPages(pages, t, !t.isEmpty());
        return new Snapshot(t, PrimitivePages.toPrimitives(embedded), currentIndex);
    }

    /**
     * @throws SnapshotCorruptedException if a stored page cannot be decoded
     */
    public PageState restore() {
        return new PageState(PrimitivePages.toPages(pages), currentIndex);
    }
}
