package io.pagetree.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view over a page list that resolves reference chains.
 * <p>
 * Positions in the list are authoritative; a page's {@code index} field is expected to
 * match its position. Chains are followed at most one step per page, so a malformed
 * (cyclic or forward-pointing) list resolves to empty instead of looping.
 */
public final class Pages {

    private final List<Page> pages;

    public Pages(List<Page> pages) {
        this.pages = List.copyOf(pages);
    }

    /** Concrete board of page {@code index}, or empty if the chain is broken. */
    public Optional<FieldState> resolveField(int index) {
        int cursor = index;
        for (int steps = 0; steps <= pages.size(); steps++) {
            if (cursor < 0 || cursor >= pages.size()) return Optional.empty();
            PageField field = pages.get(cursor).field();
            if (field instanceof PageField.Value value) return Optional.of(value.state());
            cursor = ((PageField.Ref) field).index();
        }
        return Optional.empty();
    }

    /** Concrete comment text of page {@code index}, or empty if the chain is broken. */
    public Optional<String> resolveComment(int index) {
        int source = commentSourceIndex(index);
        if (source < 0) return Optional.empty();
        return Optional.of(((PageComment.Text) pages.get(source).comment()).text());
    }

    /** Index of the page that physically holds the comment text of page {@code index}, or -1. */
    public int commentSourceIndex(int index) {
        int cursor = index;
        for (int steps = 0; steps <= pages.size(); steps++) {
            if (cursor < 0 || cursor >= pages.size()) return -1;
            PageComment comment = pages.get(cursor).comment();
            if (comment instanceof PageComment.Text) return cursor;
            cursor = ((PageComment.Ref) comment).index();
        }
        return -1;
    }

    /**
     * Copy of {@code pages} with every index and reference shifted by {@code offset}.
     * Used when appending an independent page list behind an existing one.
     */
    public static List<Page> shift(List<Page> pages, int offset) {
        var out = new ArrayList<Page>(pages.size());
        for (Page p : pages) {
            PageField field = p.field() instanceof PageField.Ref ref
                    ? PageField.ref(ref.index() + offset) : p.field();
            PageComment comment = p.comment() instanceof PageComment.Ref ref
                    ? PageComment.ref(ref.index() + offset) : p.comment();
            out.add(new Page(p.index() + offset, field, comment, p.flags()));
        }
        return out;
    }
}
