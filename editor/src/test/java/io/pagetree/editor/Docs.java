package io.pagetree.editor;

import io.pagetree.core.FieldState;
import io.pagetree.core.NodeId;
import io.pagetree.core.Page;
import io.pagetree.core.PageComment;

import java.util.ArrayList;
import java.util.List;

/** Page lists and helpers shared by editor tests. */
final class Docs {

    private Docs() {}

    static NodeId id(String value) { return new NodeId(value); }

    /** {@code count} pages with fields f0.. and comments {@code prefix}0.. */
    static List<Page> pages(String prefix, int count) {
        var out = new ArrayList<Page>(count);
        for (int i = 0; i < count; i++) {
            out.add(Page.of(i, new FieldState("f" + i), prefix + i));
        }
        return out;
    }

    static String text(Page page) {
        return ((PageComment.Text) page.comment()).text();
    }
}
