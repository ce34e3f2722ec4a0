package io.pagetree.storage;

import io.pagetree.core.FieldState;
import io.pagetree.core.Page;
import io.pagetree.core.PageComment;
import io.pagetree.core.PageField;

import java.util.ArrayList;
import java.util.List;

/** Conversions between {@link Page} and {@link PrimitivePage}. */
public final class PrimitivePages {

    private PrimitivePages() {}

    public static PrimitivePage toPrimitive(Page page) {
        String field = null;
        Integer fieldRef = null;
        if (page.field() instanceof PageField.Value value) {
            field = value.state().encoded();
        } else {
            fieldRef = ((PageField.Ref) page.field()).index();
        }
        String comment = null;
        Integer commentRef = null;
        if (page.comment() instanceof PageComment.Text text) {
            comment = text.text();
        } else {
            commentRef = ((PageComment.Ref) page.comment()).index();
        }
        return new PrimitivePage(page.index(), field, fieldRef, comment, commentRef, page.flags());
    }

    public static List<PrimitivePage> toPrimitives(List<Page> pages) {
        var out = new ArrayList<PrimitivePage>(pages.size());
        for (Page p : pages) out.add(toPrimitive(p));
        return List.copyOf(out);
    }

    /**
     * Decode one page found at {@code position}.
     *
     * @throws SnapshotCorruptedException if the record is incomplete or references a later page
     */
    public static Page toPage(PrimitivePage p, int position) {
        if (p == null) throw new SnapshotCorruptedException("Missing page at position " + position);
        if (p.index() != position) {
            throw new SnapshotCorruptedException("Page at position " + position + " claims index " + p.index());
        }
        if (p.flags() == null) throw new SnapshotCorruptedException("Page " + position + " has no flags");

        PageField field;
        if (p.field() != null && p.fieldRef() == null) {
            field = PageField.value(new FieldState(p.field()));
        } else if (p.field() == null && p.fieldRef() != null) {
            field = PageField.ref(checkRef(p.fieldRef(), position, "field"));
        } else {
            throw new SnapshotCorruptedException("Page " + position + " must have exactly one of field/fieldRef");
        }

        PageComment comment;
        if (p.comment() != null && p.commentRef() == null) {
            comment = PageComment.text(p.comment());
        } else if (p.comment() == null && p.commentRef() != null) {
            comment = PageComment.ref(checkRef(p.commentRef(), position, "comment"));
        } else {
            throw new SnapshotCorruptedException("Page " + position + " must have exactly one of comment/commentRef");
        }
        return new Page(position, field, comment, p.flags());
    }

    public static List<Page> toPages(List<PrimitivePage> primitives) {
        var out = new ArrayList<Page>(primitives.size());
        for (int i = 0; i < primitives.size(); i++) out.add(toPage(primitives.get(i), i));
        return List.copyOf(out);
    }

    private static int checkRef(int ref, int position, String what) {
        if (ref < 0 || ref >= position) {
            throw new SnapshotCorruptedException("Page " + position + " " + what + " ref " + ref + " is not an earlier page");
        }
        return ref;
    }
}
