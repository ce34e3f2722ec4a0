package io.pagetree.core;

import java.util.Objects;

/**
 * One page of the flat page list.
 * <p>
 * Forward-reference rule: a {@code Ref} field or comment always points at an earlier page,
 * so a page list can be resolved in a single left-to-right pass.
 */
public record Page(int index, PageField field, PageComment comment, PageFlags flags) {

    public Page {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(comment, "comment");
        Objects.requireNonNull(flags, "flags");
    }

    /** Page with a concrete board and comment and default flags. */
    public static Page of(int index, FieldState field, String comment) {
        return new Page(index, PageField.value(field), PageComment.text(comment), PageFlags.defaults());
    }

    public Page withIndex(int newIndex) { return new Page(newIndex, field, comment, flags); }

    public Page withComment(PageComment newComment) { return new Page(index, field, newComment, flags); }

    public Page withFlags(PageFlags newFlags) { return new Page(index, field, comment, newFlags); }
}
