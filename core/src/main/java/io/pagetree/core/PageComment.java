package io.pagetree.core;

import java.util.Objects;

/**
 * Comment of a page: concrete text, or a reference to an earlier page's comment.
 */
public sealed interface PageComment permits PageComment.Text, PageComment.Ref {

    static PageComment text(String text) { return new Text(text); }

    static PageComment ref(int index) { return new Ref(index); }

    record Text(String text) implements PageComment {
        public Text {
            Objects.requireNonNull(text, "text");
        }
    }

    record Ref(int index) implements PageComment {
        public Ref {
            if (index < 0) throw new IllegalArgumentException("ref index must be >= 0: " + index);
        }
    }
}
