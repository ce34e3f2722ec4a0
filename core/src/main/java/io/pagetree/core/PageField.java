package io.pagetree.core;

import java.util.Objects;

/**
 * Board content of a page: either a concrete value or a reference to an earlier page
 * whose (resolved) board this page reuses.
 */
public sealed interface PageField permits PageField.Value, PageField.Ref {

    static PageField value(FieldState state) { return new Value(state); }

    static PageField ref(int index) { return new Ref(index); }

    record Value(FieldState state) implements PageField {
        public Value {
            Objects.requireNonNull(state, "state");
        }
    }

    record Ref(int index) implements PageField {
        public Ref {
            if (index < 0) throw new IllegalArgumentException("ref index must be >= 0: " + index);
        }
    }
}
