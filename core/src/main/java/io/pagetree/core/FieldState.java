package io.pagetree.core;

import java.util.Objects;

/**
 * Opaque board state of a page. The editor never looks inside it; it only copies it
 * and compares it for equality.
 */
public record FieldState(String encoded) {

    private static final FieldState EMPTY = new FieldState("");

    public FieldState {
        Objects.requireNonNull(encoded, "encoded");
    }

    /** Empty board. */
    public static FieldState empty() { return EMPTY; }

    public boolean isEmpty() { return encoded.isEmpty(); }

    /** Independent copy (value semantics, so this is a new instance with equal contents). */
    public FieldState copy() { return new FieldState(encoded); }
}
