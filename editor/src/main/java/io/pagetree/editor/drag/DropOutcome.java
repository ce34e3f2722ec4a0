package io.pagetree.editor.drag;

import io.pagetree.editor.DocumentState;

/** Result of a drop: the next drag state and, when something changed, the committed document. */
public record DropOutcome(DragState dragState, DocumentState document) {
    public boolean committed() { return document != null; }
}
