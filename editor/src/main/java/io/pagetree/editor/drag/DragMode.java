package io.pagetree.editor.drag;

/** What dropping a dragged node onto another node does. */
public enum DragMode {
    /** The node alone moves; its children stay in its old place. */
    ATTACH_SINGLE,
    /** The node and its later siblings move, subtrees included. */
    ATTACH_BRANCH,
    /** Slot-based reordering. Not supported in tree view: drops always cancel. */
    REORDER
}
