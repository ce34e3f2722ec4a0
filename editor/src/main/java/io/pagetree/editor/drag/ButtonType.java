package io.pagetree.editor.drag;

/** Drop buttons shown next to a hovered node. */
public enum ButtonType {
    /** Drop as the node's first child. */
    INSERT,
    /** Drop as the node's last child. */
    BRANCH,
    /** Delete the dragged node. */
    DELETE
}
