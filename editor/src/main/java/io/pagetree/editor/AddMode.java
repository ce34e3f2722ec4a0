package io.pagetree.editor;

/** What the "add page" action does with the current node. */
public enum AddMode {
    /** New page as the last child of the current node. */
    BRANCH,
    /** New page inserted directly after the current node, taking over its main route. */
    INSERT
}
