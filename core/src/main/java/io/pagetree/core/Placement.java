package io.pagetree.core;

/** Where an attached node lands among its new parent's children. */
public enum Placement {
    /** Becomes the first child; the parent's previous first child moves below it. */
    INSERT,
    /** Appended as the last child (a new branch). */
    BRANCH
}
