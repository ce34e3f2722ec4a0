package io.pagetree.storage;

/** Outcome of one undo or redo. */
public record HistoryStep(PageState state, int undoCount, int redoCount) {}
