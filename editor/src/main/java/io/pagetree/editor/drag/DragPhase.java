package io.pagetree.editor.drag;

public enum DragPhase { IDLE, DRAGGING }
