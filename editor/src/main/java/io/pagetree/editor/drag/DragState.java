package io.pagetree.editor.drag;

import io.pagetree.core.NodeId;

import java.util.Objects;

/**
 * Immutable drag-and-drop state. {@link DragController} takes one and returns the next.
 * <p>
 * When {@code phase == IDLE} every target field is null; only {@code mode} is kept.
 * A button target ({@code targetButtonParentId} + {@code targetButtonType}) takes
 * precedence over a node target on drop.
 */
public record DragState(
        DragPhase phase,
        NodeId sourceNodeId,
        NodeId targetNodeId,
        Integer dropSlotIndex,
        DragMode mode,
        NodeId targetButtonParentId,
        ButtonType targetButtonType
) {

    public DragState {
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(mode, "mode");
        if (phase == DragPhase.DRAGGING) Objects.requireNonNull(sourceNodeId, "sourceNodeId");
    }

    public static DragState idle(DragMode mode) {
        return new DragState(DragPhase.IDLE, null, null, null, mode, null, null);
    }

    public static DragState dragging(NodeId source, DragMode mode) {
        return new DragState(DragPhase.DRAGGING, source, null, null, mode, null, null);
    }

    public boolean isDragging() { return phase == DragPhase.DRAGGING; }

    public boolean hasButtonTarget() { return targetButtonParentId != null && targetButtonType != null; }

    public DragState withTarget(NodeId target) {
        return new DragState(phase, sourceNodeId, target, dropSlotIndex, mode, targetButtonParentId, targetButtonType);
    }

    public DragState withButton(NodeId parent, ButtonType type) {
        return new DragState(phase, sourceNodeId, targetNodeId, dropSlotIndex, mode, parent, type);
    }

    public DragState withDropSlot(Integer slot) {
        return new DragState(phase, sourceNodeId, targetNodeId, slot, mode, targetButtonParentId, targetButtonType);
    }

    public DragState withMode(DragMode newMode) {
        return new DragState(phase, sourceNodeId, targetNodeId, dropSlotIndex, newMode, targetButtonParentId, targetButtonType);
    }
}
