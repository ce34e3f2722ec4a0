// file: editor/src/main/java/io/pagetree/editor/drag/DragController.java
package io.pagetree.editor.drag;

import io.pagetree.core.NodeId;
import io.pagetree.core.PageTree;
import io.pagetree.core.Placement;
import io.pagetree.core.TreeMutations;
import io.pagetree.core.TreeNode;
import io.pagetree.editor.DocumentState;
import io.pagetree.editor.EditCommitter;
import io.pagetree.editor.EditLogger;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Drag-and-drop reparenting in the tree view.
 * <p>
 * Responsibilities:
 *  - Track hover targets, keeping only targets the drop would accept.
 *  - On drop, pick the structural primitive for the target and mode, and hand the result
 *    to the {@link EditCommitter} (validate, normalize, one history entry).
 * <p>
 * Single-node drops:
 *  - target inside the source's subtree: detach the source (children stay) then attach;
 *  - source is the root: reroot by first child then attach;
 *  - otherwise a plain single-node move.
 * With {@code buttonDropMovesSubtree} the insert/branch/delete buttons act on the whole
 * subtree instead, which rules out descendant targets and the root as a source.
 */
public final class DragController {

    private static final Logger log = Logger.getLogger(DragController.class.getName());

    private final EditCommitter committer;
    private final boolean buttonDropMovesSubtree;

    public DragController(EditCommitter committer, boolean buttonDropMovesSubtree) {
        this.committer = Objects.requireNonNull(committer, "committer");
        this.buttonDropMovesSubtree = buttonDropMovesSubtree;
    }

    public DragState start(DragState state, PageTree tree, NodeId sourceId) {
        TreeNode source = tree.findNode(sourceId).orElse(null);
        if (source == null || source.isVirtual()) {
            log.fine(() -> "drag start ignored: " + sourceId + " is not a draggable node");
            return state;
        }
        return DragState.dragging(sourceId, state.mode());
    }

    public DragState setMode(DragState state, DragMode mode) {
        return state.withMode(Objects.requireNonNull(mode, "mode"));
    }

    /** Hovering a node: remembered only if dropping there would be accepted. */
    public DragState hoverNode(DragState state, PageTree tree, NodeId targetId) {
        if (!state.isDragging()) return state;
        boolean ok = isValidNodeTarget(tree, state.sourceNodeId(), targetId, state.mode());
        return state.withTarget(ok ? targetId : null);
    }

    /** Hovering a node's drop button: remembered only if the button would accept the source. */
    public DragState hoverButton(DragState state, PageTree tree, NodeId parentId, ButtonType type) {
        if (!state.isDragging()) return state;
        boolean ok = isValidButtonTarget(tree, state.sourceNodeId(), parentId, type);
        return ok ? state.withButton(parentId, type) : state.withButton(null, null);
    }

    public DragState leaveButton(DragState state) {
        return state.withButton(null, null);
    }

    public DragState hoverSlot(DragState state, Integer slot) {
        if (!state.isDragging()) return state;
        return state.withDropSlot(slot);
    }

    public DragState cancel(DragState state) {
        return DragState.idle(state.mode());
    }

    /**
     * Drop. Always ends the drag; returns a committed document only when the tree changed
     * and the result validated.
     */
    public DropOutcome commit(DragState state, DocumentState document) {
        long start = System.nanoTime();
        DragState idle = cancel(state);
        if (!state.isDragging()) return new DropOutcome(idle, null);
        if (state.mode() == DragMode.REORDER) {
            EditLogger.logEdit("drop:reorder", EditLogger.Outcome.NO_OP, EditLogger.micros(start),
                    "reordering is disabled in the tree view", null);
            return new DropOutcome(idle, null);
        }

        PageTree tree = document.tree();
        NodeId source = state.sourceNodeId();
        String operation;
        PageTree moved;
        if (state.hasButtonTarget()) {
            NodeId parent = state.targetButtonParentId();
            switch (state.targetButtonType()) {
                case DELETE -> {
                    operation = "drop:delete";
                    moved = TreeMutations.removeNode(tree, source, buttonDropMovesSubtree);
                }
                case INSERT -> {
                    operation = "drop:insert";
                    moved = reparent(tree, source, parent, Placement.INSERT);
                }
                default -> {
                    operation = "drop:branch";
                    moved = reparent(tree, source, parent, Placement.BRANCH);
                }
            }
        } else if (state.targetNodeId() != null) {
            NodeId target = state.targetNodeId();
            if (state.mode() == DragMode.ATTACH_BRANCH) {
                operation = "drop:attach-branch";
                moved = TreeMutations.moveNodeWithRightSiblingsToParent(tree, source, target);
            } else {
                operation = "drop:attach";
                moved = reparentSingle(tree, source, target, Placement.BRANCH);
            }
        } else {
            return new DropOutcome(idle, null);
        }

        if (moved == tree) {
            EditLogger.logEdit(operation, EditLogger.Outcome.NO_OP, EditLogger.micros(start),
                    source + " stays where it is", null);
            return new DropOutcome(idle, null);
        }
        DocumentState next = committer
                .commit(operation, document, moved, document.pages(), document.activeNodeId(), null)
                .orElse(null);
        return new DropOutcome(idle, next);
    }

    // ---------------------------------------------------------------- validity

    boolean isValidNodeTarget(PageTree tree, NodeId source, NodeId target, DragMode mode) {
        return switch (mode) {
            case ATTACH_SINGLE -> TreeMutations.canMoveNode(tree, source, target, true);
            case ATTACH_BRANCH -> !isRoot(tree, source) && TreeMutations.canMoveNode(tree, source, target, false);
            case REORDER -> false;
        };
    }

    boolean isValidButtonTarget(PageTree tree, NodeId source, NodeId parent, ButtonType type) {
        if (type == ButtonType.DELETE) {
            TreeNode node = tree.findNode(source).orElse(null);
            return node != null && !node.isVirtual() && tree.realNodeCount() > 1
                    && !(buttonDropMovesSubtree && isRoot(tree, source));
        }
        if (buttonDropMovesSubtree && isRoot(tree, source)) return false;
        return TreeMutations.canMoveNode(tree, source, parent, !buttonDropMovesSubtree);
    }

    // ---------------------------------------------------------------- moves

    private PageTree reparent(PageTree tree, NodeId source, NodeId target, Placement placement) {
        if (buttonDropMovesSubtree) {
            return TreeMutations.moveSubtree(tree, source, target, placement);
        }
        return reparentSingle(tree, source, target, placement);
    }

    private static PageTree reparentSingle(PageTree tree, NodeId source, NodeId target, Placement placement) {
        if (!TreeMutations.canMoveNode(tree, source, target, true)) return tree;
        PageTree detached;
        if (isRoot(tree, source)) {
            detached = TreeMutations.rerootByFirstChild(tree);
        } else if (tree.isDescendant(source, target)) {
            detached = TreeMutations.detachLeavingChildren(tree, source);
        } else {
            return TreeMutations.moveSingle(tree, source, target, placement);
        }
        if (detached == tree) return tree;
        return TreeMutations.attach(detached, source, target, placement);
    }

    private static boolean isRoot(PageTree tree, NodeId id) {
        return id != null && id.equals(tree.rootId());
    }
}
