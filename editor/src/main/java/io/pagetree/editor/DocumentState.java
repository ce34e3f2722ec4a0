package io.pagetree.editor;

import io.pagetree.core.FieldState;
import io.pagetree.core.NodeId;
import io.pagetree.core.Page;
import io.pagetree.core.PageTree;
import io.pagetree.core.PageTrees;
import io.pagetree.core.TreeNode;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything the editor shows at one point in time.
 * <p>
 * Pages here never carry the embedded tree marker; the tree travels separately and is
 * embedded only in snapshots and saved documents.
 */
public record DocumentState(
        List<Page> pages,
        int currentIndex,
        PageTree tree,
        NodeId activeNodeId,
        boolean treeEnabled,
        AddMode addMode,
        int undoCount,
        int redoCount
) {

    public DocumentState {
        pages = List.copyOf(pages);
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(addMode, "addMode");
    }

    /** One empty page, linear tree, tree view off. */
    public static DocumentState initial(EditorConfig config) {
        PageTree tree = PageTrees.createTreeFromPages(1);
        return new DocumentState(
                List.of(Page.of(0, FieldState.empty(), "")),
                0,
                tree,
                tree.rootId(),
                false,
                config.defaultAddMode(),
                0,
                0);
    }

    public Optional<TreeNode> activeNode() {
        return tree.findNode(activeNodeId);
    }

    public Page currentPage() {
        return pages.get(currentIndex);
    }

    public DocumentState withTree(PageTree newTree, NodeId active, int index) {
        return new DocumentState(pages, index, newTree, active, treeEnabled, addMode, undoCount, redoCount);
    }

    public DocumentState withActive(NodeId active, int index) {
        return new DocumentState(pages, index, tree, active, treeEnabled, addMode, undoCount, redoCount);
    }

    public DocumentState withTreeEnabled(boolean enabled) {
        return new DocumentState(pages, currentIndex, tree, activeNodeId, enabled, addMode, undoCount, redoCount);
    }

    public DocumentState withAddMode(AddMode mode) {
        return new DocumentState(pages, currentIndex, tree, activeNodeId, treeEnabled, mode, undoCount, redoCount);
    }

    public DocumentState withHistoryCount(int undo, int redo) {
        return new DocumentState(pages, currentIndex, tree, activeNodeId, treeEnabled, addMode, undo, redo);
    }
}
