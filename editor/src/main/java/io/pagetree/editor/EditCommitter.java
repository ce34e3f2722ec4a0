// file: editor/src/main/java/io/pagetree/editor/EditCommitter.java
package io.pagetree.editor;

import io.pagetree.core.NodeId;
import io.pagetree.core.Page;
import io.pagetree.core.PageTree;
import io.pagetree.core.PageTrees;
import io.pagetree.core.TreeNode;
import io.pagetree.core.TreeValidator;
import io.pagetree.core.linear.Linearizer;
import io.pagetree.storage.HistorySink;
import io.pagetree.storage.Snapshot;
import io.pagetree.storage.SnapshotTask;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns a proposed (tree, pages) pair into the next {@link DocumentState}.
 * <p>
 * Pipeline:
 *  1. validate the tree against the page count; invalid proposals are dropped;
 *  2. normalize pages into tree pre-order (references rewritten);
 *  3. snapshot before/after with the tree embedded in page 0;
 *  4. register the pair with the {@link HistorySink};
 *  5. return the state for the caller to publish.
 * <p>
 * The committer holds no document state of its own, so the session and the drag
 * controller can share one instance.
 */
public final class EditCommitter {

    private final HistorySink history;

    public EditCommitter(HistorySink history) {
        this.history = Objects.requireNonNull(history, "history");
    }

    /**
     * @param operation    name used in logs
     * @param before       state the edit starts from (the revert half of the history entry)
     * @param tree         proposed tree
     * @param pages        proposed pages, indexed as the proposed tree expects
     * @param activeNodeId node to focus afterwards; when it is missing or virtual the
     *                     tree's default node is used
     * @param mergeKey     history merge key, or null
     * @return the committed state, or empty when the proposal was invalid
     */
    public Optional<DocumentState> commit(
            String operation,
            DocumentState before,
            PageTree tree,
            List<Page> pages,
            NodeId activeNodeId,
            String mergeKey
    ) {
        long start = System.nanoTime();
        var validation = TreeValidator.validate(tree, pages.size());
        if (!validation.valid()) {
            EditLogger.logEdit(operation, EditLogger.Outcome.REJECTED, EditLogger.micros(start),
                    String.join("; ", validation.errors()), null);
            return Optional.empty();
        }

        var normalized = Linearizer.normalize(tree, pages);
        PageTree finalTree = normalized.tree();
        List<Page> finalPages = normalized.pages();

        NodeId active = activeNodeId;
        TreeNode node = finalTree.findNode(active).filter(n -> !n.isVirtual()).orElse(null);
        if (node == null) {
            active = PageTrees.getDefaultActiveNodeId(finalTree);
            node = finalTree.findNode(active).orElse(null);
        }
        int index = node != null
                ? node.pageIndex()
                : clamp(normalized.remap(before.currentIndex()), finalPages.size());

        Snapshot prev = Snapshot.capture(before.tree(), before.pages(), before.currentIndex());
        Snapshot next = Snapshot.capture(finalTree, finalPages, index);
        int undoCount = history.register(SnapshotTask.of(prev, next), mergeKey);

        DocumentState after = new DocumentState(
                finalPages,
                index,
                finalTree,
                active,
                before.treeEnabled(),
                before.addMode(),
                undoCount,
                0);
        EditLogger.logEdit(operation, EditLogger.Outcome.COMMITTED, EditLogger.micros(start),
                finalPages.size() + " pages" + (normalized.changed() ? ", reordered" : ""), null);
        return Optional.of(after);
    }

    private static int clamp(int index, int size) {
        if (size == 0) return 0;
        return Math.max(0, Math.min(index, size - 1));
    }
}
