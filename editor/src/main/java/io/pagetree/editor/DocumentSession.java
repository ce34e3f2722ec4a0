// file: editor/src/main/java/io/pagetree/editor/DocumentSession.java
package io.pagetree.editor;

import io.pagetree.core.FieldState;
import io.pagetree.core.NodeId;
import io.pagetree.core.Page;
import io.pagetree.core.PageComment;
import io.pagetree.core.PageField;
import io.pagetree.core.PageTree;
import io.pagetree.core.PageTrees;
import io.pagetree.core.Pages;
import io.pagetree.core.TreeMutations;
import io.pagetree.core.TreeNode;
import io.pagetree.core.TreeValidator;
import io.pagetree.core.linear.PageReorderer;
import io.pagetree.editor.drag.ButtonType;
import io.pagetree.editor.drag.DragController;
import io.pagetree.editor.drag.DragMode;
import io.pagetree.editor.drag.DragState;
import io.pagetree.editor.drag.DropOutcome;
import io.pagetree.storage.EmbeddedTreeCodec;
import io.pagetree.storage.HistoryJournal;
import io.pagetree.storage.HistoryStep;
import io.pagetree.storage.HistoryTask;
import io.pagetree.storage.PrimitivePages;
import io.pagetree.storage.SnapshotCorruptedException;
import io.pagetree.storage.SnapshotStore;
import io.pagetree.storage.StoredDocument;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One open document: pages, tree, history and drag state.
 * <p>
 * Responsibilities:
 *  - Expose the editor's user-intent operations (add/insert/remove pages, comments,
 *    reordering, drag-and-drop, undo/redo, load/save).
 *  - Route every structural edit through the {@link EditCommitter} so the tree, the page
 *    order and the history stay consistent.
 * <p>
 * Concurrency:
 *  - Operations are synchronized; readers see the latest published state through a
 *    volatile field.
 *  - Restoring from the {@link SnapshotStore} runs on the I/O executor. Each request takes
 *    a generation number; a result is applied only if nothing was published since the
 *    request (last write wins).
 * <p>
 * Operations that do not apply return false (or the unchanged state) and leave the
 * document untouched.
 */
public final class DocumentSession {

    private static final Logger log = Logger.getLogger(DocumentSession.class.getName());

    private final EditorConfig config;
    private final HistoryJournal journal;
    private final EditCommitter committer;
    private final DragController drags;
    private final SnapshotStore store;
    private final Executor ioExecutor;
    private final AtomicLong generation = new AtomicLong();

    private volatile DocumentState state;
    private volatile DragState drag;

    public DocumentSession(EditorConfig config, SnapshotStore store, Executor ioExecutor) {
        this.config = Objects.requireNonNull(config, "config");
        this.store = Objects.requireNonNull(store, "store");
        this.ioExecutor = Objects.requireNonNull(ioExecutor, "ioExecutor");
        this.journal = new HistoryJournal(config.historyCapacity());
        this.committer = new EditCommitter(journal);
        this.drags = new DragController(committer, config.buttonDropMovesSubtree());
        this.state = DocumentState.initial(config);
        this.drag = DragState.idle(config.defaultDragMode());
    }

    public DocumentSession(EditorConfig config, SnapshotStore store) {
        this(config, store, ForkJoinPool.commonPool());
    }

    public DocumentState state() { return state; }

    public DragState dragState() { return drag; }

    public EditorConfig config() { return config; }

    // ---------------------------------------------------------------- loading & history

    /**
     * Replace the document with {@code pages}. A tree embedded in page 0 is picked up (and
     * turns the tree view on); otherwise a linear tree is built. The replacement is one
     * undoable step.
     */
    public synchronized DocumentState loadPages(List<Page> pages) {
        if (pages.isEmpty()) throw new IllegalArgumentException("a document needs at least one page");
        DocumentState before = state;
        var extraction = EmbeddedTreeCodec.extractTreeFromPages(pages);
        List<Page> cleaned = reindexed(extraction.pages());
        PageTree embedded = usableTree(extraction.tree(), cleaned.size());
        PageTree tree = embedded != null ? embedded : PageTrees.createTreeFromPages(cleaned.size());
        boolean enabled = before.treeEnabled() || embedded != null;

        Optional<DocumentState> next = committer.commit("loadPages", before, tree, cleaned,
                PageTrees.getDefaultActiveNodeId(tree), null);
        if (next.isEmpty()) return before;
        DocumentState loaded = next.get().withTreeEnabled(enabled);
        drag = drags.cancel(drag);
        publish(loaded);
        return loaded;
    }

    /**
     * Show pages produced by a history step. The tree comes from page 0 when present;
     * otherwise the current tree is kept if it still fits the pages, and a linear tree is
     * built if it does not. Does not register history.
     */
    public synchronized DocumentState loadPagesViaHistory(List<Page> pages, int index, int undoCount, int redoCount) {
        DocumentState before = state;
        var extraction = EmbeddedTreeCodec.extractTreeFromPages(pages);
        List<Page> cleaned = extraction.pages();
        if (cleaned.isEmpty()) {
            log.warning("History step produced no pages; keeping the current document");
            return before;
        }
        PageTree tree = usableTree(extraction.tree(), cleaned.size());
        if (tree == null) {
            boolean currentFits = !before.tree().isEmpty()
                    && TreeValidator.validate(before.tree(), cleaned.size()).valid();
            tree = currentFits ? before.tree() : PageTrees.createTreeFromPages(cleaned.size());
        }

        int current = Math.max(0, Math.min(index, cleaned.size() - 1));
        NodeId active = tree.findNodeByPageIndex(current)
                .map(TreeNode::id)
                .orElse(PageTrees.getDefaultActiveNodeId(tree));
        DocumentState next = new DocumentState(cleaned, current, tree, active,
                before.treeEnabled(), before.addMode(), undoCount, redoCount);
        drag = drags.cancel(drag);
        publish(next);
        return next;
    }

    public synchronized void setHistoryCount(int undoCount, int redoCount) {
        publish(state.withHistoryCount(undoCount, redoCount));
    }

    /** Record an externally built history task and refresh the counters. */
    public synchronized int registerHistoryTask(HistoryTask task, String mergeKey) {
        int undoCount = journal.register(task, mergeKey);
        setHistoryCount(undoCount, 0);
        return undoCount;
    }

    public synchronized boolean undo() {
        return step("undo", true);
    }

    public synchronized boolean redo() {
        return step("redo", false);
    }

    /** Seal the latest history entry against merging. */
    public synchronized boolean fixHistory() {
        return journal.fixLatest();
    }

    private boolean step(String operation, boolean backwards) {
        long start = System.nanoTime();
        Optional<HistoryStep> step;
        try {
            step = backwards ? journal.undo(state.pages()) : journal.redo(state.pages());
        } catch (SnapshotCorruptedException e) {
            log.log(Level.SEVERE, operation + " failed: history snapshot is corrupted", e);
            EditLogger.logEdit(operation, EditLogger.Outcome.FAILED, EditLogger.micros(start), null, e);
            return false;
        }
        if (step.isEmpty()) {
            EditLogger.logEdit(operation, EditLogger.Outcome.NO_OP, EditLogger.micros(start), "history is empty", null);
            return false;
        }
        HistoryStep s = step.get();
        loadPagesViaHistory(s.state().pages(), s.state().index(), s.undoCount(), s.redoCount());
        EditLogger.logEdit(operation, EditLogger.Outcome.COMMITTED, EditLogger.micros(start),
                s.undoCount() + " undo / " + s.redoCount() + " redo", null);
        return true;
    }

    // ---------------------------------------------------------------- view state

    /**
     * Switch the tree view. Turning it on keeps the current tree when it still matches the
     * pages, and builds a linear one otherwise.
     *
     * @return whether the tree view is on afterwards
     */
    public synchronized boolean toggleTreeMode() {
        DocumentState s = state;
        if (s.treeEnabled()) {
            drag = drags.cancel(drag);
            publish(s.withTreeEnabled(false));
            return false;
        }
        PageTree tree = s.tree();
        if (tree.isEmpty() || !TreeValidator.validate(tree, s.pages().size()).valid()) {
            tree = PageTrees.createTreeFromPages(s.pages().size());
        }
        NodeId active = tree.findNodeByPageIndex(s.currentIndex())
                .map(TreeNode::id)
                .orElse(PageTrees.getDefaultActiveNodeId(tree));
        publish(s.withTree(tree, active, s.currentIndex()).withTreeEnabled(true));
        return true;
    }

    public synchronized void setAddMode(AddMode mode) {
        publish(state.withAddMode(Objects.requireNonNull(mode, "mode")));
    }

    /** Focus a node (and its page). Virtual and unknown nodes are ignored. */
    public synchronized boolean selectNode(NodeId id) {
        DocumentState s = state;
        TreeNode node = s.tree().findNode(id).orElse(null);
        if (node == null || node.isVirtual() || node.pageIndex() >= s.pages().size()) {
            log.fine(() -> "selectNode ignored: " + id);
            return false;
        }
        publish(s.withActive(id, node.pageIndex()));
        return true;
    }

    /** Show page {@code index}; the active node follows when the page has one. */
    public synchronized boolean openPage(int index) {
        DocumentState s = state;
        if (index < 0 || index >= s.pages().size()) return false;
        NodeId active = s.tree().findNodeByPageIndex(index).map(TreeNode::id).orElse(s.activeNodeId());
        publish(s.withActive(active, index));
        return true;
    }

    // ---------------------------------------------------------------- structural edits

    /** New page as the last child of {@code parentId} (or of the current node when null). */
    public synchronized boolean addBranch(NodeId parentId) {
        return addPage(AddMode.BRANCH, parentId);
    }

    /** New page right after {@code parentId} (or the current node when null). */
    public synchronized boolean insertAfter(NodeId parentId) {
        return addPage(AddMode.INSERT, parentId);
    }

    /** New page after the current node, as the current add mode says. */
    public synchronized boolean addPage() {
        return addPage(state.addMode(), null);
    }

    private boolean addPage(AddMode mode, NodeId parentOverride) {
        String operation = mode == AddMode.BRANCH ? "addBranch" : "insertAfter";
        DocumentState s = state;
        if (!s.treeEnabled()) {
            EditLogger.logEdit(operation, EditLogger.Outcome.NO_OP, -1, "tree view is off", null);
            return false;
        }
        TreeNode parent = (parentOverride != null
                ? s.tree().findNode(parentOverride)
                : currentNode(s)).orElse(null);
        if (parent == null || parent.isVirtual()) {
            EditLogger.logEdit(operation, EditLogger.Outcome.NO_OP, -1, "no usable parent node", null);
            return false;
        }

        int newIndex = s.pages().size();
        var added = mode == AddMode.BRANCH
                ? TreeMutations.addBranchNode(s.tree(), parent.id(), newIndex)
                : TreeMutations.insertNode(s.tree(), parent.id(), newIndex);
        if (!added.added()) return false;

        var pages = new ArrayList<Page>(s.pages());
        pages.add(derivePage(s.pages(), parent.pageIndex(), newIndex));
        return commit(operation, s, added.tree(), pages, added.newNodeId(), null);
    }

    /**
     * Remove the current node. Its page stays in the list (it moves behind the tree's pages);
     * focus goes to the parent.
     */
    public synchronized boolean removeCurrentNode(boolean removeDescendants) {
        DocumentState s = state;
        if (!s.treeEnabled()) return false;
        TreeNode node = currentNode(s).orElse(null);
        if (node == null || node.isVirtual()) return false;

        PageTree tree = TreeMutations.removeNode(s.tree(), node.id(), removeDescendants);
        if (tree == s.tree()) {
            EditLogger.logEdit("removeNode", EditLogger.Outcome.NO_OP, -1, node.id() + " cannot be removed", null);
            return false;
        }
        NodeId parent = node.parentId();
        NodeId focus = parent != null && !tree.isVirtualNode(parent) && tree.contains(parent)
                ? parent
                : PageTrees.getDefaultActiveNodeId(tree);
        return commit("removeNode", s, tree, s.pages(), focus, null);
    }

    /** Set a page's comment. Consecutive edits of the same page merge into one undo step. */
    public synchronized boolean updateComment(int pageIndex, String text) {
        DocumentState s = state;
        if (pageIndex < 0 || pageIndex >= s.pages().size()) return false;
        Objects.requireNonNull(text, "text");
        var pages = new ArrayList<Page>(s.pages());
        pages.set(pageIndex, pages.get(pageIndex).withComment(PageComment.text(text)));
        return commit("updateComment", s, s.tree(), pages, s.activeNodeId(), "comment:" + pageIndex);
    }

    /**
     * List-view reorder: move page {@code from} before slot {@code toSlot}. Only available
     * with the tree view off; the tree is rebuilt as a chain over the new order.
     */
    public synchronized boolean movePage(int from, int toSlot) {
        DocumentState s = state;
        int n = s.pages().size();
        if (s.treeEnabled()) {
            EditLogger.logEdit("movePage", EditLogger.Outcome.NO_OP, -1, "reordering is disabled in the tree view", null);
            return false;
        }
        if (from < 0 || from >= n || toSlot < 0 || toSlot > n || toSlot == from || toSlot == from + 1) {
            EditLogger.logEdit("movePage", EditLogger.Outcome.NO_OP, -1, from + " -> slot " + toSlot, null);
            return false;
        }
        var reordering = PageReorderer.movePage(s.pages(), from, toSlot);
        PageTree linear = PageTrees.createTreeFromPages(n);
        int current = reordering.indexMap().get(s.currentIndex());
        NodeId active = linear.findNodeByPageIndex(current).map(TreeNode::id).orElse(null);
        return commit("movePage", s, linear, reordering.pages(), active, null);
    }

    /**
     * Append another document behind this one. Both trees end up as independent sequences
     * under a shared virtual root.
     */
    public synchronized boolean appendPages(List<Page> incoming) {
        if (incoming.isEmpty()) return false;
        DocumentState s = state;
        var extraction = EmbeddedTreeCodec.extractTreeFromPages(incoming);
        List<Page> cleaned = reindexed(extraction.pages());
        PageTree incomingTree = usableTree(extraction.tree(), cleaned.size());
        if (incomingTree == null) incomingTree = PageTrees.createTreeFromPages(cleaned.size());

        int offset = s.pages().size();
        var pages = new ArrayList<Page>(s.pages());
        pages.addAll(Pages.shift(cleaned, offset));
        PageTree merged = PageTrees.mergeIndependentTrees(s.tree(), incomingTree, offset);
        return commit("appendPages", s, merged, pages, s.activeNodeId(), null);
    }

    // ---------------------------------------------------------------- drag and drop

    public synchronized boolean startDrag(NodeId sourceId) {
        if (!state.treeEnabled()) return false;
        drag = drags.start(drag, state.tree(), sourceId);
        return drag.isDragging();
    }

    public synchronized DragState hoverNode(NodeId targetId) {
        drag = drags.hoverNode(drag, state.tree(), targetId);
        return drag;
    }

    public synchronized DragState hoverButton(NodeId parentId, ButtonType type) {
        drag = drags.hoverButton(drag, state.tree(), parentId, type);
        return drag;
    }

    public synchronized DragState leaveButton() {
        drag = drags.leaveButton(drag);
        return drag;
    }

    public synchronized DragState hoverSlot(Integer slot) {
        drag = drags.hoverSlot(drag, slot);
        return drag;
    }

    public synchronized void setDragMode(DragMode mode) {
        drag = drags.setMode(drag, mode);
    }

    public synchronized void cancelDrag() {
        drag = drags.cancel(drag);
    }

    /** Finish the drag. True when the tree changed. */
    public synchronized boolean drop() {
        DropOutcome outcome = drags.commit(drag, state);
        drag = outcome.dragState();
        if (!outcome.committed()) return false;
        publish(outcome.document());
        return true;
    }

    // ---------------------------------------------------------------- persistence

    /** Write the current document to the store (tree embedded when the tree view is on). */
    public String save() {
        return store.write(toStored(state));
    }

    /** {@link #save()} on the I/O executor. Failures are logged and surface through the future. */
    public CompletableFuture<String> saveAsync() {
        StoredDocument doc = toStored(state);
        return CompletableFuture.supplyAsync(() -> store.write(doc), ioExecutor)
                .whenComplete((name, err) -> {
                    if (err != null) log.log(Level.WARNING, "Saving the document failed", err);
                });
    }

    /**
     * Load the newest saved document on the I/O executor. Completes with true when it was
     * applied, false when there was nothing to load or a later operation superseded it.
     * A corrupted snapshot completes the future exceptionally and leaves the document as is.
     */
    public CompletableFuture<Boolean> restoreLatestAsync() {
        long ticket = generation.incrementAndGet();
        return CompletableFuture.supplyAsync(store::loadLatest, ioExecutor)
                .thenApply(doc -> applyRestored(ticket, doc))
                .whenComplete((applied, err) -> {
                    if (err != null) log.log(Level.SEVERE, "Restore failed; keeping the current document", err);
                });
    }

    private synchronized boolean applyRestored(long ticket, Optional<StoredDocument> doc) {
        if (generation.get() != ticket) {
            log.fine(() -> "Restore #" + ticket + " superseded by a later operation");
            return false;
        }
        if (doc.isEmpty()) return false;
        List<Page> pages = PrimitivePages.toPages(doc.get().pages());
        if (pages.isEmpty()) return false;
        loadPages(pages);
        openPage(doc.get().currentIndex());
        return true;
    }

    private StoredDocument toStored(DocumentState s) {
        boolean embed = s.treeEnabled() && config.embedTree();
        List<Page> pages = EmbeddedTreeCodec.embedTreeInPages(s.pages(), s.tree(), embed);
        return new StoredDocument(PrimitivePages.toPrimitives(pages), s.currentIndex(), System.currentTimeMillis());
    }

    // ---------------------------------------------------------------- helpers

    private boolean commit(String operation, DocumentState before, PageTree tree, List<Page> pages,
                           NodeId active, String mergeKey) {
        Optional<DocumentState> next = committer.commit(operation, before, tree, pages, active, mergeKey);
        next.ifPresent(this::publish);
        return next.isPresent();
    }

    private void publish(DocumentState next) {
        generation.incrementAndGet();
        state = next;
    }

    private static Optional<TreeNode> currentNode(DocumentState s) {
        Optional<TreeNode> active = s.activeNode().filter(n -> !n.isVirtual());
        return active.isPresent() ? active : s.tree().findNodeByPageIndex(s.currentIndex());
    }

    /**
     * Page created from {@code sourceIndex}: a copy of its resolved board, a reference to the
     * page holding its comment text, and its flags with quiz mode off.
     */
    private static Page derivePage(List<Page> pages, int sourceIndex, int newIndex) {
        Pages view = new Pages(pages);
        FieldState field = view.resolveField(sourceIndex).orElse(FieldState.empty()).copy();
        int commentSource = view.commentSourceIndex(sourceIndex);
        PageComment comment = commentSource >= 0 ? PageComment.ref(commentSource) : PageComment.text("");
        return new Page(newIndex, PageField.value(field), comment, pages.get(sourceIndex).flags().withQuiz(false));
    }

    /** Tree fit for {@code pageCount} pages (virtual root added if needed), or null. */
    private static PageTree usableTree(PageTree tree, int pageCount) {
        if (tree == null) return null;
        PageTree rooted = PageTrees.ensureVirtualRoot(tree);
        var validation = TreeValidator.validate(rooted, pageCount);
        if (!validation.valid()) {
            log.warning("Ignoring embedded tree: " + String.join("; ", validation.errors()));
            return null;
        }
        return rooted;
    }

    /** Pages renumbered by position (loaded lists may carry stale indices). */
    private static List<Page> reindexed(List<Page> pages) {
        var out = new ArrayList<Page>(pages.size());
        for (int i = 0; i < pages.size(); i++) {
            Page p = pages.get(i);
            out.add(p.index() == i ? p : p.withIndex(i));
        }
        return out;
    }
}
