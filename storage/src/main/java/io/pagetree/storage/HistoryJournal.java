// file: src/main/java/io/pagetree/storage/HistoryJournal.java
package io.pagetree.storage;

import io.pagetree.core.Page;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Bounded undo/redo stacks of {@link HistoryTask}s.
 * <p>
 * Rules:
 *  - register pushes onto undo and clears redo;
 *  - a task registered with the same merge key as the top entry, while the top is not
 *    fixed, replaces it with a {@link MergedTask} (one undo step for both);
 *  - past {@code capacity} the oldest undo entry is dropped;
 *  - undo/redo move one entry between the stacks. If the task fails to produce pages the
 *    entry stays where it was and the exception propagates.
 * <p>
 * All methods are synchronized; the journal may be shared by a session and its drag
 * controller.
 */
public final class HistoryJournal implements HistorySink {

    private static final Logger log = Logger.getLogger(HistoryJournal.class.getName());

    private record Entry(HistoryTask task, String key) {}

    private final int capacity;
    private final Deque<Entry> undo = new ArrayDeque<>();
    private final Deque<Entry> redo = new ArrayDeque<>();

    public HistoryJournal(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        this.capacity = capacity;
    }

    @Override
    public synchronized int register(HistoryTask task, String mergeKey) {
        Objects.requireNonNull(task, "task");
        Entry top = undo.peekLast();
        if (mergeKey != null && top != null && mergeKey.equals(top.key()) && !top.task().fixed()) {
            undo.pollLast();
            undo.addLast(new Entry(new MergedTask(top.task(), task, false), mergeKey));
        } else {
            undo.addLast(new Entry(task, mergeKey));
            while (undo.size() > capacity) {
                undo.pollFirst();
            }
        }
        redo.clear();
        return undo.size();
    }

    /** Step back. Empty when there is nothing to undo. */
    public synchronized Optional<HistoryStep> undo(List<Page> currentPages) {
        Entry e = undo.pollLast();
        if (e == null) {
            log.fine("undo: history is empty");
            return Optional.empty();
        }
        PageState state;
        try {
            state = e.task().revert(currentPages);
        } catch (RuntimeException ex) {
            undo.addLast(e);
            throw ex;
        }
        redo.addLast(e);
        return Optional.of(new HistoryStep(state, undo.size(), redo.size()));
    }

    /** Step forward. Empty when there is nothing to redo. */
    public synchronized Optional<HistoryStep> redo(List<Page> currentPages) {
        Entry e = redo.pollLast();
        if (e == null) {
            log.fine("redo: nothing to redo");
            return Optional.empty();
        }
        PageState state;
        try {
            state = e.task().replay(currentPages);
        } catch (RuntimeException ex) {
            redo.addLast(e);
            throw ex;
        }
        undo.addLast(e);
        return Optional.of(new HistoryStep(state, undo.size(), redo.size()));
    }

    /** Seal the latest entry so the next edit with the same key starts a new step. */
    public synchronized boolean fixLatest() {
        Entry top = undo.pollLast();
        if (top == null) return false;
        undo.addLast(new Entry(top.task().fix(), top.key()));
        return true;
    }

    public synchronized int undoCount() { return undo.size(); }

    public synchronized int redoCount() { return redo.size(); }
}
