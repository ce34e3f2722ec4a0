package io.pagetree.storage;

/** Where committed edits are recorded. */
public interface HistorySink {

    /**
     * Record {@code task}, coalescing it with the latest entry when both carry the same
     * non-null {@code mergeKey}.
     *
     * @return number of undoable entries after registration
     */
    int register(HistoryTask task, String mergeKey);
}
