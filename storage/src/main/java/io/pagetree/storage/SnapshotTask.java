package io.pagetree.storage;

import io.pagetree.core.Page;

import java.util.List;
import java.util.Objects;

/** Whole-document before/after pair: revert restores {@code before}, replay restores {@code after}. */
public record SnapshotTask(Snapshot before, Snapshot after, boolean fixed) implements HistoryTask {

    public SnapshotTask {
        Objects.requireNonNull(before, "before");
        Objects.requireNonNull(after, "after");
    }

    public static SnapshotTask of(Snapshot before, Snapshot after) {
        return new SnapshotTask(before, after, false);
    }

    @Override
    public PageState replay(List<Page> currentPages) {
        return after.restore();
    }

    @Override
    public PageState revert(List<Page> currentPages) {
        return before.restore();
    }

    @Override
    public HistoryTask fix() {
        return fixed ? this : new SnapshotTask(before, after, true);
    }
}
