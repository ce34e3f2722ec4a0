package io.pagetree.storage;

import io.pagetree.core.Page;

import java.util.List;
import java.util.Objects;

/** Two coalesced edits: reverting undoes both, replaying redoes both. */
public record MergedTask(HistoryTask first, HistoryTask last, boolean fixed) implements HistoryTask {

    public MergedTask {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(last, "last");
    }

    @Override
    public PageState replay(List<Page> currentPages) {
        return last.replay(currentPages);
    }

    @Override
    public PageState revert(List<Page> currentPages) {
        return first.revert(currentPages);
    }

    @Override
    public HistoryTask fix() {
        return fixed ? this : new MergedTask(first, last, true);
    }
}
