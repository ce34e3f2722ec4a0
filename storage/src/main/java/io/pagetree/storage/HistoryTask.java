package io.pagetree.storage;

import io.pagetree.core.Page;

import java.util.List;

/**
 * One undoable edit.
 * <p>
 * {@code replay} and {@code revert} receive the pages currently shown and return the
 * pages (and index) to show instead. A {@code fixed} task never absorbs later edits.
 */
public interface HistoryTask {

    PageState replay(List<Page> currentPages);

    PageState revert(List<Page> currentPages);

    boolean fixed();

    /** Same task, sealed against merging. */
    HistoryTask fix();
}
