package io.pagetree.storage;

import io.pagetree.core.Page;

import java.util.List;

/** Pages plus the page the editor should show. What a history step hands back. */
public record PageState(List<Page> pages, int index) {
    public PageState {
        pages = List.copyOf(pages);
    }
}
