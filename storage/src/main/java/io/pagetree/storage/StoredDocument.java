package io.pagetree.storage;

import java.util.List;

/** A saved document: primitive pages (tree embedded in page 0) and the page that was open. */
public record StoredDocument(List<PrimitivePage> pages, int currentIndex, long savedAtMillis) {
    public StoredDocument {
        pages = pages == null ? List.of() : List.copyOf(pages);
    }
}
