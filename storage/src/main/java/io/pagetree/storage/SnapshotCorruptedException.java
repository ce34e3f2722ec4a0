package io.pagetree.storage;

import io.pagetree.core.PageTreeException;

/**
 * A persisted snapshot could not be turned back into pages.
 * Fatal for the load that hit it; the caller keeps its last good state.
 */
public class SnapshotCorruptedException extends PageTreeException {

    public SnapshotCorruptedException(String message) {
        super(message);
    }

    public SnapshotCorruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
