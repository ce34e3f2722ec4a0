package io.pagetree.storage;

import java.util.Optional;

/**
 * Durable home for saved documents.
 * <p>
 * Only the newest document matters on restore; older ones are kept for manual recovery.
 */
public interface SnapshotStore {

    /**
     * Persist {@code document}.
     *
     * @return identifier of the written snapshot (e.g., file name)
     */
    String write(StoredDocument document);

    /**
     * Newest saved document, if any.
     *
     * @throws SnapshotCorruptedException if the newest snapshot cannot be parsed
     */
    Optional<StoredDocument> loadLatest();
}
