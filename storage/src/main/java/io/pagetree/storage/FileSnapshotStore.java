// file: src/main/java/io/pagetree/storage/FileSnapshotStore.java
package io.pagetree.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * JSON document store, one file per save.
 * <p>
 * Naming: {@code document-<millis>.json}. If a file for the current millisecond already
 * exists the next free millisecond is used, so names stay strictly increasing.
 * <p>
 * Atomicity:
 *   - We write to "document-<millis>.json.tmp" first,
 *   - then move to "document-<millis>.json" using ATOMIC_MOVE.
 */
public final class FileSnapshotStore implements SnapshotStore {

    private static final Logger log = Logger.getLogger(FileSnapshotStore.class.getName());

    private static final String PREFIX = "document-";
    private static final String SUFFIX = ".json";

    private final Path dir;
    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public FileSnapshotStore(Path dir) {
        this.dir = dir;
        try { Files.createDirectories(dir); } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    @Override
    public synchronized String write(StoredDocument document) {
        long millis = Math.max(document.savedAtMillis(), 0L);
        Path dst = dir.resolve(PREFIX + millis + SUFFIX);
        while (Files.exists(dst)) {
            millis++;
            dst = dir.resolve(PREFIX + millis + SUFFIX);
        }
        Path tmp = dir.resolve(dst.getFileName() + ".tmp");

        try {
            mapper.writeValue(tmp.toFile(), document);
            Files.move(tmp, dst, ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write snapshot " + dst, e);
        }
        String name = dst.getFileName().toString();
        log.fine(() -> "Wrote snapshot " + name + " (" + document.pages().size() + " pages)");
        return name;
    }

    @Override
    public synchronized Optional<StoredDocument> loadLatest() {
        Path latest;
        try (Stream<Path> files = Files.list(dir)) {
            latest = files
                    .filter(p -> millisOf(p) >= 0)
                    .max(Comparator.comparingLong(FileSnapshotStore::millisOf))
                    .orElse(null);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + dir, e);
        }
        if (latest == null) return Optional.empty();

        try {
            return Optional.of(mapper.readValue(latest.toFile(), StoredDocument.class));
        } catch (JsonProcessingException e) {
            throw new SnapshotCorruptedException("Snapshot " + latest.getFileName() + " is not a valid document", e);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + latest, e);
        }
    }

    /** Millisecond stamp of a finished snapshot file, or -1 for anything else. */
    private static long millisOf(Path p) {
        String name = p.getFileName().toString();
        if (!name.startsWith(PREFIX) || !name.endsWith(SUFFIX)) return -1;
        try {
            return Long.parseLong(name.substring(PREFIX.length(), name.length() - SUFFIX.length()));
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
