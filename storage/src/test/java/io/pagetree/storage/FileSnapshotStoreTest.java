package io.pagetree.storage;

import io.pagetree.core.FieldState;
import io.pagetree.core.Page;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileSnapshotStoreTest {

    @TempDir Path dir;

    private static StoredDocument doc(String comment, long at) {
        var pages = List.of(Page.of(0, new FieldState("f"), comment));
        return new StoredDocument(PrimitivePages.toPrimitives(pages), 0, at);
    }

    @Test
    void newest_document_wins_after_restart() {
        var store = new FileSnapshotStore(dir);
        store.write(doc("old", 1000));
        store.write(doc("new", 2000));

        var reopened = new FileSnapshotStore(dir);
        var latest = reopened.loadLatest().orElseThrow();
        assertEquals("new", latest.pages().get(0).comment());
        assertEquals(2000, latest.savedAtMillis());
    }

    @Test
    void same_millisecond_saves_get_distinct_names() throws Exception {
        var store = new FileSnapshotStore(dir);
        String first = store.write(doc("a", 5000));
        String second = store.write(doc("b", 5000));
        assertNotEquals(first, second);
        assertEquals("b", store.loadLatest().orElseThrow().pages().get(0).comment());
        try (var files = Files.list(dir)) {
            assertTrue(files.noneMatch(p -> p.toString().endsWith(".tmp")));
        }
    }

    @Test
    void empty_directory_has_nothing_to_restore() {
        assertTrue(new FileSnapshotStore(dir).loadLatest().isEmpty());
    }

    @Test
    void unreadable_newest_file_is_reported_as_corrupted() throws Exception {
        var store = new FileSnapshotStore(dir);
        store.write(doc("ok", 1000));
        Files.writeString(dir.resolve("document-9999.json"), "{not json");
        Files.writeString(dir.resolve("notes.txt"), "ignored");
        assertThrows(SnapshotCorruptedException.class, store::loadLatest);
    }
}
