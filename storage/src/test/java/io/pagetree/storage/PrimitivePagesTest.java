package io.pagetree.storage;

import io.pagetree.core.FieldState;
import io.pagetree.core.Page;
import io.pagetree.core.PageComment;
import io.pagetree.core.PageField;
import io.pagetree.core.PageFlags;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PrimitivePagesTest {

    @Test
    void values_and_refs_survive_conversion() {
        var pages = List.of(
                Page.of(0, new FieldState("f0"), "hello"),
                new Page(1, PageField.ref(0), PageComment.ref(0), PageFlags.defaults().withQuiz(true)));
        assertEquals(pages, PrimitivePages.toPages(PrimitivePages.toPrimitives(pages)));
    }

    @Test
    void damaged_records_are_reported() {
        var flags = PageFlags.defaults();
        assertThrows(SnapshotCorruptedException.class,
                () -> PrimitivePages.toPage(new PrimitivePage(0, null, null, "c", null, flags), 0));
        assertThrows(SnapshotCorruptedException.class,
                () -> PrimitivePages.toPage(new PrimitivePage(1, "f", null, null, 1, flags), 1));
        assertThrows(SnapshotCorruptedException.class,
                () -> PrimitivePages.toPage(new PrimitivePage(2, "f", null, "c", null, flags), 0));
        assertThrows(SnapshotCorruptedException.class,
                () -> PrimitivePages.toPage(new PrimitivePage(0, "f", null, "c", null, null), 0));
    }
}
