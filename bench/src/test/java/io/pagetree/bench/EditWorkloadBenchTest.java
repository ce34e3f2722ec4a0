package io.pagetree.bench;

import io.pagetree.core.FieldState;
import io.pagetree.core.NodeId;
import io.pagetree.core.Page;
import io.pagetree.editor.DocumentSession;
import io.pagetree.editor.EditorConfig;
import io.pagetree.storage.FileSnapshotStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EditWorkloadBenchTest {

    @TempDir Path dir;

    @Test
    void percentile_interpolates_between_samples() {
        assertEquals(2.0, EditWorkloadBench.percentile(List.of(1.0, 2.0, 3.0), 0.5));
        assertEquals(1.5, EditWorkloadBench.percentile(List.of(1.0, 2.0), 0.5));
        assertTrue(Double.isNaN(EditWorkloadBench.percentile(List.of(), 0.5)));
    }

    @Test
    void edited_session_passes_the_tree_check() {
        var session = new DocumentSession(EditorConfig.defaults(), new FileSnapshotStore(dir.resolve("saves")), Runnable::run);
        session.loadPages(List.of(
                Page.of(0, new FieldState("a"), "first"),
                Page.of(1, new FieldState("b"), "second")));
        session.toggleTreeMode();
        session.addBranch(new NodeId("n0"));
        session.save();

        assertTrue(EditWorkloadBench.checkTree(session, "branch"));
    }

    @Test
    void scratch_directory_is_removed_with_its_contents() throws Exception {
        Path scratch = dir.resolve("bench");
        Files.createDirectories(scratch.resolve("worker-0"));
        Files.writeString(scratch.resolve("worker-0").resolve("document-1.json"), "{}");

        EditWorkloadBench.deleteRecursively(scratch);
        assertFalse(Files.exists(scratch));
    }
}
